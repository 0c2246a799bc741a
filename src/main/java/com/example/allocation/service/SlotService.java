package com.example.allocation.service;

import com.example.allocation.model.RawFeatures;
import com.example.allocation.model.SlotDefinition;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Registry of internship slots offered by host organizations. */
@Service
public class SlotService {

    private final Map<String, SlotDefinition> store = new ConcurrentHashMap<>();

    public SlotService() {
        List.of(
            new SlotDefinition("S001", "Infosys", "Backend Engineering Intern", 2, "software",
                new RawFeatures(1, List.of(0.9, 0.3, 0.2, 0.5), 1.0, 7.0,
                    List.of("software", "data"), "bengaluru", "karnataka"),
                Map.of()),
            new SlotDefinition("S002", "Tata Power", "Grid Analytics Intern", 2, "energy",
                new RawFeatures(1, List.of(0.4, 0.7, 0.6, 0.2), 0.5, 6.5,
                    List.of("energy", "data"), "mumbai", "maharashtra"),
                Map.of("rural", 1)),
            new SlotDefinition("S003", "AIIMS", "Health Policy Research Intern", 3, "healthcare",
                new RawFeatures(1, List.of(0.5, 0.8, 0.3, 0.3), 0.0, 8.0,
                    List.of("healthcare", "research", "public-policy"), "new delhi", "delhi"),
                Map.of())
        ).forEach(s -> store.put(s.id(), s));
    }

    public Optional<SlotDefinition> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    public List<SlotDefinition> findAll() {
        return store.values().stream()
                .sorted(Comparator.comparing(SlotDefinition::id))
                .collect(Collectors.toList());
    }

    public List<SlotDefinition> findByIds(Collection<String> ids) {
        return ids.stream().map(store::get).filter(Objects::nonNull)
                .sorted(Comparator.comparing(SlotDefinition::id))
                .collect(Collectors.toList());
    }

    public List<SlotDefinition> findBySector(String sector) {
        return store.values().stream()
                .filter(s -> sector.equalsIgnoreCase(s.sector()))
                .sorted(Comparator.comparing(SlotDefinition::id))
                .collect(Collectors.toList());
    }

    public SlotDefinition register(SlotDefinition slot) {
        store.put(slot.id(), slot);
        return slot;
    }

    public int totalCapacity() {
        return store.values().stream().mapToInt(SlotDefinition::capacity).sum();
    }

    public int totalCount() {
        return store.size();
    }
}
