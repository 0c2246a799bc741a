package com.example.allocation.service;

import com.example.allocation.model.CandidateProfile;
import com.example.allocation.model.Eligibility;
import com.example.allocation.model.RawFeatures;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Registry of candidates waiting for the next allocation round. */
@Service
public class CandidateService {

    private final Map<String, CandidateProfile> store = new ConcurrentHashMap<>();

    public CandidateService() {
        Instant base = Instant.now();
        List.of(
            new CandidateProfile("C001", "Aarav Mehta", base.minus(30, ChronoUnit.DAYS), "general",
                new RawFeatures(1, List.of(0.9, 0.2, 0.1, 0.4), 2.0, 8.6,
                    List.of("software", "data"), "bengaluru", "karnataka"),
                new Eligibility(Set.of(), Set.of("energy"))),
            new CandidateProfile("C002", "Diya Sharma", base.minus(28, ChronoUnit.DAYS), "women",
                new RawFeatures(1, List.of(0.7, 0.6, 0.2, 0.3), 1.0, 9.1,
                    List.of("data", "research"), "pune", "maharashtra"),
                Eligibility.ANY),
            new CandidateProfile("C003", "Kabir Singh", base.minus(25, ChronoUnit.DAYS), "rural",
                new RawFeatures(1, List.of(0.3, 0.8, 0.6, 0.1), 0.5, 7.4,
                    List.of("agriculture", "energy"), "nashik", "maharashtra"),
                new Eligibility(Set.of("maharashtra", "gujarat"), Set.of())),
            new CandidateProfile("C004", "Ishita Rao", base.minus(21, ChronoUnit.DAYS), "women",
                new RawFeatures(1, List.of(0.8, 0.3, 0.3, 0.6), 3.0, 8.0,
                    List.of("software", "finance"), "hyderabad", "telangana"),
                Eligibility.ANY),
            new CandidateProfile("C005", "Rohan Das", base.minus(18, ChronoUnit.DAYS), "general",
                new RawFeatures(1, List.of(0.2, 0.4, 0.9, 0.5), 1.5, 6.9,
                    List.of("manufacturing", "design"), "ahmedabad", "gujarat"),
                Eligibility.ANY),
            new CandidateProfile("C006", "Meera Nair", base.minus(12, ChronoUnit.DAYS), "rural",
                new RawFeatures(1, List.of(0.6, 0.5, 0.4, 0.2), null, 7.8,
                    List.of("public-policy", "healthcare"), null, "kerala"),
                Eligibility.ANY),
            new CandidateProfile("C007", "Vikram Joshi", base.minus(7, ChronoUnit.DAYS), "general",
                new RawFeatures(1, List.of(0.5, 0.5, 0.5, 0.5), 4.0, 8.3,
                    List.of("finance", "data"), "mumbai", "maharashtra"),
                new Eligibility(Set.of("maharashtra"), Set.of())),
            new CandidateProfile("C008", "Ananya Iyer", base.minus(3, ChronoUnit.DAYS), "women",
                new RawFeatures(1, List.of(0.4, 0.9, 0.3, 0.2), 0.0, 9.4,
                    List.of("healthcare", "research"), "chennai", "tamil nadu"),
                Eligibility.ANY)
        ).forEach(c -> store.put(c.id(), c));
    }

    public Optional<CandidateProfile> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    public List<CandidateProfile> findAll() {
        return store.values().stream()
                .sorted(Comparator.comparing(CandidateProfile::id))
                .collect(Collectors.toList());
    }

    public List<CandidateProfile> findByIds(Collection<String> ids) {
        return ids.stream().map(store::get).filter(Objects::nonNull)
                .sorted(Comparator.comparing(CandidateProfile::id))
                .collect(Collectors.toList());
    }

    public List<CandidateProfile> findByCategory(String category) {
        return store.values().stream()
                .filter(c -> category.equalsIgnoreCase(c.category()))
                .sorted(Comparator.comparing(CandidateProfile::id))
                .collect(Collectors.toList());
    }

    public CandidateProfile register(CandidateProfile candidate) {
        store.put(candidate.id(), candidate);
        return candidate;
    }

    public Map<String, Long> categoryCounts() {
        return store.values().stream()
                .collect(Collectors.groupingBy(c -> c.category() == null ? "unspecified" : c.category(),
                        TreeMap::new, Collectors.counting()));
    }

    public int totalCount() {
        return store.size();
    }
}
