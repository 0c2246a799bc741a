package com.example.allocation.service.port;

import com.example.allocation.model.RoundResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryRoundRepository implements RoundRepository {

    private final Map<String, RoundResult> store = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    @Override
    public void save(RoundResult result) {
        if (store.put(result.roundId(), result) == null) {
            order.add(result.roundId());
        }
    }

    @Override
    public Optional<RoundResult> findById(String roundId) {
        return Optional.ofNullable(store.get(roundId));
    }

    @Override
    public List<RoundResult> findAll() {
        List<RoundResult> all = new ArrayList<>();
        order.forEach(id -> all.add(store.get(id)));
        Collections.reverse(all);
        return all;
    }

    @Override
    public Optional<RoundResult> latestCommitted() {
        return findAll().stream().filter(RoundResult::succeeded).findFirst();
    }
}
