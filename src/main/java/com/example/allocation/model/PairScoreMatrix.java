package com.example.allocation.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Scores for every eligible (candidate, slot) pair of one round, keyed candidate id then slot id. */
public record PairScoreMatrix(
        Map<String, Map<String, PairScore>> scores,
        List<PairFailure> failures
) {
    public static final PairScoreMatrix EMPTY = new PairScoreMatrix(Map.of(), List.of());

    public PairScoreMatrix {
        scores = Map.copyOf(scores);
        failures = List.copyOf(failures);
    }

    public Optional<PairScore> get(String candidateId, String slotId) {
        Map<String, PairScore> row = scores.get(candidateId);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(slotId));
    }

    public int size() {
        return scores.values().stream().mapToInt(Map::size).sum();
    }
}
