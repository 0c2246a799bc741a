package com.example.allocation.model;

import java.time.Instant;
import java.util.List;

public record RoundResult(
        String roundId,
        RoundStatus status,
        String inputFingerprint,
        Allocation allocation,
        FairnessReport fairness,
        List<EntityExclusion> exclusions,
        RoundFailure failure,
        Instant completedAt
) {
    public RoundResult {
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
    }

    public static RoundResult succeeded(String roundId, String fingerprint, Allocation allocation,
                                        FairnessReport fairness, List<EntityExclusion> exclusions) {
        return new RoundResult(roundId, RoundStatus.SUCCEEDED, fingerprint, allocation, fairness,
                exclusions, null, Instant.now());
    }

    public static RoundResult failed(String roundId, RoundFailure failure, List<EntityExclusion> exclusions) {
        return new RoundResult(roundId, RoundStatus.FAILED, null, null, null, exclusions, failure, Instant.now());
    }

    public static RoundResult cancelled(String roundId) {
        return new RoundResult(roundId, RoundStatus.CANCELLED, null, null, null, List.of(),
                new RoundFailure("ROUND_CANCELLED", "Round " + roundId + " was cancelled before commit", List.of()),
                Instant.now());
    }

    public boolean succeeded() {
        return status == RoundStatus.SUCCEEDED;
    }
}
