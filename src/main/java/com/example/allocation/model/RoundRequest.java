package com.example.allocation.model;

import java.util.List;

/** Inputs of one allocation round. A null policy or weight set falls back to the configured defaults. */
public record RoundRequest(
        List<CandidateProfile> candidates,
        List<SlotDefinition> slots,
        QuotaPolicy quotaPolicy,
        FactorWeights weights
) {
    public RoundRequest {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public static RoundRequest of(List<CandidateProfile> candidates, List<SlotDefinition> slots) {
        return new RoundRequest(candidates, slots, null, null);
    }
}
