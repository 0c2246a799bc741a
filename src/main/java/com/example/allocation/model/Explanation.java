package com.example.allocation.model;

import java.util.List;

public record Explanation(
        String roundId,
        String candidateId,
        String slotId,
        AssignmentPhase phase,
        double composite,
        List<FactorContribution> factors,
        List<String> narrative
) {
    public Explanation {
        factors = List.copyOf(factors);
        narrative = List.copyOf(narrative);
    }
}
