package com.example.allocation.model;

import java.util.List;

public record PairScore(
        String candidateId,
        String slotId,
        double composite,
        List<FactorContribution> breakdown
) {
    public PairScore {
        breakdown = List.copyOf(breakdown);
    }

    public double contributionSum() {
        return breakdown.stream().mapToDouble(FactorContribution::contribution).sum();
    }

    public boolean degraded() {
        return breakdown.stream().anyMatch(FactorContribution::degraded);
    }
}
