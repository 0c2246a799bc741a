package com.example.allocation.model;

import java.util.List;

public record FairnessReport(
        String roundId,
        DisparityScope scope,
        double populationRate,
        double tolerance,
        List<CategoryRate> rates,
        List<FairnessViolation> violations,
        boolean skipped
) {
    public FairnessReport {
        rates = List.copyOf(rates);
        violations = List.copyOf(violations);
    }

    public static FairnessReport skipped(String roundId, DisparityScope scope, double tolerance) {
        return new FairnessReport(roundId, scope, 0.0, tolerance, List.of(), List.of(), true);
    }

    public boolean passed() {
        return violations.isEmpty();
    }
}
