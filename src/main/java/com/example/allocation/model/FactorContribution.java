package com.example.allocation.model;

public record FactorContribution(
        String factor,
        double weight,
        double subscore,
        double contribution,
        boolean degraded,
        String degradationReason
) {
    public static FactorContribution of(String factor, double weight, double subscore) {
        return new FactorContribution(factor, weight, subscore, weight * subscore, false, null);
    }

    public static FactorContribution degraded(String factor, double weight, String reason) {
        return new FactorContribution(factor, weight, 0.0, 0.0, true, reason);
    }
}
