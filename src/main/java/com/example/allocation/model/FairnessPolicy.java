package com.example.allocation.model;

/**
 * Post-solve disparity settings. Categories with fewer than {@code minGroupSize} candidates are
 * reported but never flagged.
 */
public record FairnessPolicy(
        boolean enabled,
        double tolerance,
        DisparityScope scope,
        int minGroupSize
) {
    public FairnessPolicy {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Fairness tolerance must be >= 0");
        }
        scope = scope == null ? DisparityScope.AGGREGATE : scope;
    }
}
