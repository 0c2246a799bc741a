package com.example.allocation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered factor name to weight map. Weights are non-negative and sum to 1.0 (within 1e-6)
 * across the factors present; factors absent from the map are inactive.
 */
public record FactorWeights(Map<String, Double> weights) {

    public static final double TOLERANCE = 1e-6;

    public FactorWeights {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("At least one factor weight is required");
        }
        double sum = 0;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0 || e.getValue().isNaN()) {
                throw new IllegalArgumentException("Weight for factor '" + e.getKey() + "' must be >= 0");
            }
            sum += e.getValue();
        }
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Factor weights must sum to 1.0 but sum to " + sum);
        }
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static FactorWeights of(Map<String, Double> weights) {
        return new FactorWeights(weights);
    }

    public boolean isActive(String factor) {
        return weights.containsKey(factor);
    }

    public double weightOf(String factor) {
        return weights.getOrDefault(factor, 0.0);
    }
}
