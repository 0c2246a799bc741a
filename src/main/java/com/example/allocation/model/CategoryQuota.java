package com.example.allocation.model;

public record CategoryQuota(
        double minFraction,
        double maxFraction,
        boolean waivable
) {
    public static final CategoryQuota UNCONSTRAINED = new CategoryQuota(0.0, 1.0, true);

    public CategoryQuota {
        if (minFraction < 0 || minFraction > 1 || maxFraction < 0 || maxFraction > 1) {
            throw new IllegalArgumentException("Quota fractions must lie in [0,1]");
        }
    }
}
