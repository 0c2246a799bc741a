package com.example.allocation.model;

import java.util.Map;

public record QuotaPolicy(
        Map<String, CategoryQuota> categories,
        boolean waiveInfeasible
) {
    public static final QuotaPolicy NONE = new QuotaPolicy(Map.of(), false);

    public QuotaPolicy {
        categories = categories == null ? Map.of() : Map.copyOf(categories);
    }

    public CategoryQuota forCategory(String category) {
        return categories.getOrDefault(category, CategoryQuota.UNCONSTRAINED);
    }
}
