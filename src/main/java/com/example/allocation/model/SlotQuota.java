package com.example.allocation.model;

import java.util.Map;

public record SlotQuota(
        String slotId,
        int capacity,
        Map<String, QuotaBounds> bounds,
        boolean greedyWouldViolate
) {
    public SlotQuota {
        bounds = Map.copyOf(bounds);
    }

    public int floor(String category) {
        QuotaBounds b = bounds.get(category);
        return b == null ? 0 : b.floor();
    }

    /** Ceiling for the category; unconstrained categories may fill the whole slot. */
    public int ceiling(String category) {
        QuotaBounds b = bounds.get(category);
        return b == null ? capacity : b.ceiling();
    }
}
