package com.example.allocation.model;

import java.util.Map;

public record SlotDefinition(
        String id,
        String organization,
        String title,
        int capacity,
        String sector,
        RawFeatures features,
        Map<String, Integer> reservedQuotas
) {
    public SlotDefinition {
        reservedQuotas = reservedQuotas == null ? Map.of() : Map.copyOf(reservedQuotas);
    }

    public SlotDefinition withFeatures(RawFeatures fetched) {
        return new SlotDefinition(id, organization, title, capacity, sector, fetched, reservedQuotas);
    }
}
