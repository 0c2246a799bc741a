package com.example.allocation.model;

public record NormalizedSlot(
        SlotDefinition definition,
        FeatureVector features
) {
    public String id() {
        return definition.id();
    }

    public int capacity() {
        return definition.capacity();
    }
}
