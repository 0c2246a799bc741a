package com.example.allocation.model;

import java.util.List;

public record FeatureVector(
        int schemaVersion,
        List<Double> skills,
        double experience,
        double rating,
        List<Integer> tagIndices,
        String location,
        String region,
        List<String> imputedFields
) {
    public static final int UNKNOWN_TAG = -1;
    public static final String UNKNOWN_PLACE = "unknown";

    public boolean hasKnownTags() {
        return tagIndices.stream().anyMatch(i -> i != UNKNOWN_TAG);
    }

    public boolean locationKnown() {
        return !UNKNOWN_PLACE.equals(location);
    }

    public boolean regionKnown() {
        return !UNKNOWN_PLACE.equals(region);
    }
}
