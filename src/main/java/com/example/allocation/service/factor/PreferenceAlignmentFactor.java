package com.example.allocation.service.factor;

import com.example.allocation.model.FeatureVector;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class PreferenceAlignmentFactor implements CompatibilityFactor {

    public static final String NAME = "preference-alignment";
    private static final double NEUTRAL = 0.5;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String rule() {
        return "Share of the slot's known tags that the candidate lists as a preference; 0.5 when either side has no known tags";
    }

    @Override
    public double subscore(FeatureVector candidate, FeatureVector slot) {
        if (!candidate.hasKnownTags() || !slot.hasKnownTags()) {
            return NEUTRAL;
        }
        Set<Integer> preferred = known(candidate.tagIndices());
        Set<Integer> offered = known(slot.tagIndices());
        long matched = offered.stream().filter(preferred::contains).count();
        return (double) matched / offered.size();
    }

    private static Set<Integer> known(List<Integer> indices) {
        return indices.stream().filter(i -> i != FeatureVector.UNKNOWN_TAG).collect(Collectors.toSet());
    }
}
