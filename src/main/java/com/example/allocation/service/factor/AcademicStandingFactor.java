package com.example.allocation.service.factor;

import com.example.allocation.model.FeatureVector;

public class AcademicStandingFactor implements CompatibilityFactor {

    public static final String NAME = "academic-standing";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String rule() {
        return "The candidate's academic rating rescaled to [0,1]";
    }

    @Override
    public double subscore(FeatureVector candidate, FeatureVector slot) {
        return candidate.rating();
    }
}
