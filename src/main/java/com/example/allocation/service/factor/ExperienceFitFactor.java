package com.example.allocation.service.factor;

import com.example.allocation.model.FeatureVector;

public class ExperienceFitFactor implements CompatibilityFactor {

    public static final String NAME = "experience-fit";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String rule() {
        return "1.0 when the candidate meets the slot's desired experience, otherwise 1 minus the normalized shortfall";
    }

    @Override
    public double subscore(FeatureVector candidate, FeatureVector slot) {
        double shortfall = slot.experience() - candidate.experience();
        return shortfall <= 0 ? 1.0 : Math.max(0.0, 1.0 - shortfall);
    }
}
