package com.example.allocation.service.factor;

import com.example.allocation.exception.FactorException;
import com.example.allocation.model.FeatureVector;

public class GeographyFitFactor implements CompatibilityFactor {

    public static final String NAME = "geography-fit";

    private final double regionPartialCredit;

    public GeographyFitFactor(double regionPartialCredit) {
        if (regionPartialCredit < 0 || regionPartialCredit > 1) {
            throw new IllegalArgumentException("Region partial credit must lie in [0,1]");
        }
        this.regionPartialCredit = regionPartialCredit;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String rule() {
        return "1.0 for the same location, " + regionPartialCredit + " for the same region, 0 otherwise";
    }

    @Override
    public double subscore(FeatureVector candidate, FeatureVector slot) {
        if (!candidate.locationKnown() && !candidate.regionKnown()) {
            throw new FactorException(NAME, "Candidate location and region are unknown");
        }
        if (!slot.locationKnown() && !slot.regionKnown()) {
            throw new FactorException(NAME, "Slot location and region are unknown");
        }
        if (candidate.locationKnown() && candidate.location().equals(slot.location())) {
            return 1.0;
        }
        if (candidate.regionKnown() && candidate.region().equals(slot.region())) {
            return regionPartialCredit;
        }
        return 0.0;
    }
}
