package com.example.allocation.service.factor;

import com.example.allocation.exception.FactorException;
import com.example.allocation.model.FeatureVector;

/**
 * One named, explainable component of a pair's compatibility score.
 * Implementations must be pure: the subscore depends only on the two vectors.
 */
public interface CompatibilityFactor {

    String name();

    /** Human-readable statement of how the subscore is computed. */
    String rule();

    /**
     * @return subscore in [0,1]
     * @throws FactorException when a field the factor needs is absent
     */
    double subscore(FeatureVector candidate, FeatureVector slot);
}
