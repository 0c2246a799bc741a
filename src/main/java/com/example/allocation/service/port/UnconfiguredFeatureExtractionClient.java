package com.example.allocation.service.port;

import com.example.allocation.exception.FeatureExtractionException;
import com.example.allocation.model.RawFeatures;

/** Fallback used when no extraction provider is wired: every lookup fails. */
public class UnconfiguredFeatureExtractionClient implements FeatureExtractionClient {

    @Override
    public RawFeatures extractCandidateFeatures(String candidateId) {
        throw new FeatureExtractionException(candidateId, "No feature extraction provider configured");
    }

    @Override
    public RawFeatures extractSlotFeatures(String slotId) {
        throw new FeatureExtractionException(slotId, "No feature extraction provider configured");
    }
}
