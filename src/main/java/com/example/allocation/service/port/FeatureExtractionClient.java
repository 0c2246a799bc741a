package com.example.allocation.service.port;

import com.example.allocation.model.RawFeatures;

/**
 * Source of raw features for entities submitted without them, typically an embedding or
 * document-parsing service.
 *
 * <p>Implementations throw {@link com.example.allocation.exception.FeatureExtractionException}
 * on failure. Calls may be retried, so they must be safe to repeat.
 */
public interface FeatureExtractionClient {

    RawFeatures extractCandidateFeatures(String candidateId);

    RawFeatures extractSlotFeatures(String slotId);
}
