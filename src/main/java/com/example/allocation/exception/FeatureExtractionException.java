package com.example.allocation.exception;

import java.util.List;

public class FeatureExtractionException extends AllocationException {

    public FeatureExtractionException(String entityId, String message) {
        super("EXTRACTION_ERROR", message, List.of(entityId));
    }

    public FeatureExtractionException(String entityId, String message, Throwable cause) {
        super("EXTRACTION_ERROR", message, List.of(entityId), cause);
    }
}
