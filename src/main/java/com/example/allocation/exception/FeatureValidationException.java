package com.example.allocation.exception;

import java.util.List;

/** A single entity's features are structurally incompatible; the entity is excluded, the round continues. */
public class FeatureValidationException extends AllocationException {

    public FeatureValidationException(String entityId, String message) {
        super("VALIDATION_ERROR", message, List.of(entityId == null ? "<blank>" : entityId));
    }
}
