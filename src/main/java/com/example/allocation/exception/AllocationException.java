package com.example.allocation.exception;

import java.util.List;

/**
 * Base of the allocation error taxonomy. Every failure carries a stable error code and the
 * ids of the entities it concerns so callers can correct input and retry.
 */
public class AllocationException extends RuntimeException {

    private final String errorCode;
    private final List<String> offendingEntities;

    public AllocationException(String errorCode, String message, List<String> offendingEntities) {
        super(message);
        this.errorCode = errorCode;
        this.offendingEntities = offendingEntities == null ? List.of() : List.copyOf(offendingEntities);
    }

    public AllocationException(String errorCode, String message, List<String> offendingEntities, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.offendingEntities = offendingEntities == null ? List.of() : List.copyOf(offendingEntities);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public List<String> getOffendingEntities() {
        return offendingEntities;
    }
}
