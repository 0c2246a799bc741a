package com.example.allocation.exception;

import java.util.List;

/** One factor could not be computed for a pair; the scorer degrades it to a neutral subscore. */
public class FactorException extends AllocationException {

    private final String factor;

    public FactorException(String factor, String message) {
        super("FACTOR_ERROR", message, List.of());
        this.factor = factor;
    }

    public String getFactor() {
        return factor;
    }
}
