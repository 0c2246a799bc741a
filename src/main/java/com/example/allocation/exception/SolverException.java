package com.example.allocation.exception;

import java.util.List;

public class SolverException extends AllocationException {

    public SolverException(String message, List<String> offendingEntities) {
        super("SOLVER_ERROR", message, offendingEntities);
    }

    public SolverException(String message, List<String> offendingEntities, Throwable cause) {
        super("SOLVER_ERROR", message, offendingEntities, cause);
    }
}
