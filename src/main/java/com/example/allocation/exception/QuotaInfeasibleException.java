package com.example.allocation.exception;

import java.util.List;
import java.util.Map;

/** Reserved floors cannot fit a slot's capacity. Maps each offending slot to its conflicting categories. */
public class QuotaInfeasibleException extends AllocationException {

    private final Map<String, List<String>> conflicts;

    public QuotaInfeasibleException(String message, Map<String, List<String>> conflicts) {
        super("QUOTA_INFEASIBLE", message, List.copyOf(conflicts.keySet()));
        this.conflicts = Map.copyOf(conflicts);
    }

    public Map<String, List<String>> getConflicts() {
        return conflicts;
    }
}
