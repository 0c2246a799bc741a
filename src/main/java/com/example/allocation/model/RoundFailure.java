package com.example.allocation.model;

import java.util.List;

public record RoundFailure(
        String code,
        String message,
        List<String> offendingEntities
) {
    public RoundFailure {
        offendingEntities = offendingEntities == null ? List.of() : List.copyOf(offendingEntities);
    }
}
