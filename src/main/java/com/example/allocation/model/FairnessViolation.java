package com.example.allocation.model;

public record FairnessViolation(
        String category,
        String slotId,
        double disparity,
        double tolerance,
        String message
) {}
