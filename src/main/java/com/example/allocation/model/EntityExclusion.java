package com.example.allocation.model;

public record EntityExclusion(
        String entityId,
        EntityType type,
        String errorCode,
        String reason
) {}
