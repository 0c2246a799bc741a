package com.example.allocation.model;

public record AllocationEntry(
        String candidateId,
        String slotId,
        String category,
        PairScore score,
        AssignmentPhase phase
) {}
