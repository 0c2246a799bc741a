package com.example.allocation.model;

public record PairFailure(
        String candidateId,
        String slotId,
        String reason
) {}
