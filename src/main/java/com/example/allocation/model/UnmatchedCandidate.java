package com.example.allocation.model;

public record UnmatchedCandidate(
        String candidateId,
        UnmatchedReason reason
) {}
