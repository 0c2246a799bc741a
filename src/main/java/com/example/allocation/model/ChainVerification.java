package com.example.allocation.model;

public record ChainVerification(
        boolean valid,
        int recordsChecked,
        Long firstInvalidSequence
) {}
