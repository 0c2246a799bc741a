package com.example.allocation.model;

public record QuotaBounds(
        String category,
        int floor,
        int ceiling,
        boolean waivable
) {}
