package com.example.allocation.model;

/**
 * Realized allocation rate for one category. {@code slotId} is null for batch-wide rates;
 * for per-slot rates, {@code rate} is the category's share of the slot's assignments.
 */
public record CategoryRate(
        String category,
        String slotId,
        int population,
        int assigned,
        double rate,
        double baseline,
        double disparity
) {}
