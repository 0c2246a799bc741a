package com.example.allocation.model;

/** One slot offered to a candidate, with the score that ranks it. */
public record SlotMatch(
        String slotId,
        String organization,
        String title,
        String sector,
        PairScore score
) {}
