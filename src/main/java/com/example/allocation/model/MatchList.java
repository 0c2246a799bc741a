package com.example.allocation.model;

import java.util.List;

public record MatchList(
        String candidateId,
        int eligibleSlots,
        List<SlotMatch> matches
) {
    public MatchList {
        matches = List.copyOf(matches);
    }
}
