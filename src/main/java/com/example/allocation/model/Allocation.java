package com.example.allocation.model;

import java.util.List;
import java.util.Optional;

public record Allocation(
        String roundId,
        List<AllocationEntry> entries,
        List<UnmatchedCandidate> unmatched,
        List<QuotaWaiver> waivers
) {
    public Allocation {
        entries = List.copyOf(entries);
        unmatched = List.copyOf(unmatched);
        waivers = List.copyOf(waivers);
    }

    public Optional<AllocationEntry> entryFor(String candidateId) {
        return entries.stream().filter(e -> e.candidateId().equals(candidateId)).findFirst();
    }

    public Optional<UnmatchedCandidate> unmatchedFor(String candidateId) {
        return unmatched.stream().filter(u -> u.candidateId().equals(candidateId)).findFirst();
    }

    public List<AllocationEntry> entriesForSlot(String slotId) {
        return entries.stream().filter(e -> e.slotId().equals(slotId)).toList();
    }

    public double totalScore() {
        return entries.stream().mapToDouble(e -> e.score().composite()).sum();
    }
}
