package com.example.allocation.service;

import com.example.allocation.model.Allocation;
import com.example.allocation.model.CandidateProfile;
import com.example.allocation.model.Eligibility;
import com.example.allocation.model.FactorContribution;
import com.example.allocation.model.FeatureVector;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairScore;
import com.example.allocation.model.PairScoreMatrix;
import com.example.allocation.model.QuotaBounds;
import com.example.allocation.model.QuotaSchedule;
import com.example.allocation.model.SlotDefinition;
import com.example.allocation.model.SlotQuota;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Hand-built normalized entities and score tables for solver and fairness tests. */
final class Fixtures {

    static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private Fixtures() {
    }

    static NormalizedCandidate candidate(String id, String category, int minutesAfterT0) {
        return candidate(id, category, minutesAfterT0, Eligibility.ANY);
    }

    static NormalizedCandidate candidate(String id, String category, int minutesAfterT0, Eligibility eligibility) {
        CandidateProfile profile = new CandidateProfile(id, id, T0.plusSeconds(60L * minutesAfterT0),
                category, null, eligibility);
        return new NormalizedCandidate(profile, vector("south"));
    }

    static NormalizedSlot slot(String id, int capacity) {
        return slot(id, capacity, "south", "software");
    }

    static NormalizedSlot slot(String id, int capacity, String region, String sector) {
        SlotDefinition definition = new SlotDefinition(id, "Org " + id, "Intern " + id, capacity, sector, null, Map.of());
        return new NormalizedSlot(definition, vector(region));
    }

    static NormalizedSlot reservedSlot(String id, int capacity, Map<String, Integer> reserved) {
        SlotDefinition definition = new SlotDefinition(id, "Org " + id, "Intern " + id, capacity, "software", null, reserved);
        return new NormalizedSlot(definition, vector("south"));
    }

    static FeatureVector vector(String region) {
        return new FeatureVector(1, List.of(1.0, 0.0), 0.5, 0.5, List.of(), "unknown", region, List.of());
    }

    static PairScore score(String candidateId, String slotId, double composite) {
        return new PairScore(candidateId, slotId, composite,
                List.of(FactorContribution.of("skill-similarity", 1.0, composite)));
    }

    static Allocation emptyAllocation(String roundId) {
        return new Allocation(roundId, List.of(), List.of(), List.of());
    }

    static ScoreTable scores() {
        return new ScoreTable();
    }

    static QuotaSchedule floor(String slotId, int capacity, String category, int floor, boolean waivable) {
        return schedule(slotId, capacity, new QuotaBounds(category, floor, capacity, waivable));
    }

    static QuotaSchedule schedule(String slotId, int capacity, QuotaBounds... bounds) {
        Map<String, QuotaBounds> byCategory = new LinkedHashMap<>();
        for (QuotaBounds b : bounds) {
            byCategory.put(b.category(), b);
        }
        return new QuotaSchedule(Map.of(slotId, new SlotQuota(slotId, capacity, byCategory, false)), List.of());
    }

    static final class ScoreTable {

        private final Map<String, Map<String, PairScore>> rows = new LinkedHashMap<>();

        ScoreTable put(String candidateId, String slotId, double composite) {
            rows.computeIfAbsent(candidateId, k -> new HashMap<>()).put(slotId, score(candidateId, slotId, composite));
            return this;
        }

        PairScoreMatrix build() {
            return new PairScoreMatrix(rows, List.of());
        }
    }
}
