package com.example.allocation.service;

import com.example.allocation.exception.SolverException;
import com.example.allocation.model.Allocation;
import com.example.allocation.model.AllocationEntry;
import com.example.allocation.model.AssignmentPhase;
import com.example.allocation.model.Eligibility;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairScoreMatrix;
import com.example.allocation.model.QuotaBounds;
import com.example.allocation.model.QuotaSchedule;
import com.example.allocation.model.SlotQuota;
import com.example.allocation.model.UnmatchedReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.example.allocation.service.Fixtures.candidate;
import static com.example.allocation.service.Fixtures.floor;
import static com.example.allocation.service.Fixtures.schedule;
import static com.example.allocation.service.Fixtures.scores;
import static com.example.allocation.service.Fixtures.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class AllocationSolverTest {

    private final AllocationSolver solver = new AllocationSolver(0.0);

    private static List<String> assigned(Allocation allocation, String slotId) {
        return allocation.entriesForSlot(slotId).stream().map(AllocationEntry::candidateId).toList();
    }

    // =========================================================================
    //  Open competition
    // =========================================================================

    @Nested
    @DisplayName("Open competition")
    class OpenCompetition {

        @Test
        @DisplayName("should fill a slot with the highest scoring candidates and report the rest")
        void highestScoresWin() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("A", "general", 0), candidate("B", "general", 1), candidate("C", "general", 2));
            PairScoreMatrix matrix = scores().put("A", "S1", 0.9).put("B", "S1", 0.7).put("C", "S1", 0.5).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 2)), matrix, QuotaSchedule.EMPTY);

            assertThat(assigned(allocation, "S1")).containsExactlyInAnyOrder("A", "B");
            assertThat(allocation.unmatchedFor("C")).get()
                    .extracting(u -> u.reason()).isEqualTo(UnmatchedReason.NO_SEAT_AVAILABLE);
            assertThat(allocation.entries()).allMatch(e -> e.phase() == AssignmentPhase.OPEN_COMPETITION);
        }

        @Test
        @DisplayName("should maximize the total score rather than place greedily")
        void globalOptimumBeatsGreedy() {
            List<NormalizedCandidate> candidates = List.of(candidate("A", "general", 0), candidate("B", "general", 1));
            PairScoreMatrix matrix = scores()
                    .put("A", "S1", 0.9).put("A", "S2", 0.8)
                    .put("B", "S1", 0.85).put("B", "S2", 0.1)
                    .build();

            Allocation allocation = solver.solve("r1", candidates,
                    List.of(slot("S1", 1), slot("S2", 1)), matrix, QuotaSchedule.EMPTY);

            assertThat(allocation.entryFor("A")).get().extracting(AllocationEntry::slotId).isEqualTo("S2");
            assertThat(allocation.entryFor("B")).get().extracting(AllocationEntry::slotId).isEqualTo("S1");
            assertThat(allocation.totalScore()).isCloseTo(1.65, offset(1e-9));
        }

        @Test
        @DisplayName("should never exceed capacity or assign a candidate twice")
        void capacityAndUniqueness() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("A", "general", 0), candidate("B", "general", 1),
                    candidate("C", "general", 2), candidate("D", "general", 3), candidate("E", "general", 4));
            Fixtures.ScoreTable table = scores();
            for (NormalizedCandidate c : candidates) {
                table.put(c.id(), "S1", 0.9).put(c.id(), "S2", 0.8);
            }

            Allocation allocation = solver.solve("r1", candidates,
                    List.of(slot("S1", 2), slot("S2", 1)), table.build(), QuotaSchedule.EMPTY);

            assertThat(allocation.entriesForSlot("S1")).hasSize(2);
            assertThat(allocation.entriesForSlot("S2")).hasSize(1);
            assertThat(allocation.entries()).extracting(AllocationEntry::candidateId).doesNotHaveDuplicates();
            assertThat(allocation.unmatched()).hasSize(2);
        }

        @Test
        @DisplayName("should produce identical allocations for identical input")
        void deterministic() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("A", "general", 0), candidate("B", "rural", 0), candidate("C", "general", 0));
            PairScoreMatrix matrix = scores()
                    .put("A", "S1", 0.5).put("B", "S1", 0.5).put("C", "S1", 0.5)
                    .put("A", "S2", 0.5).put("B", "S2", 0.5).put("C", "S2", 0.5)
                    .build();
            List<NormalizedSlot> slots = List.of(slot("S1", 1), slot("S2", 1));

            Allocation first = solver.solve("r1", candidates, slots, matrix, QuotaSchedule.EMPTY);
            Allocation second = solver.solve("r1", candidates, slots, matrix, QuotaSchedule.EMPTY);

            assertThat(second).isEqualTo(first);
        }
    }

    // =========================================================================
    //  Tie-breaking
    // =========================================================================

    @Nested
    @DisplayName("Tie-breaking")
    class TieBreaking {

        @Test
        @DisplayName("should give the seat to the earlier submission when scores are equal")
        void earlierSubmissionWins() {
            // Q sorts first by id, P was submitted first
            List<NormalizedCandidate> candidates = List.of(candidate("Q", "general", 5), candidate("P", "general", 1));
            PairScoreMatrix matrix = scores().put("P", "S1", 0.8).put("Q", "S1", 0.8).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 1)), matrix, QuotaSchedule.EMPTY);

            assertThat(assigned(allocation, "S1")).containsExactly("P");
            assertThat(allocation.unmatchedFor("Q")).isPresent();
        }

        @Test
        @DisplayName("should fall back to candidate id when submissions are simultaneous")
        void idBreaksSimultaneousSubmissions() {
            List<NormalizedCandidate> candidates = List.of(candidate("M2", "general", 3), candidate("M1", "general", 3));
            PairScoreMatrix matrix = scores().put("M1", "S1", 0.6).put("M2", "S1", 0.6).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 1)), matrix, QuotaSchedule.EMPTY);

            assertThat(assigned(allocation, "S1")).containsExactly("M1");
        }

        @Test
        @DisplayName("should still prefer a strictly better score over an earlier submission")
        void scoreBeatsTimestamp() {
            List<NormalizedCandidate> candidates = List.of(candidate("Early", "general", 0), candidate("Late", "general", 100));
            PairScoreMatrix matrix = scores().put("Early", "S1", 0.700000).put("Late", "S1", 0.700001).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 1)), matrix, QuotaSchedule.EMPTY);

            assertThat(assigned(allocation, "S1")).containsExactly("Late");
        }
    }

    // =========================================================================
    //  Reserved quotas
    // =========================================================================

    @Nested
    @DisplayName("Reserved quotas")
    class ReservedQuotas {

        @Test
        @DisplayName("should seat a reserved-category candidate ahead of higher scoring open candidates")
        void reservedSeatFilledFirst() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("X", "rural", 0), candidate("Y", "general", 1), candidate("Z", "general", 2));
            PairScoreMatrix matrix = scores().put("X", "S1", 0.4).put("Y", "S1", 0.9).put("Z", "S1", 0.8).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 2)), matrix,
                    floor("S1", 2, "rural", 1, false));

            assertThat(allocation.entryFor("X")).get()
                    .extracting(AllocationEntry::phase).isEqualTo(AssignmentPhase.RESERVED_QUOTA);
            assertThat(allocation.entryFor("Y")).get()
                    .extracting(AllocationEntry::phase).isEqualTo(AssignmentPhase.OPEN_COMPETITION);
            assertThat(allocation.unmatchedFor("Z")).get()
                    .extracting(u -> u.reason()).isEqualTo(UnmatchedReason.NO_SEAT_AVAILABLE);
        }

        @Test
        @DisplayName("should pick the best-scoring members of the category for reserved seats")
        void bestCategoryMembersReserved() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("R1", "rural", 0), candidate("R2", "rural", 1), candidate("G1", "general", 2));
            PairScoreMatrix matrix = scores().put("R1", "S1", 0.3).put("R2", "S1", 0.6).put("G1", "S1", 0.2).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 1)), matrix,
                    floor("S1", 1, "rural", 1, false));

            assertThat(assigned(allocation, "S1")).containsExactly("R2");
        }

        @Test
        @DisplayName("should waive an unfillable waivable floor and give the seat to open competition")
        void waivableFloorWaived() {
            List<NormalizedCandidate> candidates = List.of(candidate("G1", "general", 0), candidate("G2", "general", 1));
            PairScoreMatrix matrix = scores().put("G1", "S1", 0.9).put("G2", "S1", 0.8).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 2)), matrix,
                    floor("S1", 2, "rural", 1, true));

            assertThat(allocation.waivers()).singleElement().satisfies(w -> {
                assertThat(w.slotId()).isEqualTo("S1");
                assertThat(w.categories()).containsExactly("rural");
                assertThat(w.reason()).contains("0 of 1");
            });
            assertThat(assigned(allocation, "S1")).containsExactlyInAnyOrder("G1", "G2");
        }

        @Test
        @DisplayName("should fail when a hard floor cannot be filled")
        void hardFloorFails() {
            List<NormalizedCandidate> candidates = List.of(candidate("G1", "general", 0));
            PairScoreMatrix matrix = scores().put("G1", "S1", 0.9).build();

            assertThatThrownBy(() -> solver.solve("r1", candidates, List.of(slot("S1", 2)), matrix,
                    floor("S1", 2, "rural", 1, false)))
                    .isInstanceOf(SolverException.class)
                    .hasMessageContaining("S1")
                    .satisfies(e -> {
                        SolverException se = (SolverException) e;
                        assertThat(se.getErrorCode()).isEqualTo("SOLVER_ERROR");
                        assertThat(se.getOffendingEntities()).containsExactly("S1");
                    });
        }
    }

    // =========================================================================
    //  Ceilings
    // =========================================================================

    @Nested
    @DisplayName("Ceilings")
    class Ceilings {

        @Test
        @DisplayName("should cap a category at its ceiling even when it scores highest")
        void ceilingCapsCategory() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("G1", "general", 0), candidate("G2", "general", 1), candidate("R1", "rural", 2));
            PairScoreMatrix matrix = scores().put("G1", "S1", 0.9).put("G2", "S1", 0.85).put("R1", "S1", 0.3).build();

            Allocation allocation = solver.solve("r1", candidates, List.of(slot("S1", 3)), matrix,
                    schedule("S1", 3, new QuotaBounds("general", 0, 1, true)));

            assertThat(assigned(allocation, "S1")).containsExactlyInAnyOrder("G1", "R1");
            assertThat(allocation.unmatchedFor("G2")).isPresent();
        }

        @Test
        @DisplayName("should choose which members fill a capped category by total score, not by rank")
        void bindingCeilingSolvedExactly() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("G1", "general", 0), candidate("G2", "general", 1), candidate("R", "rural", 2));
            PairScoreMatrix matrix = scores()
                    .put("G1", "S1", 0.9).put("G1", "S2", 0.5)
                    .put("G2", "S1", 0.8).put("G2", "S2", 0.1)
                    .put("R", "S1", 0.3)
                    .build();

            Allocation allocation = solver.solve("r1", candidates,
                    List.of(slot("S1", 2), slot("S2", 1)), matrix,
                    schedule("S1", 2, new QuotaBounds("general", 0, 1, true)));

            assertThat(assigned(allocation, "S1")).containsExactlyInAnyOrder("G2", "R");
            assertThat(assigned(allocation, "S2")).containsExactly("G1");
            assertThat(allocation.totalScore()).isCloseTo(1.6, offset(1e-9));
            assertThat(allocation.unmatched()).isEmpty();
        }

        @Test
        @DisplayName("should reach the constrained optimum when ceilings bind in several slots")
        void bindingCeilingsInEverySlot() {
            List<NormalizedCandidate> candidates = List.of(
                    candidate("G1", "general", 0), candidate("G2", "general", 1),
                    candidate("R1", "rural", 2), candidate("R2", "rural", 3));
            PairScoreMatrix matrix = scores()
                    .put("G1", "S1", 0.9).put("G1", "S2", 0.85)
                    .put("G2", "S1", 0.8).put("G2", "S2", 0.2)
                    .put("R1", "S1", 0.4).put("R1", "S2", 0.4)
                    .put("R2", "S1", 0.3).put("R2", "S2", 0.35)
                    .build();
            QuotaSchedule schedule = new QuotaSchedule(Map.of(
                    "S1", new SlotQuota("S1", 2, Map.of("general", new QuotaBounds("general", 0, 1, true)), false),
                    "S2", new SlotQuota("S2", 2, Map.of("general", new QuotaBounds("general", 0, 1, true)), false)),
                    List.of());

            Allocation allocation = solver.solve("r1", candidates,
                    List.of(slot("S1", 2), slot("S2", 2)), matrix, schedule);

            assertThat(assigned(allocation, "S1")).containsExactlyInAnyOrder("G2", "R1");
            assertThat(assigned(allocation, "S2")).containsExactlyInAnyOrder("G1", "R2");
            assertThat(allocation.totalScore()).isCloseTo(2.40, offset(1e-9));
        }

        @Test
        @DisplayName("should match an exhaustive search on small instances with random ceilings")
        void matchesExhaustiveSearch() {
            Random random = new Random(7);
            String[] categories = {"general", "rural"};
            for (int trial = 0; trial < 150; trial++) {
                int n = 2 + random.nextInt(4);
                List<NormalizedCandidate> candidates = new ArrayList<>();
                Fixtures.ScoreTable table = scores();
                double[][] score = new double[n][2];
                for (int i = 0; i < n; i++) {
                    String id = "C" + i;
                    candidates.add(candidate(id, categories[random.nextInt(2)], i));
                    for (int s = 0; s < 2; s++) {
                        if (random.nextInt(5) > 0) {
                            score[i][s] = (1 + random.nextInt(99)) / 100.0;
                            table.put(id, "S" + s, score[i][s]);
                        }
                    }
                }
                int[] capacity = {1 + random.nextInt(3), 1 + random.nextInt(3)};
                int[] generalCeiling = {random.nextInt(capacity[0] + 1), random.nextInt(capacity[1] + 1)};
                Map<String, SlotQuota> quotas = new HashMap<>();
                for (int s = 0; s < 2; s++) {
                    quotas.put("S" + s, new SlotQuota("S" + s, capacity[s],
                            Map.of("general", new QuotaBounds("general", 0, generalCeiling[s], true)), false));
                }

                Allocation allocation = solver.solve("r" + trial, candidates,
                        List.of(slot("S0", capacity[0]), slot("S1", capacity[1])), table.build(),
                        new QuotaSchedule(quotas, List.of()));

                double best = bestFeasibleTotal(candidates, score, capacity, generalCeiling, 0, new int[2], new int[2]);
                assertThat(allocation.totalScore()).as("trial %d", trial).isCloseTo(best, offset(1e-9));
                for (int s = 0; s < 2; s++) {
                    String slotId = "S" + s;
                    assertThat(allocation.entriesForSlot(slotId)).hasSizeLessThanOrEqualTo(capacity[s]);
                    assertThat(allocation.entriesForSlot(slotId).stream()
                            .filter(e -> e.category().equals("general")).count())
                            .isLessThanOrEqualTo(generalCeiling[s]);
                }
            }
        }

        private double bestFeasibleTotal(List<NormalizedCandidate> candidates, double[][] score,
                                         int[] capacity, int[] generalCeiling,
                                         int index, int[] used, int[] generals) {
            if (index == candidates.size()) {
                return 0.0;
            }
            double best = bestFeasibleTotal(candidates, score, capacity, generalCeiling, index + 1, used, generals);
            boolean general = candidates.get(index).category().equals("general");
            for (int s = 0; s < 2; s++) {
                if (score[index][s] <= 0 || used[s] >= capacity[s] || (general && generals[s] >= generalCeiling[s])) {
                    continue;
                }
                used[s]++;
                if (general) {
                    generals[s]++;
                }
                best = Math.max(best, score[index][s]
                        + bestFeasibleTotal(candidates, score, capacity, generalCeiling, index + 1, used, generals));
                used[s]--;
                if (general) {
                    generals[s]--;
                }
            }
            return best;
        }
    }

    // =========================================================================
    //  Eligibility and degenerate input
    // =========================================================================

    @Nested
    @DisplayName("Eligibility and degenerate input")
    class EligibilityAndEdges {

        @Test
        @DisplayName("should leave a candidate unmatched as ineligible when no slot region is acceptable")
        void regionIneligible() {
            NormalizedCandidate north = candidate("N", "general", 0, new Eligibility(Set.of("north"), Set.of()));
            PairScoreMatrix matrix = scores().put("N", "S1", 0.99).build();

            Allocation allocation = solver.solve("r1", List.of(north), List.of(slot("S1", 1, "south", "software")),
                    matrix, QuotaSchedule.EMPTY);

            assertThat(allocation.entries()).isEmpty();
            assertThat(allocation.unmatchedFor("N")).get()
                    .extracting(u -> u.reason()).isEqualTo(UnmatchedReason.INELIGIBLE_FOR_ALL_OPEN_SLOTS);
        }

        @Test
        @DisplayName("should respect excluded sectors")
        void sectorExcluded() {
            NormalizedCandidate c = candidate("C", "general", 0, new Eligibility(Set.of(), Set.of("Energy")));
            PairScoreMatrix matrix = scores().put("C", "S1", 0.9).put("C", "S2", 0.2).build();

            Allocation allocation = solver.solve("r1", List.of(c),
                    List.of(slot("S1", 1, "south", "energy"), slot("S2", 1, "south", "software")),
                    matrix, QuotaSchedule.EMPTY);

            assertThat(assigned(allocation, "S2")).containsExactly("C");
        }

        @Test
        @DisplayName("should treat pairs below the minimum score as ineligible")
        void minimumScoreFilters() {
            AllocationSolver strict = new AllocationSolver(0.5);
            PairScoreMatrix matrix = scores().put("L", "S1", 0.3).build();

            Allocation allocation = strict.solve("r1", List.of(candidate("L", "general", 0)),
                    List.of(slot("S1", 1)), matrix, QuotaSchedule.EMPTY);

            assertThat(allocation.unmatchedFor("L")).get()
                    .extracting(u -> u.reason()).isEqualTo(UnmatchedReason.INELIGIBLE_FOR_ALL_OPEN_SLOTS);
        }

        @Test
        @DisplayName("should treat pairs that failed to score as ineligible")
        void unscoredPairIneligible() {
            Allocation allocation = solver.solve("r1", List.of(candidate("U", "general", 0)),
                    List.of(slot("S1", 1)), PairScoreMatrix.EMPTY, QuotaSchedule.EMPTY);

            assertThat(allocation.unmatchedFor("U")).get()
                    .extracting(u -> u.reason()).isEqualTo(UnmatchedReason.INELIGIBLE_FOR_ALL_OPEN_SLOTS);
        }

        @Test
        @DisplayName("should return an empty allocation for no candidates")
        void noCandidates() {
            Allocation allocation = solver.solve("r1", List.of(), List.of(slot("S1", 3)),
                    PairScoreMatrix.EMPTY, QuotaSchedule.EMPTY);

            assertThat(allocation.entries()).isEmpty();
            assertThat(allocation.unmatched()).isEmpty();
        }

        @Test
        @DisplayName("should report every candidate as seatless when there are no slots")
        void noSlots() {
            Allocation allocation = solver.solve("r1", List.of(candidate("A", "general", 0)), List.of(),
                    PairScoreMatrix.EMPTY, QuotaSchedule.EMPTY);

            assertThat(allocation.entries()).isEmpty();
            assertThat(allocation.unmatched()).singleElement()
                    .extracting(u -> u.reason()).isEqualTo(UnmatchedReason.NO_SEAT_AVAILABLE);
        }
    }
}
