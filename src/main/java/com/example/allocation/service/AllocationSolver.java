package com.example.allocation.service;

import com.example.allocation.config.AllocationProperties;
import com.example.allocation.exception.SolverException;
import com.example.allocation.model.Allocation;
import com.example.allocation.model.AllocationEntry;
import com.example.allocation.model.AssignmentPhase;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairScore;
import com.example.allocation.model.PairScoreMatrix;
import com.example.allocation.model.QuotaBounds;
import com.example.allocation.model.QuotaSchedule;
import com.example.allocation.model.QuotaWaiver;
import com.example.allocation.model.SlotQuota;
import com.example.allocation.model.UnmatchedCandidate;
import com.example.allocation.model.UnmatchedReason;
import com.example.allocation.service.matching.HungarianAssignment;
import com.example.allocation.service.matching.MinCostFlow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Capacity- and quota-constrained assignment of candidates to slots, maximizing total
 * compatibility.
 *
 * <p>Each slot is expanded into unit-capacity seats sharing the slot's score column.
 * <ol>
 *   <li><b>Reserved phase</b>: every reserved seat is typed (slot, category) and matched with
 *       cardinality priority, then by score, against candidates of that category.</li>
 *   <li><b>Open phase</b>: remaining candidates compete for the remaining seats. Without a
 *       binding ceiling this is a plain assignment; otherwise it is solved exactly as a flow in
 *       which each (slot, category) group is capped at its remaining ceiling.</li>
 * </ol>
 * Scores are quantized to 1e-6 and combined with a submission-rank bonus, so among equally
 * scored candidates the earlier submission wins the seat. Nothing is returned unless the whole
 * allocation passes the capacity, uniqueness, floor and ceiling checks.
 */
@Service
public class AllocationSolver {

    private static final Logger log = LoggerFactory.getLogger(AllocationSolver.class);

    static final long SCORE_QUANTUM = 1_000_000L;

    private final double minimumScore;

    @Autowired
    public AllocationSolver(AllocationProperties properties) {
        this(properties.getScoring().getMinimumScore());
    }

    public AllocationSolver(double minimumScore) {
        this.minimumScore = minimumScore;
    }

    public Allocation solve(String roundId,
                            List<NormalizedCandidate> candidates,
                            List<NormalizedSlot> slots,
                            PairScoreMatrix scores,
                            QuotaSchedule schedule) {
        if (candidates.isEmpty()) {
            return new Allocation(roundId, List.of(), List.of(), schedule.waivers());
        }
        List<NormalizedCandidate> ranked = rankBySubmission(candidates);
        if (slots.isEmpty()) {
            List<UnmatchedCandidate> unmatched = ranked.stream()
                    .map(c -> new UnmatchedCandidate(c.id(), UnmatchedReason.NO_SEAT_AVAILABLE)).toList();
            return new Allocation(roundId, List.of(), unmatched, schedule.waivers());
        }
        List<NormalizedSlot> orderedSlots = new ArrayList<>(slots);
        orderedSlots.sort(Comparator.comparing(NormalizedSlot::id));

        Problem problem = new Problem(ranked, orderedSlots, scores, schedule);
        List<QuotaWaiver> waivers = new ArrayList<>(schedule.waivers());

        List<AllocationEntry> reserved = reservedPhase(problem, waivers);
        List<AllocationEntry> open = openPhase(problem);

        List<AllocationEntry> entries = new ArrayList<>(reserved);
        entries.addAll(open);
        Map<String, Integer> rankOf = problem.rankIndex;
        Map<String, Integer> slotOrder = problem.slotIndex;
        entries.sort(Comparator.<AllocationEntry>comparingInt(e -> slotOrder.get(e.slotId()))
                .thenComparingInt(e -> rankOf.get(e.candidateId())));

        Set<String> assigned = new HashSet<>();
        entries.forEach(e -> assigned.add(e.candidateId()));
        List<UnmatchedCandidate> unmatched = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            NormalizedCandidate c = ranked.get(i);
            if (!assigned.contains(c.id())) {
                unmatched.add(new UnmatchedCandidate(c.id(), problem.hasAnyEdge(i)
                        ? UnmatchedReason.NO_SEAT_AVAILABLE
                        : UnmatchedReason.INELIGIBLE_FOR_ALL_OPEN_SLOTS));
            }
        }

        Allocation allocation = new Allocation(roundId, entries, unmatched, waivers);
        verify(allocation, orderedSlots, problem);
        log.info("round={} solved: assigned={} unmatched={} reserved={} waivers={} totalScore={}",
                roundId, entries.size(), unmatched.size(), reserved.size(), waivers.size(),
                String.format(Locale.ROOT, "%.4f", allocation.totalScore()));
        return allocation;
    }

    // =========================================================================
    //  Reserved phase
    // =========================================================================

    private List<AllocationEntry> reservedPhase(Problem problem, List<QuotaWaiver> waivers) {
        List<Seat> seats = new ArrayList<>();
        for (int s = 0; s < problem.slots.size(); s++) {
            SlotQuota quota = problem.quotaOf(s);
            List<String> categories = new ArrayList<>(quota.bounds().keySet());
            Collections.sort(categories);
            for (String category : categories) {
                for (int k = 0; k < quota.floor(category); k++) {
                    seats.add(new Seat(s, category));
                }
            }
        }
        if (seats.isEmpty()) {
            return List.of();
        }

        int n = problem.candidates.size();
        long cardinalityBonus;
        try {
            // any extra reserved seat outweighs every score difference
            cardinalityBonus = Math.addExact(
                    Math.multiplyExact((long) Math.min(n, seats.size()), problem.maxBaseWeight), 1L);
        } catch (ArithmeticException e) {
            throw new SolverException("Reserved-seat weights overflow for " + n + " candidates and "
                    + seats.size() + " reserved seats", List.of(), e);
        }
        HungarianAssignment.WeightFunction weights = (row, col) -> {
            Seat seat = seats.get(col);
            long base = problem.base[row][seat.slot];
            return base > 0 && seat.category.equals(problem.candidates.get(row).category())
                    ? cardinalityBonus + base : 0;
        };
        int[] match = HungarianAssignment.maximize(n, seats.size(), weights);

        List<AllocationEntry> entries = new ArrayList<>();
        Map<Seat, Integer> filled = new HashMap<>();
        for (int row = 0; row < n; row++) {
            if (match[row] == HungarianAssignment.UNASSIGNED) {
                continue;
            }
            Seat seat = seats.get(match[row]);
            entries.add(problem.assign(row, seat.slot, AssignmentPhase.RESERVED_QUOTA));
            filled.merge(seat, 1, Integer::sum);
        }

        for (int s = 0; s < problem.slots.size(); s++) {
            SlotQuota quota = problem.quotaOf(s);
            String slotId = problem.slots.get(s).id();
            List<String> categories = new ArrayList<>(quota.bounds().keySet());
            Collections.sort(categories);
            for (String category : categories) {
                QuotaBounds bounds = quota.bounds().get(category);
                int got = filled.getOrDefault(new Seat(s, category), 0);
                if (got >= bounds.floor()) {
                    continue;
                }
                String reason = String.format(Locale.ROOT,
                        "only %d of %d reserved '%s' seats could be filled with eligible candidates",
                        got, bounds.floor(), category);
                if (!bounds.waivable()) {
                    throw new SolverException("Hard quota floor cannot be met for slot " + slotId + ": " + reason,
                            List.of(slotId));
                }
                log.warn("slot={} floor waived: {}", slotId, reason);
                waivers.add(new QuotaWaiver(slotId, List.of(category), reason));
                problem.waivedFloors.add(new Seat(s, category));
            }
        }
        return entries;
    }

    // =========================================================================
    //  Open phase
    // =========================================================================

    private List<AllocationEntry> openPhase(Problem problem) {
        List<Integer> pool = new ArrayList<>();
        for (int row = 0; row < problem.candidates.size(); row++) {
            if (!problem.isAssigned(row)) {
                pool.add(row);
            }
        }
        List<Integer> seats = new ArrayList<>();
        for (int s = 0; s < problem.slots.size(); s++) {
            for (int k = 0; k < problem.openSeats(s); k++) {
                seats.add(s);
            }
        }
        if (pool.isEmpty() || seats.isEmpty()) {
            return List.of();
        }
        if (ceilingsInPlay(problem)) {
            return openPhaseWithCeilings(problem, pool);
        }

        int[] match = HungarianAssignment.maximize(pool.size(), seats.size(),
                (i, j) -> problem.base[pool.get(i)][seats.get(j)]);
        List<AllocationEntry> entries = new ArrayList<>();
        for (int i = 0; i < pool.size(); i++) {
            if (match[i] != HungarianAssignment.UNASSIGNED) {
                entries.add(problem.assign(pool.get(i), seats.get(match[i]), AssignmentPhase.OPEN_COMPETITION));
            }
        }
        return entries;
    }

    /** True when some category could fill fewer of a slot's open seats than the slot has left. */
    private static boolean ceilingsInPlay(Problem problem) {
        for (int s = 0; s < problem.slots.size(); s++) {
            SlotQuota quota = problem.quotaOf(s);
            for (String category : quota.bounds().keySet()) {
                if (quota.ceiling(category) - problem.countOf(s, category) < problem.openSeats(s)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Exact open phase under ceilings, as a maximum-weight flow:
     * source -> candidate (1) -> (slot, category) (remaining ceiling) -> slot (open seats) -> sink.
     */
    private List<AllocationEntry> openPhaseWithCeilings(Problem problem, List<Integer> pool) {
        int slotCount = problem.slots.size();
        Map<Seat, Integer> groupNode = new LinkedHashMap<>();
        for (int row : pool) {
            String category = problem.candidates.get(row).category();
            for (int s = 0; s < slotCount; s++) {
                if (problem.base[row][s] > 0 && roomFor(problem, s, category) > 0) {
                    groupNode.putIfAbsent(new Seat(s, category), groupNode.size());
                }
            }
        }

        int source = 0;
        int firstCandidate = 1;
        int firstGroup = firstCandidate + pool.size();
        int firstSlot = firstGroup + groupNode.size();
        int sink = firstSlot + slotCount;
        MinCostFlow network = new MinCostFlow(sink + 1);

        Map<Integer, List<int[]>> candidateEdges = new LinkedHashMap<>();
        for (int i = 0; i < pool.size(); i++) {
            int row = pool.get(i);
            network.addEdge(source, firstCandidate + i, 1, 0);
            String category = problem.candidates.get(row).category();
            for (int s = 0; s < slotCount; s++) {
                Integer group = groupNode.get(new Seat(s, category));
                if (group != null && problem.base[row][s] > 0) {
                    int edge = network.addEdge(firstCandidate + i, firstGroup + group, 1, -problem.base[row][s]);
                    candidateEdges.computeIfAbsent(row, k -> new ArrayList<>()).add(new int[]{edge, s});
                }
            }
        }
        groupNode.forEach((seat, group) -> network.addEdge(firstGroup + group, firstSlot + seat.slot,
                Math.min(roomFor(problem, seat.slot, seat.category), problem.openSeats(seat.slot)), 0));
        for (int s = 0; s < slotCount; s++) {
            network.addEdge(firstSlot + s, sink, problem.openSeats(s), 0);
        }

        try {
            network.minimizeCost(source, sink);
        } catch (ArithmeticException e) {
            throw new SolverException("Assignment weights overflow for " + pool.size() + " candidates and "
                    + slotCount + " slots", List.of(), e);
        }

        List<AllocationEntry> entries = new ArrayList<>();
        candidateEdges.forEach((row, edges) -> {
            for (int[] edge : edges) {
                if (network.flow(edge[0]) > 0) {
                    entries.add(problem.assign(row, edge[1], AssignmentPhase.OPEN_COMPETITION));
                }
            }
        });
        log.debug("open phase solved under ceilings: groups={} assigned={}", groupNode.size(), entries.size());
        return entries;
    }

    private static int roomFor(Problem problem, int slot, String category) {
        return problem.quotaOf(slot).ceiling(category) - problem.countOf(slot, category);
    }

    // =========================================================================
    //  Verification
    // =========================================================================

    private static void verify(Allocation allocation, List<NormalizedSlot> slots, Problem problem) {
        Set<String> seen = new HashSet<>();
        for (AllocationEntry entry : allocation.entries()) {
            if (!seen.add(entry.candidateId())) {
                throw new SolverException("Candidate " + entry.candidateId() + " assigned more than once",
                        List.of(entry.candidateId()));
            }
        }
        for (int s = 0; s < slots.size(); s++) {
            NormalizedSlot slot = slots.get(s);
            List<AllocationEntry> inSlot = allocation.entriesForSlot(slot.id());
            if (inSlot.size() > slot.capacity()) {
                throw new SolverException("Slot " + slot.id() + " over capacity: " + inSlot.size()
                        + " > " + slot.capacity(), List.of(slot.id()));
            }
            SlotQuota quota = problem.quotaOf(s);
            for (QuotaBounds bounds : quota.bounds().values()) {
                long count = inSlot.stream().filter(e -> bounds.category().equals(e.category())).count();
                boolean waived = problem.waivedFloors.contains(new Seat(s, bounds.category()));
                if (count < bounds.floor() && !waived) {
                    throw new SolverException("Slot " + slot.id() + " misses floor for " + bounds.category(),
                            List.of(slot.id()));
                }
                if (count > bounds.ceiling()) {
                    throw new SolverException("Slot " + slot.id() + " exceeds ceiling for " + bounds.category(),
                            List.of(slot.id()));
                }
            }
        }
    }

    private static List<NormalizedCandidate> rankBySubmission(List<NormalizedCandidate> candidates) {
        List<NormalizedCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparing(NormalizedCandidate::submittedAt)
                .thenComparing(NormalizedCandidate::id));
        return ranked;
    }

    private record Seat(int slot, String category) {}

    /** Round-local working state of one solve. */
    private final class Problem {

        final List<NormalizedCandidate> candidates;
        final List<NormalizedSlot> slots;
        final PairScoreMatrix scores;
        final QuotaSchedule schedule;
        final Map<String, Integer> rankIndex = new HashMap<>();
        final Map<String, Integer> slotIndex = new HashMap<>();
        final long[][] base;
        final long maxBaseWeight;
        final Set<Seat> waivedFloors = new HashSet<>();
        private final boolean[] assigned;
        private final int[] used;
        private final Map<Seat, Integer> categoryCounts = new HashMap<>();

        Problem(List<NormalizedCandidate> candidates, List<NormalizedSlot> slots,
                PairScoreMatrix scores, QuotaSchedule schedule) {
            this.candidates = candidates;
            this.slots = slots;
            this.scores = scores;
            this.schedule = schedule;
            this.assigned = new boolean[candidates.size()];
            this.used = new int[slots.size()];
            for (int i = 0; i < candidates.size(); i++) {
                rankIndex.put(candidates.get(i).id(), i);
            }
            for (int s = 0; s < slots.size(); s++) {
                slotIndex.put(slots.get(s).id(), s);
            }

            int n = candidates.size();
            long totalSeats = slots.stream().mapToLong(NormalizedSlot::capacity).sum();
            long tieSpan;
            try {
                // the rank bonuses of any matching must stay below one score quantum
                tieSpan = Math.addExact(Math.multiplyExact((long) n, Math.min(n, totalSeats)), 1L);
                maxBaseWeight = Math.addExact(Math.multiplyExact(SCORE_QUANTUM, tieSpan), n);
            } catch (ArithmeticException e) {
                throw new SolverException("Round too large for exact assignment weights: "
                        + n + " candidates, " + totalSeats + " seats", List.of(), e);
            }
            this.base = new long[n][slots.size()];
            for (int i = 0; i < n; i++) {
                NormalizedCandidate c = candidates.get(i);
                for (int s = 0; s < slots.size(); s++) {
                    NormalizedSlot slot = slots.get(s);
                    if (!c.eligibleFor(slot)) {
                        continue;
                    }
                    Optional<PairScore> score = scores.get(c.id(), slot.id());
                    if (score.isEmpty() || score.get().composite() < minimumScore) {
                        continue;
                    }
                    long quantized = Math.round(clamp(score.get().composite()) * SCORE_QUANTUM);
                    base[i][s] = quantized * tieSpan + (n - i);
                }
            }
        }

        SlotQuota quotaOf(int s) {
            NormalizedSlot slot = slots.get(s);
            return schedule.forSlot(slot.id(), slot.capacity());
        }

        boolean hasAnyEdge(int row) {
            for (long w : base[row]) {
                if (w > 0) {
                    return true;
                }
            }
            return false;
        }

        boolean isAssigned(int row) {
            return assigned[row];
        }

        int openSeats(int s) {
            return slots.get(s).capacity() - used[s];
        }

        int countOf(int s, String category) {
            return categoryCounts.getOrDefault(new Seat(s, category), 0);
        }

        AllocationEntry assign(int row, int s, AssignmentPhase phase) {
            NormalizedCandidate c = candidates.get(row);
            NormalizedSlot slot = slots.get(s);
            assigned[row] = true;
            used[s]++;
            categoryCounts.merge(new Seat(s, c.category()), 1, Integer::sum);
            PairScore score = scores.get(c.id(), slot.id())
                    .orElseThrow(() -> new SolverException("No score for assigned pair " + c.id() + "/" + slot.id(),
                            List.of(c.id(), slot.id())));
            return new AllocationEntry(c.id(), slot.id(), c.category(), score, phase);
        }
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
