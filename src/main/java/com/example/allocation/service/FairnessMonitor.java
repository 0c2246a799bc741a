package com.example.allocation.service;

import com.example.allocation.exception.QuotaInfeasibleException;
import com.example.allocation.model.Allocation;
import com.example.allocation.model.AllocationEntry;
import com.example.allocation.model.CategoryQuota;
import com.example.allocation.model.CategoryRate;
import com.example.allocation.model.DisparityScope;
import com.example.allocation.model.FairnessPolicy;
import com.example.allocation.model.FairnessReport;
import com.example.allocation.model.FairnessViolation;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairScore;
import com.example.allocation.model.PairScoreMatrix;
import com.example.allocation.model.QuotaBounds;
import com.example.allocation.model.QuotaPolicy;
import com.example.allocation.model.QuotaSchedule;
import com.example.allocation.model.QuotaWaiver;
import com.example.allocation.model.SlotQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Quota bookkeeping around the solver: derives per-slot floors and ceilings before the solve,
 * and measures per-category assignment disparity after it.
 */
@Service
public class FairnessMonitor {

    private static final Logger log = LoggerFactory.getLogger(FairnessMonitor.class);

    // absorbs binary representation error in fraction x capacity, e.g. 0.3 x 10
    private static final double EPSILON = 1e-9;

    public QuotaSchedule buildSchedule(List<NormalizedSlot> slots,
                                       List<NormalizedCandidate> candidates,
                                       PairScoreMatrix scores,
                                       QuotaPolicy policy) {
        QuotaPolicy quotaPolicy = policy == null ? QuotaPolicy.NONE : policy;
        Map<String, SlotQuota> schedule = new LinkedHashMap<>();
        List<QuotaWaiver> waivers = new ArrayList<>();
        Map<String, List<String>> conflicts = new LinkedHashMap<>();
        Map<String, Integer> greedy = greedyCategoryCounts(slots, candidates, scores);

        List<NormalizedSlot> ordered = new ArrayList<>(slots);
        ordered.sort(Comparator.comparing(NormalizedSlot::id));
        for (NormalizedSlot slot : ordered) {
            Map<String, QuotaBounds> bounds = boundsFor(slot, quotaPolicy);
            List<String> involved = conflictingCategories(slot.capacity(), bounds);
            if (!involved.isEmpty()) {
                boolean waivable = quotaPolicy.waiveInfeasible()
                        && involved.stream().allMatch(c -> quotaPolicy.forCategory(c).waivable());
                if (!waivable) {
                    conflicts.put(slot.id(), involved);
                    continue;
                }
                String reason = String.format(Locale.ROOT,
                        "floors %s cannot fit capacity %d; reserved floors waived", floorsOf(bounds), slot.capacity());
                log.warn("slot={} quota infeasible, waiving: {}", slot.id(), reason);
                waivers.add(new QuotaWaiver(slot.id(), involved, reason));
                bounds = zeroFloors(bounds);
            }
            boolean greedyViolates = bounds.values().stream().anyMatch(b -> {
                int count = greedy.getOrDefault(slot.id() + "\u0000" + b.category(), 0);
                return count < b.floor() || count > b.ceiling();
            });
            schedule.put(slot.id(), new SlotQuota(slot.id(), slot.capacity(), bounds, greedyViolates));
        }

        if (!conflicts.isEmpty()) {
            StringBuilder message = new StringBuilder("Quota floors are infeasible for ");
            message.append(conflicts.size()).append(conflicts.size() == 1 ? " slot:" : " slots:");
            conflicts.forEach((slotId, categories) ->
                    message.append(' ').append(slotId).append(' ').append(categories).append(';'));
            throw new QuotaInfeasibleException(message.substring(0, message.length() - 1), conflicts);
        }
        long flagged = schedule.values().stream().filter(SlotQuota::greedyWouldViolate).count();
        log.debug("quota schedule built: slots={} constrained={} greedyWouldViolate={} waivers={}",
                schedule.size(), schedule.values().stream().filter(q -> !q.bounds().isEmpty()).count(),
                flagged, waivers.size());
        return new QuotaSchedule(schedule, waivers);
    }

    public FairnessReport assess(String roundId,
                                 Allocation allocation,
                                 List<NormalizedCandidate> candidates,
                                 FairnessPolicy policy) {
        if (!policy.enabled()) {
            log.debug("round={} fairness check disabled", roundId);
            return FairnessReport.skipped(roundId, policy.scope(), policy.tolerance());
        }
        Map<String, Integer> population = new TreeMap<>();
        candidates.forEach(c -> population.merge(c.category(), 1, Integer::sum));
        int total = candidates.size();
        double populationRate = total == 0 ? 0.0 : (double) allocation.entries().size() / total;

        List<CategoryRate> rates = policy.scope() == DisparityScope.PER_SLOT
                ? perSlotRates(allocation, population, total)
                : aggregateRates(allocation, population, populationRate);

        List<FairnessViolation> violations = new ArrayList<>();
        for (CategoryRate rate : rates) {
            if (rate.population() < policy.minGroupSize() || Math.abs(rate.disparity()) <= policy.tolerance()) {
                continue;
            }
            String where = rate.slotId() == null ? "" : " in slot " + rate.slotId();
            String message = String.format(Locale.ROOT,
                    "category '%s'%s rate %.3f deviates from baseline %.3f by %+.3f (tolerance %.3f)",
                    rate.category(), where, rate.rate(), rate.baseline(), rate.disparity(), policy.tolerance());
            log.warn("round={} fairness violation: {}", roundId, message);
            violations.add(new FairnessViolation(rate.category(), rate.slotId(), rate.disparity(),
                    policy.tolerance(), message));
        }
        return new FairnessReport(roundId, policy.scope(), populationRate, policy.tolerance(),
                rates, violations, false);
    }

    // =========================================================================
    //  Schedule helpers
    // =========================================================================

    private static Map<String, QuotaBounds> boundsFor(NormalizedSlot slot, QuotaPolicy policy) {
        int capacity = slot.capacity();
        Set<String> categories = new TreeSet<>(policy.categories().keySet());
        categories.addAll(slot.definition().reservedQuotas().keySet());

        Map<String, QuotaBounds> bounds = new LinkedHashMap<>();
        for (String category : categories) {
            CategoryQuota quota = policy.forCategory(category);
            int reserved = slot.definition().reservedQuotas().getOrDefault(category, 0);
            int floor = Math.max(reserved, (int) Math.ceil(quota.minFraction() * capacity - EPSILON));
            int ceiling = Math.min(capacity, (int) Math.floor(quota.maxFraction() * capacity + EPSILON));
            if (floor > 0 || ceiling < capacity) {
                bounds.put(category, new QuotaBounds(category, floor, ceiling, quota.waivable()));
            }
        }
        return bounds;
    }

    private static List<String> conflictingCategories(int capacity, Map<String, QuotaBounds> bounds) {
        Set<String> involved = new TreeSet<>();
        int totalFloor = 0;
        for (QuotaBounds b : bounds.values()) {
            totalFloor += b.floor();
            if (b.floor() > b.ceiling()) {
                involved.add(b.category());
            }
        }
        if (totalFloor > capacity) {
            bounds.values().stream().filter(b -> b.floor() > 0).forEach(b -> involved.add(b.category()));
        }
        return List.copyOf(involved);
    }

    private static Map<String, QuotaBounds> zeroFloors(Map<String, QuotaBounds> bounds) {
        Map<String, QuotaBounds> zeroed = new LinkedHashMap<>();
        bounds.forEach((c, b) -> zeroed.put(c, new QuotaBounds(c, 0, b.ceiling(), b.waivable())));
        return zeroed;
    }

    private static Map<String, Integer> floorsOf(Map<String, QuotaBounds> bounds) {
        Map<String, Integer> floors = new TreeMap<>();
        bounds.values().stream().filter(b -> b.floor() > 0).forEach(b -> floors.put(b.category(), b.floor()));
        return floors;
    }

    /**
     * Category counts per slot under an unconstrained greedy pass: pairs by score descending,
     * then earlier submission, then ids. Keyed by slot id and category.
     */
    private static Map<String, Integer> greedyCategoryCounts(List<NormalizedSlot> slots,
                                                             List<NormalizedCandidate> candidates,
                                                             PairScoreMatrix scores) {
        record Pair(NormalizedCandidate candidate, NormalizedSlot slot, double score) {}

        List<Pair> pairs = new ArrayList<>();
        for (NormalizedCandidate c : candidates) {
            for (NormalizedSlot s : slots) {
                Optional<PairScore> score = scores.get(c.id(), s.id());
                if (score.isPresent() && c.eligibleFor(s)) {
                    pairs.add(new Pair(c, s, score.get().composite()));
                }
            }
        }
        pairs.sort(Comparator.comparingDouble(Pair::score).reversed()
                .thenComparing(p -> p.candidate().submittedAt())
                .thenComparing(p -> p.candidate().id())
                .thenComparing(p -> p.slot().id()));

        Set<String> placed = new HashSet<>();
        Map<String, Integer> used = new HashMap<>();
        Map<String, Integer> counts = new HashMap<>();
        for (Pair p : pairs) {
            String slotId = p.slot().id();
            if (placed.contains(p.candidate().id()) || used.getOrDefault(slotId, 0) >= p.slot().capacity()) {
                continue;
            }
            placed.add(p.candidate().id());
            used.merge(slotId, 1, Integer::sum);
            counts.merge(slotId + "\u0000" + p.candidate().category(), 1, Integer::sum);
        }
        return counts;
    }

    // =========================================================================
    //  Disparity helpers
    // =========================================================================

    private static List<CategoryRate> aggregateRates(Allocation allocation, Map<String, Integer> population,
                                                     double populationRate) {
        Map<String, Integer> assigned = new HashMap<>();
        allocation.entries().forEach(e -> assigned.merge(e.category(), 1, Integer::sum));
        List<CategoryRate> rates = new ArrayList<>();
        population.forEach((category, size) -> {
            int got = assigned.getOrDefault(category, 0);
            double rate = (double) got / size;
            rates.add(new CategoryRate(category, null, size, got, rate, populationRate, rate - populationRate));
        });
        return rates;
    }

    private static List<CategoryRate> perSlotRates(Allocation allocation, Map<String, Integer> population, int total) {
        Map<String, List<AllocationEntry>> bySlot = new TreeMap<>();
        allocation.entries().forEach(e -> bySlot.computeIfAbsent(e.slotId(), k -> new ArrayList<>()).add(e));
        List<CategoryRate> rates = new ArrayList<>();
        bySlot.forEach((slotId, entries) -> population.forEach((category, size) -> {
            int got = (int) entries.stream().filter(e -> category.equals(e.category())).count();
            double share = (double) got / entries.size();
            double baseline = (double) size / total;
            rates.add(new CategoryRate(category, slotId, size, got, share, baseline, share - baseline));
        }));
        return rates;
    }
}
