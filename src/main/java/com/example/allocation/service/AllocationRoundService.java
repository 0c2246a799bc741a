package com.example.allocation.service;

import com.example.allocation.config.AllocationProperties;
import com.example.allocation.exception.AllocationException;
import com.example.allocation.exception.FeatureExtractionException;
import com.example.allocation.exception.FeatureValidationException;
import com.example.allocation.model.Allocation;
import com.example.allocation.model.AllocationEntry;
import com.example.allocation.model.AuditEntry;
import com.example.allocation.model.CandidateProfile;
import com.example.allocation.model.EntityExclusion;
import com.example.allocation.model.EntityType;
import com.example.allocation.model.Explanation;
import com.example.allocation.model.FactorContribution;
import com.example.allocation.model.FactorWeights;
import com.example.allocation.model.FairnessPolicy;
import com.example.allocation.model.FairnessReport;
import com.example.allocation.model.FairnessViolation;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairFailure;
import com.example.allocation.model.PairScore;
import com.example.allocation.model.PairScoreMatrix;
import com.example.allocation.model.QuotaPolicy;
import com.example.allocation.model.QuotaSchedule;
import com.example.allocation.model.QuotaWaiver;
import com.example.allocation.model.RawFeatures;
import com.example.allocation.model.RoundFailure;
import com.example.allocation.model.RoundRequest;
import com.example.allocation.model.RoundResult;
import com.example.allocation.model.SlotDefinition;
import com.example.allocation.model.UnmatchedCandidate;
import com.example.allocation.model.UnmatchedReason;
import com.example.allocation.service.port.AllocationPublisher;
import com.example.allocation.service.port.FeatureExtractionClient;
import com.example.allocation.service.port.RoundRepository;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runs allocation rounds end to end: feature retrieval, normalization, parallel scoring, quota
 * scheduling, solving, fairness assessment, commit, audit and publication.
 *
 * <p>Rounds are serialized by a single round lock. Everything computed before commit is
 * round-local and discarded on failure or cancellation, so callers observe either a committed
 * allocation or a {@link RoundFailure}, never a partial result. The committing transition and
 * cancellation race on one compare-and-set; whichever wins decides the outcome.
 */
@Service
public class AllocationRoundService {

    private static final Logger log = LoggerFactory.getLogger(AllocationRoundService.class);

    public static final String MDC_ROUND_ID = "roundId";

    private static final DateTimeFormatter ROUND_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final AllocationProperties properties;
    private final FeatureNormalizer normalizer;
    private final CompatibilityScorer scorer;
    private final FairnessMonitor fairnessMonitor;
    private final AllocationSolver solver;
    private final AuditLedger ledger;
    private final FeatureExtractionClient extractionClient;
    private final RoundRepository repository;
    private final AllocationPublisher publisher;
    private final Retry extractionRetry;
    private final Executor scoringExecutor;
    private final Executor roundExecutor;

    private final ReentrantLock roundLock = new ReentrantLock();
    private final AtomicInteger roundCounter = new AtomicInteger();

    public AllocationRoundService(AllocationProperties properties,
                                  FeatureNormalizer normalizer,
                                  CompatibilityScorer scorer,
                                  FairnessMonitor fairnessMonitor,
                                  AllocationSolver solver,
                                  AuditLedger ledger,
                                  FeatureExtractionClient extractionClient,
                                  RoundRepository repository,
                                  AllocationPublisher publisher,
                                  @Qualifier("featureExtractionRetry") Retry extractionRetry,
                                  @Qualifier("scoringExecutor") Executor scoringExecutor,
                                  @Qualifier("roundExecutor") Executor roundExecutor) {
        this.properties = properties;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.fairnessMonitor = fairnessMonitor;
        this.solver = solver;
        this.ledger = ledger;
        this.extractionClient = extractionClient;
        this.repository = repository;
        this.publisher = publisher;
        this.extractionRetry = extractionRetry;
        this.scoringExecutor = scoringExecutor;
        this.roundExecutor = roundExecutor;
    }

    // =========================================================================
    //  Round execution
    // =========================================================================

    /** Runs a round on the calling thread and returns its outcome. */
    public RoundResult runRound(RoundRequest request) {
        return execute(new RoundContext(nextRoundId()), request);
    }

    /** Queues a round; the returned handle can cancel it until it commits. */
    public RoundHandle submitRound(RoundRequest request) {
        RoundContext context = new RoundContext(nextRoundId());
        CompletableFuture<RoundResult> result =
                CompletableFuture.supplyAsync(() -> execute(context, request), roundExecutor);
        return new RoundHandle(context.roundId, result, context::cancel);
    }

    private RoundResult execute(RoundContext context, RoundRequest request) {
        String roundId = context.roundId;
        roundLock.lock();
        MDC.put(MDC_ROUND_ID, roundId);
        List<EntityExclusion> exclusions = new ArrayList<>();
        RoundResult committed = null;
        try {
            context.ensureRunning();
            String fingerprint = AuditHasher.digest(request);
            FactorWeights weights = request.weights() != null
                    ? request.weights() : properties.getScoring().toWeights();
            QuotaPolicy quotaPolicy = request.quotaPolicy() != null
                    ? request.quotaPolicy() : properties.getQuotas().toPolicy();
            try {
                scorer.validateWeights(weights);
            } catch (IllegalArgumentException e) {
                throw new FeatureValidationException("weights", e.getMessage());
            }
            log.info("round={} started: candidates={} slots={} fingerprint={}",
                    roundId, request.candidates().size(), request.slots().size(), fingerprint.substring(0, 12));

            List<NormalizedCandidate> candidates = prepare(request.candidates(), EntityType.CANDIDATE,
                    CandidateProfile::id, this::withCandidateFeatures, normalizer::normalizeCandidate, exclusions);
            List<NormalizedSlot> slots = prepare(request.slots(), EntityType.SLOT,
                    SlotDefinition::id, this::withSlotFeatures, normalizer::normalizeSlot, exclusions);
            context.ensureRunning();

            PairScoreMatrix scores = scoreAll(context, candidates, slots, weights);
            context.ensureRunning();

            QuotaSchedule schedule = fairnessMonitor.buildSchedule(slots, candidates, scores, quotaPolicy);
            Allocation solved = solver.solve(roundId, candidates, slots, scores, schedule);
            Allocation allocation = withExcludedCandidates(solved, exclusions);
            FairnessPolicy fairnessPolicy = properties.getFairness().toPolicy();
            FairnessReport fairness = fairnessMonitor.assess(roundId, allocation, candidates, fairnessPolicy);

            if (!fingerprint.equals(AuditHasher.digest(request))) {
                throw new AllocationException("INPUT_CHANGED",
                        "Round inputs changed while round " + roundId + " was running", List.of());
            }
            if (!context.commit()) {
                throw new CancellationException("Round " + roundId + " cancelled before commit");
            }

            RoundResult result = RoundResult.succeeded(roundId, fingerprint, allocation, fairness, exclusions);
            appendAudit(roundId, auditEntries(allocation, schedule, slots, fairness));
            repository.save(result);
            committed = result;
            log.info("round={} committed: assigned={} unmatched={} excluded={} fairnessPassed={}",
                    roundId, allocation.entries().size(), allocation.unmatched().size(),
                    exclusions.size(), fairness.passed());
            publish(result);
            return result;
        } catch (CancellationException e) {
            log.warn("round={} cancelled; round state discarded", roundId);
            RoundResult cancelled = RoundResult.cancelled(roundId);
            repository.save(cancelled);
            return cancelled;
        } catch (RuntimeException e) {
            if (committed != null) {
                // a visible committed round is never rewritten
                log.error("round={} post-commit step failed: {}", roundId, e.getMessage(), e);
                return committed;
            }
            return fail(roundId, e, exclusions);
        } finally {
            MDC.remove(MDC_ROUND_ID);
            roundLock.unlock();
        }
    }

    private RoundResult fail(String roundId, RuntimeException cause, List<EntityExclusion> exclusions) {
        RoundFailure failure;
        if (cause instanceof AllocationException e) {
            log.error("round={} failed [{}]: {} offending={}", roundId, e.getErrorCode(), e.getMessage(),
                    e.getOffendingEntities());
            failure = new RoundFailure(e.getErrorCode(), e.getMessage(), e.getOffendingEntities());
        } else {
            log.error("round={} failed unexpectedly: {}", roundId, cause.getMessage(), cause);
            failure = new RoundFailure("INTERNAL_ERROR", String.valueOf(cause.getMessage()), List.of());
        }
        RoundResult failed = RoundResult.failed(roundId, failure, exclusions);
        repository.save(failed);
        return failed;
    }

    /** Seals the round's records; nothing of the round is visible until this succeeds. */
    private void appendAudit(String roundId, List<AuditEntry> entries) {
        try {
            ledger.appendRound(roundId, entries);
        } catch (RuntimeException e) {
            throw new AllocationException("AUDIT_ERROR",
                    "Audit records for round " + roundId + " could not be written: " + e.getMessage(), List.of(), e);
        }
    }

    private <T, N> List<N> prepare(List<T> inputs, EntityType type,
                                   Function<T, String> idOf,
                                   Function<T, T> withFeatures,
                                   Function<T, N> normalize,
                                   List<EntityExclusion> exclusions) {
        List<N> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (T input : inputs) {
            String id = idOf.apply(input);
            if (id != null && !seen.add(id)) {
                exclude(exclusions, new EntityExclusion(id, type, "VALIDATION_ERROR",
                        "Duplicate " + type.name().toLowerCase(Locale.ROOT) + " id " + id));
                continue;
            }
            try {
                accepted.add(normalize.apply(withFeatures.apply(input)));
            } catch (AllocationException e) {
                exclude(exclusions, new EntityExclusion(id == null ? "<blank>" : id, type,
                        e.getErrorCode(), e.getMessage()));
            }
        }
        return accepted;
    }

    private static void exclude(List<EntityExclusion> exclusions, EntityExclusion exclusion) {
        log.warn("{} {} excluded [{}]: {}", exclusion.type(), exclusion.entityId(),
                exclusion.errorCode(), exclusion.reason());
        exclusions.add(exclusion);
    }

    private CandidateProfile withCandidateFeatures(CandidateProfile candidate) {
        if (candidate.features() != null || candidate.id() == null || candidate.id().isBlank()) {
            return candidate;
        }
        return candidate.withFeatures(fetch(candidate.id(), extractionClient::extractCandidateFeatures));
    }

    private SlotDefinition withSlotFeatures(SlotDefinition slot) {
        if (slot.features() != null || slot.id() == null || slot.id().isBlank()) {
            return slot;
        }
        return slot.withFeatures(fetch(slot.id(), extractionClient::extractSlotFeatures));
    }

    private RawFeatures fetch(String entityId, Function<String, RawFeatures> extractor) {
        try {
            return Retry.decorateSupplier(extractionRetry, () -> extractor.apply(entityId)).get();
        } catch (AllocationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FeatureExtractionException(entityId,
                    "Feature extraction failed for " + entityId + ": " + e.getMessage(), e);
        }
    }

    /** Scores every eligible pair on the worker pool; each pair ends scored or failed. */
    private PairScoreMatrix scoreAll(RoundContext context, List<NormalizedCandidate> candidates,
                                     List<NormalizedSlot> slots, FactorWeights weights) {
        Duration timeout = properties.getScoring().getPairTimeout();
        Map<NormalizedCandidate, Map<NormalizedSlot, CompletableFuture<PairScore>>> pending = new LinkedHashMap<>();
        for (NormalizedCandidate candidate : candidates) {
            Map<NormalizedSlot, CompletableFuture<PairScore>> row = new LinkedHashMap<>();
            for (NormalizedSlot slot : slots) {
                if (!candidate.eligibleFor(slot)) {
                    continue;
                }
                CompletableFuture<PairScore> future = CompletableFuture
                        .supplyAsync(() -> scorer.scorePair(candidate, slot, weights), scoringExecutor)
                        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                context.track(future);
                row.put(slot, future);
            }
            pending.put(candidate, row);
        }

        Map<String, Map<String, PairScore>> scores = new LinkedHashMap<>();
        List<PairFailure> failures = new ArrayList<>();
        pending.forEach((candidate, row) -> {
            Map<String, PairScore> scored = new LinkedHashMap<>();
            row.forEach((slot, future) -> {
                try {
                    scored.put(slot.id(), future.join());
                } catch (CancellationException e) {
                    failures.add(new PairFailure(candidate.id(), slot.id(), "cancelled"));
                } catch (CompletionException e) {
                    String reason = e.getCause() instanceof TimeoutException
                            ? "timed out after " + timeout.toMillis() + " ms"
                            : String.valueOf(e.getCause().getMessage());
                    log.warn("pair={}/{} scoring failed: {}", candidate.id(), slot.id(), reason);
                    failures.add(new PairFailure(candidate.id(), slot.id(), reason));
                }
            });
            scores.put(candidate.id(), scored);
        });
        PairScoreMatrix matrix = new PairScoreMatrix(scores, failures);
        log.debug("scored pairs={} failed={}", matrix.size(), failures.size());
        return matrix;
    }

    private static Allocation withExcludedCandidates(Allocation allocation, List<EntityExclusion> exclusions) {
        List<UnmatchedCandidate> unmatched = new ArrayList<>(allocation.unmatched());
        exclusions.stream()
                .filter(x -> x.type() == EntityType.CANDIDATE)
                .map(EntityExclusion::entityId)
                .distinct()
                .filter(id -> allocation.unmatchedFor(id).isEmpty() && allocation.entryFor(id).isEmpty())
                .forEach(id -> unmatched.add(new UnmatchedCandidate(id, UnmatchedReason.EXCLUDED_INVALID_INPUT)));
        return new Allocation(allocation.roundId(), allocation.entries(), unmatched, allocation.waivers());
    }

    private static List<AuditEntry> auditEntries(Allocation allocation, QuotaSchedule schedule,
                                                 List<NormalizedSlot> slots, FairnessReport fairness) {
        Map<String, Integer> capacity = new HashMap<>();
        slots.forEach(s -> capacity.put(s.id(), s.capacity()));
        List<AuditEntry> entries = new ArrayList<>();
        for (AllocationEntry entry : allocation.entries()) {
            entries.add(AuditEntry.assigned(entry, schedule.forSlot(entry.slotId(), capacity.get(entry.slotId()))));
        }
        for (UnmatchedCandidate unmatched : allocation.unmatched()) {
            entries.add(AuditEntry.unmatched(unmatched));
        }
        for (QuotaWaiver waiver : allocation.waivers()) {
            entries.add(AuditEntry.waiver(waiver,
                    schedule.forSlot(waiver.slotId(), capacity.getOrDefault(waiver.slotId(), 0))));
        }
        for (FairnessViolation violation : fairness.violations()) {
            entries.add(AuditEntry.fairness(violation));
        }
        return entries;
    }

    private void publish(RoundResult result) {
        try {
            publisher.publish(result);
        } catch (RuntimeException e) {
            // the round is already committed and audited
            log.error("round={} publication failed: {}", result.roundId(), e.getMessage(), e);
        }
    }

    // =========================================================================
    //  Queries
    // =========================================================================

    public Optional<RoundResult> findRound(String roundId) {
        return repository.findById(roundId);
    }

    public Optional<RoundResult> latestCommittedRound() {
        return repository.latestCommitted();
    }

    public List<RoundResult> rounds() {
        return repository.findAll();
    }

    /**
     * Human-readable account of one candidate's outcome in a committed round: the factor
     * breakdown behind an assignment, or the reason the candidate stayed unmatched.
     */
    public Optional<Explanation> explain(String roundId, String candidateId) {
        Optional<RoundResult> round = repository.findById(roundId).filter(RoundResult::succeeded);
        if (round.isEmpty()) {
            return Optional.empty();
        }
        Allocation allocation = round.get().allocation();
        Optional<AllocationEntry> entry = allocation.entryFor(candidateId);
        if (entry.isPresent()) {
            return Optional.of(explainAssignment(roundId, entry.get()));
        }
        return allocation.unmatchedFor(candidateId).map(u -> new Explanation(roundId, candidateId, null, null, 0.0,
                List.of(), List.of(String.format(Locale.ROOT, "%s was not assigned: %s",
                        candidateId, u.reason().description()))));
    }

    private static Explanation explainAssignment(String roundId, AllocationEntry entry) {
        PairScore score = entry.score();
        List<String> narrative = new ArrayList<>();
        narrative.add(String.format(Locale.ROOT, "%s was assigned to %s in the %s phase with compatibility %.3f",
                entry.candidateId(), entry.slotId(),
                entry.phase().name().toLowerCase(Locale.ROOT).replace('_', ' '), score.composite()));
        for (FactorContribution factor : score.breakdown()) {
            if (factor.degraded()) {
                narrative.add(String.format(Locale.ROOT, "%s could not be evaluated (%s) and contributed 0",
                        factor.factor(), factor.degradationReason()));
            } else {
                narrative.add(String.format(Locale.ROOT, "%s contributed %.3f (weight %.2f x subscore %.3f)",
                        factor.factor(), factor.contribution(), factor.weight(), factor.subscore()));
            }
        }
        return new Explanation(roundId, entry.candidateId(), entry.slotId(), entry.phase(),
                score.composite(), score.breakdown(), narrative);
    }

    private String nextRoundId() {
        return "round-" + ROUND_STAMP.format(Instant.now()) + "-" + roundCounter.incrementAndGet();
    }

    /** Round-local lifecycle: RUNNING until either commit or cancel wins. */
    private static final class RoundContext {

        private enum State { RUNNING, COMMITTED, CANCELLED }

        final String roundId;
        private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
        private final List<CompletableFuture<?>> outstanding = new CopyOnWriteArrayList<>();

        RoundContext(String roundId) {
            this.roundId = roundId;
        }

        void track(CompletableFuture<?> future) {
            outstanding.add(future);
            if (state.get() == State.CANCELLED) {
                future.cancel(true);
            }
        }

        boolean cancel() {
            if (!state.compareAndSet(State.RUNNING, State.CANCELLED)) {
                return state.get() == State.CANCELLED;
            }
            outstanding.forEach(f -> f.cancel(true));
            return true;
        }

        boolean commit() {
            return state.compareAndSet(State.RUNNING, State.COMMITTED);
        }

        void ensureRunning() {
            if (state.get() == State.CANCELLED) {
                throw new CancellationException("Round " + roundId + " cancelled");
            }
        }
    }
}
