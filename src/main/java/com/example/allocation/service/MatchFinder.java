package com.example.allocation.service;

import com.example.allocation.config.AllocationProperties;
import com.example.allocation.exception.AllocationException;
import com.example.allocation.model.CandidateProfile;
import com.example.allocation.model.FactorWeights;
import com.example.allocation.model.MatchList;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairScore;
import com.example.allocation.model.SlotDefinition;
import com.example.allocation.model.SlotMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks the registered slots for a single candidate, outside any allocation round. Only slots the
 * candidate is eligible for and that reach the minimum score are listed, best first.
 */
@Service
public class MatchFinder {

    private static final Logger log = LoggerFactory.getLogger(MatchFinder.class);

    public static final int DEFAULT_LIMIT = 10;

    private final CandidateService candidates;
    private final SlotService slots;
    private final FeatureNormalizer normalizer;
    private final CompatibilityScorer scorer;
    private final AllocationProperties properties;

    public MatchFinder(CandidateService candidates, SlotService slots, FeatureNormalizer normalizer,
                       CompatibilityScorer scorer, AllocationProperties properties) {
        this.candidates = candidates;
        this.slots = slots;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.properties = properties;
    }

    /**
     * @param weights factor weights, or {@code null} for the configured ones
     * @return empty if no candidate has the id
     * @throws IllegalArgumentException if {@code limit < 1} or the weights are invalid
     * @throws AllocationException if the candidate's own features are invalid
     */
    public Optional<MatchList> findMatches(String candidateId, int limit, FactorWeights weights) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        Optional<CandidateProfile> profile = candidates.findById(candidateId);
        if (profile.isEmpty()) {
            return Optional.empty();
        }
        FactorWeights effective = weights != null ? weights : properties.getScoring().toWeights();
        scorer.validateWeights(effective);
        NormalizedCandidate candidate = normalizer.normalizeCandidate(profile.get());
        double minimumScore = properties.getScoring().getMinimumScore();

        List<SlotMatch> ranked = new ArrayList<>();
        for (SlotDefinition definition : slots.findAll()) {
            NormalizedSlot slot;
            try {
                slot = normalizer.normalizeSlot(definition);
            } catch (AllocationException e) {
                log.warn("slot={} skipped for matching [{}]: {}", definition.id(), e.getErrorCode(), e.getMessage());
                continue;
            }
            if (!candidate.eligibleFor(slot)) {
                continue;
            }
            PairScore score = scorer.scorePair(candidate, slot, effective);
            if (score.composite() < minimumScore) {
                continue;
            }
            ranked.add(new SlotMatch(definition.id(), definition.organization(), definition.title(),
                    definition.sector(), score));
        }
        ranked.sort(Comparator.comparingDouble((SlotMatch m) -> m.score().composite()).reversed()
                .thenComparing(SlotMatch::slotId));

        List<SlotMatch> top = ranked.subList(0, Math.min(limit, ranked.size()));
        log.info("candidate={} matches: eligible={} returned={}", candidateId, ranked.size(), top.size());
        return Optional.of(new MatchList(candidateId, ranked.size(), top));
    }
}
