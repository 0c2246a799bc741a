package com.example.allocation.service;

import com.example.allocation.config.AllocationProperties;
import com.example.allocation.exception.FactorException;
import com.example.allocation.model.FactorContribution;
import com.example.allocation.model.FactorWeights;
import com.example.allocation.model.FeatureVector;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairScore;
import com.example.allocation.service.factor.AcademicStandingFactor;
import com.example.allocation.service.factor.CompatibilityFactor;
import com.example.allocation.service.factor.ExperienceFitFactor;
import com.example.allocation.service.factor.GeographyFitFactor;
import com.example.allocation.service.factor.PreferenceAlignmentFactor;
import com.example.allocation.service.factor.SkillSimilarityFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores one (candidate, slot) pair as a weighted sum of named factors.
 *
 * <p>The result is a pure function of the two normalized vectors and the weights. The breakdown
 * is ordered by contribution descending, ties keeping factor declaration order, and its
 * contributions sum to the composite. A factor that cannot be computed is degraded to a zero
 * subscore and flagged in the breakdown instead of failing the pair.
 */
@Service
public class CompatibilityScorer {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityScorer.class);

    private final List<CompatibilityFactor> factors;

    @Autowired
    public CompatibilityScorer(AllocationProperties properties) {
        this(defaultFactors(properties.getScoring().getRegionPartialCredit()));
    }

    public CompatibilityScorer(List<CompatibilityFactor> factors) {
        Set<String> names = factors.stream().map(CompatibilityFactor::name).collect(Collectors.toSet());
        if (names.size() != factors.size()) {
            throw new IllegalArgumentException("Factor names must be unique");
        }
        this.factors = List.copyOf(factors);
    }

    public static List<CompatibilityFactor> defaultFactors(double regionPartialCredit) {
        return List.of(
                new SkillSimilarityFactor(),
                new PreferenceAlignmentFactor(),
                new GeographyFitFactor(regionPartialCredit),
                new ExperienceFitFactor(),
                new AcademicStandingFactor());
    }

    /** Factors in declaration order. */
    public List<CompatibilityFactor> factors() {
        return factors;
    }

    /** Rejects weight sets that name factors this scorer does not declare. */
    public void validateWeights(FactorWeights weights) {
        Set<String> known = factors.stream().map(CompatibilityFactor::name).collect(Collectors.toSet());
        List<String> unknown = weights.weights().keySet().stream().filter(n -> !known.contains(n)).toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown scoring factors: " + unknown + " (known: " + known + ")");
        }
    }

    public PairScore scorePair(NormalizedCandidate candidate, NormalizedSlot slot, FactorWeights weights) {
        return scorePair(candidate.id(), candidate.features(), slot.id(), slot.features(), weights);
    }

    public PairScore scorePair(String candidateId, FeatureVector candidate,
                               String slotId, FeatureVector slot, FactorWeights weights) {
        validateWeights(weights);
        List<FactorContribution> contributions = new ArrayList<>();
        double composite = 0.0;
        for (CompatibilityFactor factor : factors) {
            if (!weights.isActive(factor.name())) {
                continue;
            }
            FactorContribution contribution = evaluate(factor, candidate, slot, weights.weightOf(factor.name()));
            if (contribution.degraded()) {
                log.debug("pair={}/{} factor={} degraded: {}", candidateId, slotId,
                        factor.name(), contribution.degradationReason());
            }
            composite += contribution.contribution();
            contributions.add(contribution);
        }
        // List.sort is stable, so equal contributions keep declaration order
        contributions.sort((a, b) -> a.contribution() > b.contribution() ? -1
                : a.contribution() < b.contribution() ? 1 : 0);
        return new PairScore(candidateId, slotId, composite, contributions);
    }

    private static FactorContribution evaluate(CompatibilityFactor factor, FeatureVector candidate,
                                               FeatureVector slot, double weight) {
        try {
            double subscore = factor.subscore(candidate, slot);
            if (Double.isNaN(subscore) || subscore < 0.0 || subscore > 1.0) {
                return FactorContribution.degraded(factor.name(), weight, "subscore out of range: " + subscore);
            }
            return FactorContribution.of(factor.name(), weight, subscore);
        } catch (FactorException e) {
            return FactorContribution.degraded(factor.name(), weight, e.getMessage());
        }
    }
}
