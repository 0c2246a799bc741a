package com.example.allocation.config;

import com.example.allocation.model.CategoryQuota;
import com.example.allocation.model.DisparityScope;
import com.example.allocation.model.FactorWeights;
import com.example.allocation.model.FairnessPolicy;
import com.example.allocation.model.QuotaPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Allocation policy bound from the {@code allocation.*} namespace of application.yml.
 */
@ConfigurationProperties(prefix = "allocation")
public class AllocationProperties {

    private final Features features = new Features();
    private final Scoring scoring = new Scoring();
    private final Quotas quotas = new Quotas();
    private final Fairness fairness = new Fairness();
    private final Extraction extraction = new Extraction();

    public Features getFeatures() { return features; }
    public Scoring getScoring()   { return scoring; }
    public Quotas getQuotas()     { return quotas; }
    public Fairness getFairness() { return fairness; }
    public Extraction getExtraction() { return extraction; }

    public static class Features {
        private int schemaVersion = 1;
        private int skillDimensions = 4;
        private double maxExperienceYears = 5.0;
        private double maxRating = 10.0;
        private List<String> tagVocabulary = new ArrayList<>(List.of(
                "software", "data", "finance", "healthcare", "manufacturing",
                "energy", "agriculture", "public-policy", "design", "research"));

        public int getSchemaVersion() { return schemaVersion; }
        public void setSchemaVersion(int schemaVersion) { this.schemaVersion = schemaVersion; }
        public int getSkillDimensions() { return skillDimensions; }
        public void setSkillDimensions(int skillDimensions) { this.skillDimensions = skillDimensions; }
        public double getMaxExperienceYears() { return maxExperienceYears; }
        public void setMaxExperienceYears(double maxExperienceYears) { this.maxExperienceYears = maxExperienceYears; }
        public double getMaxRating() { return maxRating; }
        public void setMaxRating(double maxRating) { this.maxRating = maxRating; }
        public List<String> getTagVocabulary() { return tagVocabulary; }
        public void setTagVocabulary(List<String> tagVocabulary) { this.tagVocabulary = tagVocabulary; }
    }

    public static class Scoring {
        private Map<String, Double> weights = new LinkedHashMap<>();
        private double regionPartialCredit = 0.5;
        private double minimumScore = 0.0;
        private int parallelism = 4;
        private Duration pairTimeout = Duration.ofSeconds(30);

        public Scoring() {
            weights.put("skill-similarity", 0.40);
            weights.put("preference-alignment", 0.20);
            weights.put("geography-fit", 0.15);
            weights.put("experience-fit", 0.15);
            weights.put("academic-standing", 0.10);
        }

        public FactorWeights toWeights() {
            return FactorWeights.of(weights);
        }

        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = new LinkedHashMap<>(weights); }
        public double getRegionPartialCredit() { return regionPartialCredit; }
        public void setRegionPartialCredit(double regionPartialCredit) { this.regionPartialCredit = regionPartialCredit; }
        public double getMinimumScore() { return minimumScore; }
        public void setMinimumScore(double minimumScore) { this.minimumScore = minimumScore; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
        public Duration getPairTimeout() { return pairTimeout; }
        public void setPairTimeout(Duration pairTimeout) { this.pairTimeout = pairTimeout; }
    }

    public static class Quotas {
        private boolean waiveInfeasible = false;
        private Map<String, CategoryQuotaProperties> categories = new LinkedHashMap<>();

        public QuotaPolicy toPolicy() {
            Map<String, CategoryQuota> policy = new LinkedHashMap<>();
            categories.forEach((name, q) -> policy.put(name,
                    new CategoryQuota(q.getMinFraction(), q.getMaxFraction(), q.isWaivable())));
            return new QuotaPolicy(policy, waiveInfeasible);
        }

        public boolean isWaiveInfeasible() { return waiveInfeasible; }
        public void setWaiveInfeasible(boolean waiveInfeasible) { this.waiveInfeasible = waiveInfeasible; }
        public Map<String, CategoryQuotaProperties> getCategories() { return categories; }
        public void setCategories(Map<String, CategoryQuotaProperties> categories) { this.categories = categories; }
    }

    public static class CategoryQuotaProperties {
        private double minFraction = 0.0;
        private double maxFraction = 1.0;
        private boolean waivable = true;

        public double getMinFraction() { return minFraction; }
        public void setMinFraction(double minFraction) { this.minFraction = minFraction; }
        public double getMaxFraction() { return maxFraction; }
        public void setMaxFraction(double maxFraction) { this.maxFraction = maxFraction; }
        public boolean isWaivable() { return waivable; }
        public void setWaivable(boolean waivable) { this.waivable = waivable; }
    }

    public static class Fairness {
        private boolean enabled = true;
        private double tolerance = 0.2;
        private DisparityScope scope = DisparityScope.AGGREGATE;
        private int minGroupSize = 1;

        public FairnessPolicy toPolicy() {
            return new FairnessPolicy(enabled, tolerance, scope, minGroupSize);
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getTolerance() { return tolerance; }
        public void setTolerance(double tolerance) { this.tolerance = tolerance; }
        public DisparityScope getScope() { return scope; }
        public void setScope(DisparityScope scope) { this.scope = scope; }
        public int getMinGroupSize() { return minGroupSize; }
        public void setMinGroupSize(int minGroupSize) { this.minGroupSize = minGroupSize; }
    }

    public static class Extraction {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }
}
