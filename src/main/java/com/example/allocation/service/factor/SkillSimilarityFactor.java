package com.example.allocation.service.factor;

import com.example.allocation.exception.FactorException;
import com.example.allocation.model.FeatureVector;

import java.util.List;

public class SkillSimilarityFactor implements CompatibilityFactor {

    public static final String NAME = "skill-similarity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String rule() {
        return "Cosine similarity of the skill embeddings, rescaled from [-1,1] to [0,1]";
    }

    @Override
    public double subscore(FeatureVector candidate, FeatureVector slot) {
        List<Double> a = candidate.skills();
        List<Double> b = slot.skills();
        if (a.size() != b.size()) {
            throw new FactorException(NAME, "Skill vectors differ in length: " + a.size() + " vs " + b.size());
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.size(); i++) {
            dot += a.get(i) * b.get(i);
            normA += a.get(i) * a.get(i);
            normB += b.get(i) * b.get(i);
        }
        if (normA == 0 || normB == 0) {
            throw new FactorException(NAME, "Skill embedding is empty (zero norm) after normalization");
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        cosine = Math.max(-1.0, Math.min(1.0, cosine));
        return (cosine + 1.0) / 2.0;
    }
}
