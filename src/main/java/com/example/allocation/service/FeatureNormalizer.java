package com.example.allocation.service;

import com.example.allocation.config.AllocationProperties;
import com.example.allocation.exception.FeatureValidationException;
import com.example.allocation.model.CandidateProfile;
import com.example.allocation.model.FeatureVector;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.RawFeatures;
import com.example.allocation.model.SlotDefinition;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Turns externally embedded features into the fixed schema the scorer compares.
 * Missing numeric fields are imputed to the midpoint of their range, unmapped tags go to the
 * unknown bucket, and a schema-version or dimensionality mismatch rejects the entity.
 */
@Service
public class FeatureNormalizer {

    private static final double NEUTRAL_SKILL_COMPONENT = 0.0;
    private static final double MIDPOINT = 0.5;

    private final AllocationProperties.Features config;
    private final Map<String, Integer> vocabulary;

    public FeatureNormalizer(AllocationProperties properties) {
        this.config = properties.getFeatures();
        Map<String, Integer> index = new LinkedHashMap<>();
        for (String tag : config.getTagVocabulary()) {
            index.putIfAbsent(canonical(tag), index.size());
        }
        this.vocabulary = Collections.unmodifiableMap(index);
    }

    public NormalizedCandidate normalizeCandidate(CandidateProfile candidate) {
        if (candidate.id() == null || candidate.id().isBlank()) {
            throw new FeatureValidationException(candidate.id(), "Candidate id must not be blank");
        }
        if (candidate.submittedAt() == null) {
            throw new FeatureValidationException(candidate.id(), "Candidate " + candidate.id() + " has no submission timestamp");
        }
        return new NormalizedCandidate(candidate, normalize(candidate.id(), candidate.features()));
    }

    public NormalizedSlot normalizeSlot(SlotDefinition slot) {
        if (slot.id() == null || slot.id().isBlank()) {
            throw new FeatureValidationException(slot.id(), "Slot id must not be blank");
        }
        if (slot.capacity() < 1) {
            throw new FeatureValidationException(slot.id(), "Slot " + slot.id() + " has capacity " + slot.capacity() + " (must be >= 1)");
        }
        for (Map.Entry<String, Integer> reserved : slot.reservedQuotas().entrySet()) {
            if (reserved.getValue() == null || reserved.getValue() < 0) {
                throw new FeatureValidationException(slot.id(),
                        "Slot " + slot.id() + " reserves a negative count for category " + reserved.getKey());
            }
        }
        return new NormalizedSlot(slot, normalize(slot.id(), slot.features()));
    }

    public FeatureVector normalize(String entityId, RawFeatures raw) {
        if (raw == null) {
            throw new FeatureValidationException(entityId, "No features available for " + entityId);
        }
        if (raw.schemaVersion() != config.getSchemaVersion()) {
            throw new FeatureValidationException(entityId, String.format(Locale.ROOT,
                    "Schema version %d of %s does not match expected version %d",
                    raw.schemaVersion(), entityId, config.getSchemaVersion()));
        }
        List<String> imputed = new ArrayList<>();
        List<Double> skills = normalizeSkills(entityId, raw.skills(), imputed);

        double experience;
        if (raw.experienceYears() == null) {
            experience = MIDPOINT;
            imputed.add("experience");
        } else {
            experience = rescale(raw.experienceYears(), config.getMaxExperienceYears());
        }

        double rating;
        if (raw.rating() == null) {
            rating = MIDPOINT;
            imputed.add("rating");
        } else {
            rating = rescale(raw.rating(), config.getMaxRating());
        }

        List<Integer> tags = new ArrayList<>(mapTags(raw.tags()));
        String location = place(raw.location());
        String region = place(raw.region());
        if (FeatureVector.UNKNOWN_PLACE.equals(location) && FeatureVector.UNKNOWN_PLACE.equals(region)) {
            imputed.add("location");
        }
        return new FeatureVector(config.getSchemaVersion(), skills, experience, rating,
                List.copyOf(tags), location, region, List.copyOf(imputed));
    }

    /** Vocabulary index of a tag, or {@link FeatureVector#UNKNOWN_TAG}. */
    public int tagIndex(String tag) {
        return tag == null ? FeatureVector.UNKNOWN_TAG : vocabulary.getOrDefault(canonical(tag), FeatureVector.UNKNOWN_TAG);
    }

    public List<String> vocabulary() {
        return List.copyOf(vocabulary.keySet());
    }

    private List<Double> normalizeSkills(String entityId, List<Double> skills, List<String> imputed) {
        int dimensions = config.getSkillDimensions();
        if (skills == null || skills.isEmpty()) {
            imputed.add("skills");
            return Collections.nCopies(dimensions, NEUTRAL_SKILL_COMPONENT);
        }
        if (skills.size() != dimensions) {
            throw new FeatureValidationException(entityId, String.format(Locale.ROOT,
                    "Skill embedding of %s has %d components, expected %d", entityId, skills.size(), dimensions));
        }
        List<Double> out = new ArrayList<>(dimensions);
        boolean anyMissing = false;
        for (Double component : skills) {
            if (component == null || component.isNaN()) {
                out.add(NEUTRAL_SKILL_COMPONENT);
                anyMissing = true;
            } else {
                out.add(component);
            }
        }
        if (anyMissing) {
            imputed.add("skills[partial]");
        }
        return List.copyOf(out);
    }

    private SortedSet<Integer> mapTags(List<String> tags) {
        SortedSet<Integer> indices = new TreeSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    indices.add(tagIndex(tag));
                }
            }
        }
        return indices;
    }

    private static double rescale(double value, double max) {
        if (max <= 0) {
            return MIDPOINT;
        }
        return Math.max(0.0, Math.min(1.0, value / max));
    }

    private static String place(String value) {
        return value == null || value.isBlank() ? FeatureVector.UNKNOWN_PLACE : canonical(value);
    }

    private static String canonical(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
