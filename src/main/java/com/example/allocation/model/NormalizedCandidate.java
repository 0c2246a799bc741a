package com.example.allocation.model;

import java.time.Instant;

public record NormalizedCandidate(
        CandidateProfile profile,
        FeatureVector features
) {
    public static final String UNSPECIFIED_CATEGORY = "unspecified";

    public String id() {
        return profile.id();
    }

    /** Declared category, or {@link #UNSPECIFIED_CATEGORY} when the profile has none. */
    public String category() {
        String category = profile.category();
        return category == null || category.isBlank() ? UNSPECIFIED_CATEGORY : category;
    }

    public Instant submittedAt() {
        return profile.submittedAt();
    }

    public boolean eligibleFor(NormalizedSlot slot) {
        Eligibility eligibility = profile.eligibility() == null ? Eligibility.ANY : profile.eligibility();
        return eligibility.permits(slot.features().region(), slot.definition().sector());
    }
}
