package com.example.allocation.model;

import java.time.Instant;

public record CandidateProfile(
        String id,
        String name,
        Instant submittedAt,
        String category,
        RawFeatures features,
        Eligibility eligibility
) {
    public CandidateProfile withFeatures(RawFeatures fetched) {
        return new CandidateProfile(id, name, submittedAt, category, fetched, eligibility);
    }
}
