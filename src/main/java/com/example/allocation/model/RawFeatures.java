package com.example.allocation.model;

import java.util.List;

public record RawFeatures(
        int schemaVersion,
        List<Double> skills,
        Double experienceYears,
        Double rating,
        List<String> tags,
        String location,
        String region
) {}
