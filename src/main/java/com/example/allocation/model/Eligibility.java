package com.example.allocation.model;

import java.util.Locale;
import java.util.Set;

public record Eligibility(
        Set<String> regions,
        Set<String> excludedSectors
) {
    public static final Eligibility ANY = new Eligibility(Set.of(), Set.of());

    public Eligibility {
        regions = regions == null ? Set.of() : Set.copyOf(regions);
        excludedSectors = excludedSectors == null ? Set.of() : Set.copyOf(excludedSectors);
    }

    /** True when a slot in the given region and sector is acceptable to the candidate. */
    public boolean permits(String region, String sector) {
        boolean regionOk = regions.isEmpty() || (region != null && regions.stream()
                .anyMatch(r -> r.trim().toLowerCase(Locale.ROOT).equals(region.trim().toLowerCase(Locale.ROOT))));
        boolean sectorOk = sector == null || excludedSectors.stream()
                .noneMatch(s -> s.equalsIgnoreCase(sector.trim()));
        return regionOk && sectorOk;
    }
}
