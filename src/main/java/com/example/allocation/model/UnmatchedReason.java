package com.example.allocation.model;

public enum UnmatchedReason {
    NO_SEAT_AVAILABLE("no seat available"),
    INELIGIBLE_FOR_ALL_OPEN_SLOTS("ineligible for all open slots"),
    EXCLUDED_INVALID_INPUT("excluded: invalid input");

    private final String description;

    UnmatchedReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
