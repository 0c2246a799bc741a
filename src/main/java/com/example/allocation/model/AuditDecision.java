package com.example.allocation.model;

public enum AuditDecision {
    ASSIGNED,
    UNMATCHED,
    QUOTA_WAIVED,
    FAIRNESS_VIOLATION,
    CORRECTION
}
