package com.example.allocation.model;

public enum AssignmentPhase {
    RESERVED_QUOTA,
    OPEN_COMPETITION
}
