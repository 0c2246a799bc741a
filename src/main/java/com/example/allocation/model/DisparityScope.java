package com.example.allocation.model;

public enum DisparityScope {
    AGGREGATE,
    PER_SLOT
}
