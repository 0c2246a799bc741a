package com.example.allocation.model;

public enum RoundStatus {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
