package com.example.allocation.model;

public enum EntityType {
    CANDIDATE,
    SLOT
}
