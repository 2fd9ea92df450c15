package com.shlawgathon.pulse.backend.model;

public enum ProductivityLevel {
    HIGH,
    MEDIUM,
    LOW
}
