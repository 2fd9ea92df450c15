package com.shlawgathon.pulse.backend.model;

public enum TechnicalDepth {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
