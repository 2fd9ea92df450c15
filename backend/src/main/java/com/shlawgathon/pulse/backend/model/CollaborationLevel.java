package com.shlawgathon.pulse.backend.model;

public enum CollaborationLevel {
    SOLO,
    MINIMAL,
    MODERATE,
    HIGH
}
