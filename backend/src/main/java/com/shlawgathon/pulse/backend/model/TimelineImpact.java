package com.shlawgathon.pulse.backend.model;

public enum TimelineImpact {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
