package com.shlawgathon.pulse.backend.model;

public enum TimelineEventStatus {
    COMPLETED,
    IN_PROGRESS,
    BLOCKED,
    ABANDONED
}
