package com.shlawgathon.pulse.backend.model;

public enum TimelineCategory {
    CODE,
    ARCHITECTURE,
    REVIEW,
    PLANNING,
    DEBUGGING
}
