package com.shlawgathon.pulse.backend.model;

/**
 * Kind of development activity a timeline event represents.
 */
public enum TimelineEventType {
    FEATURE,
    BUG,
    REFACTOR,
    DOCUMENTATION,
    TESTING,
    DEPLOYMENT,
    LEARNING,
    COLLABORATION
}
