package com.shlawgathon.pulse.backend.model;

/**
 * Coarse trend over the most recent timeline events.
 */
public enum TimelineMomentum {
    ACCELERATING,
    STEADY,
    SLOWING,
    BLOCKED
}
