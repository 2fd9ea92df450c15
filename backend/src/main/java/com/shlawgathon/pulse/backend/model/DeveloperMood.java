package com.shlawgathon.pulse.backend.model;

/**
 * Tone of a developer's recent conversation.
 */
public enum DeveloperMood {
    POSITIVE,
    NEUTRAL,
    FRUSTRATED,
    FOCUSED
}
