package com.shlawgathon.pulse.backend.model;

/**
 * Completion state of a single interaction as reported by the assistant hook.
 */
public enum CompletionStatus {
    PENDING,
    COMPLETED
}
