package com.shlawgathon.pulse.backend.model;

/**
 * Live activity status of a developer, derived from the recent window.
 */
public enum DeveloperStatus {
    BLOCKED(4, "Blocked"),
    PROBLEM_SOLVING(3, "Problem solving"),
    FLOW(2, "In flow"),
    IDLE(1, "Idle");

    private final int priority;
    private final String messagePrefix;

    DeveloperStatus(int priority, String messagePrefix) {
        this.priority = priority;
        this.messagePrefix = messagePrefix;
    }

    /**
     * Board ordering weight, higher sorts first.
     */
    public int getPriority() {
        return priority;
    }

    public String getMessagePrefix() {
        return messagePrefix;
    }
}
