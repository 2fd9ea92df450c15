package com.shlawgathon.pulse.backend.model;

public enum TaskPriority {
    HIGH,
    MEDIUM,
    LOW
}
