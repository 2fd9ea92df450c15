package com.shlawgathon.pulse.backend.model;

public enum DigestMomentum {
    HIGH,
    MEDIUM,
    LOW
}
