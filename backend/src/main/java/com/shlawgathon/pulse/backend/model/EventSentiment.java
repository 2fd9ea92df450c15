package com.shlawgathon.pulse.backend.model;

public enum EventSentiment {
    POSITIVE,
    NEUTRAL,
    FRUSTRATED,
    EXCITED
}
