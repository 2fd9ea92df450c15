package com.shlawgathon.pulse.backend.model;

import java.util.List;

/**
 * One user's records, newest first, with the recent and daily subsets.
 * {@code recent} is always contained in {@code daily}.
 */
public record UserActivityWindow(
        String userId,
        List<InteractionRecord> all,
        List<InteractionRecord> recent,
        List<InteractionRecord> daily) {

    public boolean isActive() {
        return !daily.isEmpty();
    }
}
