package com.shlawgathon.pulse.backend;

import com.shlawgathon.pulse.backend.model.CompletionStatus;
import com.shlawgathon.pulse.backend.model.InteractionRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Interaction record fixtures.
 */
public final class TestRecords {

    public static final Instant NOW = Instant.parse("2026-03-10T15:00:00Z");

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private TestRecords() {
    }

    public static InteractionRecord record(String userId, String query, Duration age) {
        return record(userId, query, "Here is how to do it.", age);
    }

    public static InteractionRecord record(String userId, String query, String response, Duration age) {
        return InteractionRecord.builder()
                .id("rec-" + SEQUENCE.incrementAndGet())
                .userId(userId)
                .projectId("proj-1")
                .projectName("Pulse")
                .queryText(query)
                .responseText(response)
                .timestamp(NOW.minus(age))
                .completionStatus(response != null ? CompletionStatus.COMPLETED : CompletionStatus.PENDING)
                .build();
    }

    public static InteractionRecord pending(String userId, String query, Duration age) {
        return record(userId, query, null, age);
    }
}
