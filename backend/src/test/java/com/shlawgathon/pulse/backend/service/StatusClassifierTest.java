package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.DeveloperStatus;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.shlawgathon.pulse.backend.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class StatusClassifierTest {

    private final StatusClassifier classifier = new StatusClassifier(new PulseProperties());

    @Test
    void shouldBeIdleWithoutRecentRecords() {
        StatusClassifier.StatusClassification result = classifier.classify(List.of());

        assertEquals(DeveloperStatus.IDLE, result.status());
        assertEquals(StatusClassifier.NO_RECENT_ACTIVITY, result.message());
    }

    @Test
    void shouldBeBlockedWhenEveryRecordMentionsAnError() {
        // Given
        List<InteractionRecord> recent = List.of(
                record("alice", "error when starting the server", Duration.ofMinutes(1)),
                record("alice", "still an error on startup", Duration.ofMinutes(5)),
                record("alice", "same error again", Duration.ofMinutes(9)));

        // When
        StatusClassifier.StatusClassification result = classifier.classify(recent);

        // Then
        assertEquals(DeveloperStatus.BLOCKED, result.status());
        assertTrue(result.blockedScore() > 0.5);
        assertEquals("Blocked: error when starting the server", result.message());
    }

    @Test
    void shouldBeProblemSolvingWithMoreThanThreeProblemRecords() {
        List<InteractionRecord> recent = List.of(
                record("alice", "refactor the parser module", Duration.ofMinutes(1)),
                record("alice", "review this function", Duration.ofMinutes(2)),
                record("alice", "optimize the query", Duration.ofMinutes(3)),
                record("alice", "refactor the loop", Duration.ofMinutes(4)));

        StatusClassifier.StatusClassification result = classifier.classify(recent);

        assertEquals(DeveloperStatus.PROBLEM_SOLVING, result.status());
        assertTrue(result.problemScore() > result.flowScore());
    }

    @Test
    void shouldBeInFlowForSingleBuildRecord() {
        StatusClassifier.StatusClassification result = classifier.classify(List.of(
                record("alice", "implement the login form", Duration.ofMinutes(3))));

        assertEquals(DeveloperStatus.FLOW, result.status());
        assertEquals("In flow: implement the login form", result.message());
    }

    @Test
    void shouldTreatBusyFlowWindowAsChurn() {
        List<InteractionRecord> recent = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            recent.add(record("alice", "add a settings page " + i, Duration.ofMinutes(i + 1)));
        }

        assertEquals(DeveloperStatus.BLOCKED, classifier.classify(recent).status());
    }

    @Test
    void shouldTruncateLongStatusMessage() {
        String query = "implement " + "x".repeat(120);

        String message = classifier.classify(List.of(record("alice", query, Duration.ofMinutes(1)))).message();

        assertEquals("In flow: " + query.substring(0, 80) + "...", message);
    }

    @Test
    void shouldReturnSameResultForSameWindow() {
        List<InteractionRecord> recent = List.of(
                record("alice", "debug the websocket", Duration.ofMinutes(1)),
                record("alice", "create a new endpoint", Duration.ofMinutes(2)));

        assertEquals(classifier.classify(recent), classifier.classify(recent));
    }
}
