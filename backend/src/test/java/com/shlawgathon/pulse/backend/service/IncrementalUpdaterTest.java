package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;

import static com.shlawgathon.pulse.backend.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IncrementalUpdaterTest {

    private final TeamStatusService teamStatusService = mock(TeamStatusService.class);
    private IncrementalUpdater updater;

    @AfterEach
    void tearDown() {
        if (updater != null) {
            updater.stop();
        }
    }

    @Test
    void shouldApplyOfferedRecordsInArrivalOrder() {
        // Given
        updater = new IncrementalUpdater(teamStatusService, new PulseProperties());
        updater.start();
        InteractionRecord first = record("alice", "add login", Duration.ofMinutes(2));
        InteractionRecord second = record("alice", "error on login", Duration.ofMinutes(1));

        // When
        assertTrue(updater.offer(first));
        assertTrue(updater.offer(second));

        // Then
        verify(teamStatusService, timeout(2000)).applyRecord(second);
        InOrder order = inOrder(teamStatusService);
        order.verify(teamStatusService).applyRecord(first);
        order.verify(teamStatusService).applyRecord(second);
    }

    @Test
    void shouldKeepConsumingAfterFailure() {
        updater = new IncrementalUpdater(teamStatusService, new PulseProperties());
        InteractionRecord broken = record("alice", "add login", Duration.ofMinutes(2));
        InteractionRecord next = record("bob", "add search", Duration.ofMinutes(1));
        when(teamStatusService.applyRecord(broken)).thenThrow(new IllegalStateException("boom"));
        updater.start();

        updater.offer(broken);
        updater.offer(next);

        verify(teamStatusService, timeout(2000)).applyRecord(next);
    }

    @Test
    void shouldRejectRecordsWhenChannelIsFull() {
        PulseProperties properties = new PulseProperties();
        properties.getUpdates().setQueueCapacity(1);
        updater = new IncrementalUpdater(teamStatusService, properties);

        assertTrue(updater.offer(record("alice", "one", Duration.ofMinutes(2))));
        assertFalse(updater.offer(record("alice", "two", Duration.ofMinutes(1))));
        assertEquals(1, updater.pending());
    }

    @Test
    void shouldStopConsumerThread() {
        updater = new IncrementalUpdater(teamStatusService, new PulseProperties());
        updater.start();
        assertTrue(updater.isRunning());

        updater.stop();

        assertFalse(updater.isRunning());
    }
}
