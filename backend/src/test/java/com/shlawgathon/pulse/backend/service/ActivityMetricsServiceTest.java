package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.MutableClock;
import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.exception.RecordStoreUnavailableException;
import com.shlawgathon.pulse.backend.model.ActivityMetrics;
import com.shlawgathon.pulse.backend.model.ActivityTimeframe;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.RecordFilter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static com.shlawgathon.pulse.backend.TestRecords.NOW;
import static com.shlawgathon.pulse.backend.TestRecords.pending;
import static com.shlawgathon.pulse.backend.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ActivityMetricsServiceTest {

    private InteractionRecordService interactionRecordService;
    private TeamStatusService teamStatusService;
    private MutableClock clock;
    private ActivityMetricsService service;

    @BeforeEach
    void setUp() {
        PulseProperties properties = new PulseProperties();
        clock = new MutableClock(NOW);
        interactionRecordService = mock(InteractionRecordService.class);
        teamStatusService = mock(TeamStatusService.class);
        service = new ActivityMetricsService(interactionRecordService, teamStatusService,
                new InsightCache(clock, properties, new SimpleMeterRegistry()), properties, clock);
    }

    @Test
    void shouldSummarizeInteractions() {
        // Given
        InteractionRecord answered = record("alice", "write a test for the api endpoint", Duration.ofMinutes(30));
        answered.setCompletedAt(answered.getTimestamp().plusSeconds(20));
        InteractionRecord quick = record("alice", "react component props", Duration.ofMinutes(10));
        quick.setCompletedAt(quick.getTimestamp().plusSeconds(10));
        quick.setProjectId("proj-2");
        InteractionRecord waiting = pending("alice", "fix the sql error", Duration.ofMinutes(1));
        when(interactionRecordService.fetchRecords(any())).thenReturn(List.of(waiting, quick, answered));

        // When
        ActivityMetrics metrics = service.getMetrics("alice", ActivityTimeframe.WEEK);

        // Then
        assertEquals(3, metrics.getTotalInteractions());
        assertEquals(2, metrics.getCompletedInteractions());
        assertEquals(2.0 / 3, metrics.getCompletionRate(), 1e-9);
        assertEquals(2, metrics.getProjectsWorkedOn());
        assertEquals(List.of("API Development", "Testing", "React", "Database", "Debugging"), metrics.getTopics());
        assertEquals(15, metrics.getAverageResponseSeconds());
        assertEquals(NOW.minus(Duration.ofDays(7)), metrics.getFrom());
        assertEquals(NOW, metrics.getGeneratedAt());
    }

    @Test
    void shouldReportZeroesWithoutInteractions() {
        when(interactionRecordService.fetchRecords(any())).thenReturn(List.of());

        ActivityMetrics metrics = service.getMetrics("alice", ActivityTimeframe.MONTH);

        assertEquals(0, metrics.getTotalInteractions());
        assertEquals(0.0, metrics.getCompletionRate());
        assertEquals(0, metrics.getAverageResponseSeconds());
        assertTrue(metrics.getTopics().isEmpty());
    }

    @Test
    void shouldStartDayAtLocalMidnight() {
        when(interactionRecordService.fetchRecords(any())).thenReturn(List.of());

        service.getMetrics("alice", ActivityTimeframe.DAY);

        ArgumentCaptor<RecordFilter> filter = ArgumentCaptor.forClass(RecordFilter.class);
        verify(interactionRecordService).fetchRecords(filter.capture());
        assertEquals("alice", filter.getValue().getUserId());
        assertEquals(Instant.parse("2026-03-10T00:00:00Z"), filter.getValue().getFromTimestamp());
        assertEquals(1000, filter.getValue().getLimit());
    }

    @Test
    void shouldCachePerUserAndTimeframe() {
        when(interactionRecordService.fetchRecords(any())).thenReturn(List.of());

        ActivityMetrics first = service.getMetrics("alice", ActivityTimeframe.DAY);
        ActivityMetrics second = service.getMetrics("alice", ActivityTimeframe.DAY);
        service.getMetrics("alice", ActivityTimeframe.WEEK);
        clock.advance(Duration.ofMinutes(11));
        service.getMetrics("alice", ActivityTimeframe.DAY);

        assertSame(first, second);
        verify(interactionRecordService, times(3)).fetchRecords(any());
    }

    @Test
    void shouldUseInMemoryRecordsWithoutCachingWhenStoreIsUnavailable() {
        // Given
        when(interactionRecordService.fetchRecords(any()))
                .thenThrow(new RecordStoreUnavailableException("down",
                        new DataAccessResourceFailureException("connection refused")))
                .thenReturn(List.of());
        when(teamStatusService.recordsFor("alice")).thenReturn(List.of(
                record("alice", "add search", Duration.ofMinutes(5)),
                record("alice", "add login", Duration.ofDays(2))));

        // When
        ActivityMetrics degraded = service.getMetrics("alice", ActivityTimeframe.DAY);
        ActivityMetrics recovered = service.getMetrics("alice", ActivityTimeframe.DAY);

        // Then
        assertEquals(1, degraded.getTotalInteractions());
        assertEquals(0, recovered.getTotalInteractions());
        verify(interactionRecordService, times(2)).fetchRecords(any());
    }

    @Test
    void shouldParseTimeframeIgnoringCase() {
        assertEquals(Optional.of(ActivityTimeframe.WEEK), ActivityTimeframe.parse(" Week "));
        assertEquals(Optional.empty(), ActivityTimeframe.parse("year"));
        assertEquals(Optional.empty(), ActivityTimeframe.parse(null));
    }

    @Test
    void shouldStartDayAtMidnightOfConfiguredZone() {
        Instant start = ActivityTimeframe.DAY.startAt(NOW, ZoneId.of("America/Los_Angeles"));

        assertEquals(Instant.parse("2026-03-10T07:00:00Z"), start);
    }
}
