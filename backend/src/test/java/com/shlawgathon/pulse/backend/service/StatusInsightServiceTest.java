package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.MutableClock;
import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.DeveloperMood;
import com.shlawgathon.pulse.backend.model.DeveloperState;
import com.shlawgathon.pulse.backend.model.DeveloperStatus;
import com.shlawgathon.pulse.backend.model.DigestSource;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.StatusInsight;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.shlawgathon.pulse.backend.TestRecords.NOW;
import static com.shlawgathon.pulse.backend.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StatusInsightServiceTest {

    private TeamStatusService teamStatusService;
    private StatusInsightGenerator generator;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private StatusInsightService service;

    private final InteractionRecord aliceRecord = record("alice", "stuck on the build error", Duration.ofMinutes(2));
    private final InteractionRecord bobRecord = record("bob", "add search", Duration.ofMinutes(10));

    private final DeveloperState alice = DeveloperState.builder().id("alice").displayName("alice")
            .status(DeveloperStatus.FLOW).statusMessage("In flow: fix the build").lastActive(NOW.minusSeconds(120))
            .build();
    private final DeveloperState bob = DeveloperState.builder().id("bob").displayName("bob")
            .status(DeveloperStatus.FLOW).statusMessage("In flow: add search").lastActive(NOW.minusSeconds(600))
            .build();

    @BeforeEach
    void setUp() {
        PulseProperties properties = new PulseProperties();
        clock = new MutableClock(NOW);
        meterRegistry = new SimpleMeterRegistry();
        teamStatusService = mock(TeamStatusService.class);
        generator = mock(StatusInsightGenerator.class);
        when(generator.analyze(anyString(), anyList()))
                .thenAnswer(invocation -> StatusInsightGenerator.fallback(
                        invocation.getArgument(0), invocation.getArgument(1)));
        service = new StatusInsightService(teamStatusService, new ActivityWindowService(properties), generator,
                new InsightCache(clock, properties, meterRegistry), properties, meterRegistry);
    }

    @Test
    void shouldReplaceStatusAndKeepOriginal() {
        // Given
        when(teamStatusService.allRecords()).thenReturn(List.of(aliceRecord, bobRecord));

        // When
        List<DeveloperState> board = service.enhance(List.of(bob, alice), null, null);

        // Then
        assertEquals("alice", board.get(0).getId());
        DeveloperState enhancedAlice = board.get(0);
        assertEquals(DeveloperStatus.BLOCKED, enhancedAlice.getStatus());
        assertEquals("Fallback analysis (LLM unavailable)", enhancedAlice.getStatusMessage());
        assertEquals(DeveloperStatus.FLOW, enhancedAlice.getOriginalStatus());
        assertEquals("In flow: fix the build", enhancedAlice.getOriginalStatusMessage());
        assertEquals(DeveloperMood.FRUSTRATED, enhancedAlice.getInsight().getMood());
        assertEquals(DeveloperStatus.FLOW, alice.getStatus());
        assertNull(alice.getInsight());
    }

    @Test
    void shouldAnalyzeEachDeveloperOnceForSameRecordSet() {
        when(teamStatusService.allRecords()).thenReturn(List.of(aliceRecord, bobRecord));

        service.enhance(List.of(alice, bob), null, null);
        service.enhance(List.of(alice, bob), null, null);

        verify(generator, times(1)).analyze(eq("alice"), anyList());
        verify(generator, times(1)).analyze(eq("bob"), anyList());
        assertEquals(2.0, meterRegistry.counter("pulse_status_insights_generated", "source", "FALLBACK").count());
    }

    @Test
    void shouldReanalyzeWhenRecordsChangeOrCacheExpires() {
        InteractionRecord newer = record("alice", "add a chart", Duration.ofMinutes(1));
        when(teamStatusService.allRecords())
                .thenReturn(List.of(aliceRecord))
                .thenReturn(List.of(newer, aliceRecord))
                .thenReturn(List.of(newer, aliceRecord));

        service.enhance(List.of(alice), 1L, null);
        service.enhance(List.of(alice), 1L, null);
        clock.advance(Duration.ofSeconds(61));
        service.enhance(List.of(alice), 1L, null);

        verify(generator, times(3)).analyze(eq("alice"), anyList());
    }

    @Test
    void shouldLimitSampleToMaxRecords() {
        when(teamStatusService.allRecords()).thenReturn(List.of(aliceRecord, bobRecord));

        Map<String, StatusInsight> insights = service.getInsights(null, 1);

        assertEquals(List.of("alice"), List.copyOf(insights.keySet()));
        verify(generator, never()).analyze(eq("bob"), anyList());
    }

    @Test
    void shouldUseDefaultSampleForNonPositiveMaxRecords() {
        when(teamStatusService.allRecords()).thenReturn(List.of(aliceRecord, bobRecord));

        assertEquals(2, service.getInsights(null, 0).size());
    }

    @Test
    void shouldLeaveBoardUntouchedWithoutRecords() {
        when(teamStatusService.allRecords()).thenReturn(List.of());
        List<DeveloperState> board = List.of(alice);

        assertSame(board, service.enhance(board, null, null));
        verifyNoInteractions(generator);
    }

    @Test
    void shouldKeepDevelopersWithoutInsight() {
        StatusInsight insight = StatusInsight.builder()
                .userId("bob")
                .enhancedStatus(DeveloperStatus.IDLE)
                .statusReason("No meaningful activity")
                .source(DigestSource.LLM)
                .build();

        List<DeveloperState> board = StatusInsightService.merge(List.of(alice, bob), Map.of("bob", insight));

        assertSame(alice, board.get(0));
        assertEquals(DeveloperStatus.IDLE, board.get(1).getStatus());
        assertEquals(DeveloperStatus.FLOW, board.get(1).getOriginalStatus());
    }
}
