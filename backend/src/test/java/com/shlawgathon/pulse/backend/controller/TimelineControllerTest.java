package com.shlawgathon.pulse.backend.controller;

import com.shlawgathon.pulse.backend.dto.TimelineRange;
import com.shlawgathon.pulse.backend.model.TimelineAnalysis;
import com.shlawgathon.pulse.backend.service.TimelineAnalyzer;
import com.shlawgathon.pulse.backend.service.TimelineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TimelineControllerTest {

    private TimelineService timelineService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        timelineService = mock(TimelineService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new TimelineController(timelineService)).build();
    }

    @Test
    void shouldPassRangeToService() throws Exception {
        when(timelineService.getTimelineAnalysis(any())).thenReturn(TimelineAnalysis.builder()
                .recommendations(List.of(TimelineAnalyzer.EMPTY_RECOMMENDATION))
                .build());

        mockMvc.perform(get("/api/timeline")
                        .param("userId", "alice")
                        .param("projectId", "proj-1")
                        .param("from", "2026-03-01T00:00:00Z")
                        .param("to", "2026-03-10T00:00:00Z")
                        .param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendations[0]").value(TimelineAnalyzer.EMPTY_RECOMMENDATION));

        ArgumentCaptor<TimelineRange> range = ArgumentCaptor.forClass(TimelineRange.class);
        verify(timelineService).getTimelineAnalysis(range.capture());
        assertEquals("alice", range.getValue().getUserId());
        assertEquals("proj-1", range.getValue().getProjectId());
        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), range.getValue().getFrom());
        assertEquals(50, range.getValue().getLimit());
    }

    @Test
    void shouldRejectInvertedRange() throws Exception {
        mockMvc.perform(get("/api/timeline")
                        .param("from", "2026-03-10T00:00:00Z")
                        .param("to", "2026-03-01T00:00:00Z"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(timelineService);
    }
}
