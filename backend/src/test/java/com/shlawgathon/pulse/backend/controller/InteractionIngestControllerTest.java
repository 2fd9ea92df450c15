package com.shlawgathon.pulse.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.dto.IngestInteractionRequest;
import com.shlawgathon.pulse.backend.dto.InteractionRecordResponse;
import com.shlawgathon.pulse.backend.exception.GlobalExceptionHandler;
import com.shlawgathon.pulse.backend.model.CompletionStatus;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.service.InteractionRecordService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class InteractionIngestControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private InteractionRecordService interactionRecordService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        interactionRecordService = mock(InteractionRecordService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new InteractionIngestController(interactionRecordService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldStoreInteraction() throws Exception {
        InteractionRecord stored = InteractionRecord.builder()
                .id("rec-1")
                .userId("alice")
                .projectId("proj-1")
                .queryText("add search")
                .completionStatus(CompletionStatus.PENDING)
                .build();
        when(interactionRecordService.ingest(any())).thenReturn(stored);
        when(interactionRecordService.toResponse(stored)).thenReturn(InteractionRecordResponse.builder()
                .id("rec-1")
                .userId("alice")
                .projectId("proj-1")
                .queryText("add search")
                .completionStatus(CompletionStatus.PENDING)
                .build());

        IngestInteractionRequest request = IngestInteractionRequest.builder()
                .userId("alice")
                .projectId("proj-1")
                .queryText("add search")
                .build();

        mockMvc.perform(post("/internal/interactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("rec-1"))
                .andExpect(jsonPath("$.completionStatus").value("PENDING"));
    }

    @Test
    void shouldRejectMissingUserId() throws Exception {
        IngestInteractionRequest request = IngestInteractionRequest.builder()
                .projectId("proj-1")
                .queryText("add search")
                .build();

        mockMvc.perform(post("/internal/interactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation failed"));

        verifyNoInteractions(interactionRecordService);
    }
}
