package com.shlawgathon.pulse.backend.controller;

import com.shlawgathon.pulse.backend.dto.IngestInteractionRequest;
import com.shlawgathon.pulse.backend.dto.InteractionRecordResponse;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.service.InteractionRecordService;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal controller for interaction turns.
 * Used by the assistant hook to submit every query/response pair.
 */
@RestController
@RequestMapping("/internal/interactions")
@Tag(name = "Internal", description = "Internal callbacks from the assistant hook")
@Hidden
public class InteractionIngestController {

    private final InteractionRecordService interactionRecordService;

    public InteractionIngestController(InteractionRecordService interactionRecordService) {
        this.interactionRecordService = interactionRecordService;
    }

    @PostMapping
    @Operation(summary = "Submit interaction", description = "Store a turn and announce it to every pod")
    public ResponseEntity<InteractionRecordResponse> submit(@Valid @RequestBody IngestInteractionRequest request) {
        InteractionRecord record = interactionRecordService.ingest(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(interactionRecordService.toResponse(record));
    }
}
