package com.shlawgathon.pulse.backend.dto;

import com.shlawgathon.pulse.backend.model.CompletionStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO posted by the assistant hook for every chat turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Interaction turn submitted by the assistant hook")
public class IngestInteractionRequest {

    @Schema(description = "Client-side id, generated when absent")
    private String id;

    @NotBlank
    @Schema(description = "Developer id")
    private String userId;

    @NotBlank
    @Schema(description = "Project id")
    private String projectId;

    private String projectName;

    @NotBlank
    @Schema(description = "Developer query text")
    private String queryText;

    @Schema(description = "Assistant response, empty while pending")
    private String responseText;

    @Schema(description = "Interaction time, defaults to server time")
    private Instant timestamp;

    private CompletionStatus completionStatus;

    @Schema(description = "When the assistant finished responding")
    private Instant completedAt;
}
