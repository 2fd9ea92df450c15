package com.shlawgathon.pulse.backend.dto;

import com.shlawgathon.pulse.backend.model.CompletionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionRecordResponse {

    private String id;
    private String userId;
    private String projectId;
    private String projectName;
    private String queryText;
    private String responseText;
    private Instant timestamp;
    private CompletionStatus completionStatus;
    private Instant completedAt;
}
