package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-developer status assessment produced from the latest conversations.
 * Merged onto the heuristic board when enhancement is requested.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusInsight {

    private String userId;

    private DeveloperStatus enhancedStatus;

    private double confidence;

    private String statusReason;

    @Builder.Default
    private List<String> keyTopics = new ArrayList<>();

    private DeveloperMood mood;

    private ProductivityLevel productivity;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private DigestSource source;
}
