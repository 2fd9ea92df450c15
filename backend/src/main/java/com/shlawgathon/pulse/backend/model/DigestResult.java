package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Narrative insight for one developer.
 * Carries the eleven contract fields plus provenance metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestResult {

    private String userId;

    private Instant generatedAt;

    private String recentFocus;

    private String activitySummary;

    @Builder.Default
    private List<String> keyLearnings = new ArrayList<>();

    @Builder.Default
    private List<String> progressHighlights = new ArrayList<>();

    private DigestMomentum currentMomentum;

    private String learningTrajectory;

    private String problemSolvingApproach;

    private String collaborationPatterns;

    @Builder.Default
    private List<String> growthAreas = new ArrayList<>();

    private TechnicalDepth technicalDepth;

    /**
     * 0..1. Fallback digests never exceed 0.4.
     */
    private double confidenceScore;

    private DigestSource source;

    private int recordsAnalyzed;
}
