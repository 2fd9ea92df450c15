package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Interaction counts of one developer over a timeframe.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityMetrics {

    private String userId;

    private ActivityTimeframe timeframe;

    private Instant from;

    private int totalInteractions;

    private int completedInteractions;

    /**
     * Completed over total, 0 when there were no interactions.
     */
    private double completionRate;

    private int projectsWorkedOn;

    /**
     * Topic labels in order of first appearance.
     */
    @Builder.Default
    private List<String> topics = new ArrayList<>();

    /**
     * Mean seconds from query to completed response, over records that carry
     * a completion time. 0 when none do.
     */
    private long averageResponseSeconds;

    private Instant generatedAt;
}
