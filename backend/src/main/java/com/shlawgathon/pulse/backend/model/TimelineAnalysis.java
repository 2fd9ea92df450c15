package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate over a set of timeline events. Recomputed per request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineAnalysis {

    @Builder.Default
    private List<TimelineDay> days = new ArrayList<>();

    private TimelineSummary summary;

    private TimelinePatterns patterns;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
}
