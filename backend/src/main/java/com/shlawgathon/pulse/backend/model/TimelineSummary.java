package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineSummary {

    private int totalEvents;

    private long productiveHours;

    @Builder.Default
    private List<TimelineCategory> focusAreas = new ArrayList<>();

    @Builder.Default
    private List<String> topTechnologies = new ArrayList<>();

    private CollaborationLevel collaborationLevel;

    private TimelineMomentum overallMomentum;
}
