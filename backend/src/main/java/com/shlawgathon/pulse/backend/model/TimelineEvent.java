package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Categorized activity derived from one interaction record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEvent {

    private String id;

    private String userId;

    private Instant timestamp;

    private LocalDate date;

    /**
     * Local wall-clock time, "HH:mm".
     */
    private String time;

    private TimelineEventType type;

    private TimelineCategory category;

    private TimelineImpact impact;

    private TimelineEventStatus status;

    private String title;

    private String description;

    private int durationMinutes;

    @Builder.Default
    private List<String> technologies = new ArrayList<>();

    @Builder.Default
    private List<String> filesTouched = new ArrayList<>();

    @Builder.Default
    private List<String> challenges = new ArrayList<>();

    @Builder.Default
    private List<String> learningPoints = new ArrayList<>();

    private EventSentiment sentiment;

    private TechnicalDepth complexity;

    private String focus;
}
