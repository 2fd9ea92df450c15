package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Timeline events of one calendar day, newest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineDay {

    private LocalDate date;

    private int eventCount;

    private int totalMinutes;

    private TimelineEventType dominantType;

    @Builder.Default
    private List<TimelineEvent> events = new ArrayList<>();
}
