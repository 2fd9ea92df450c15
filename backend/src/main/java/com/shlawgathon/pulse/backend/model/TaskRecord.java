package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A unit of recent work shown on the team board. Derived 1:1 from a recent
 * interaction record and rebuilt on every classification pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRecord {

    /**
     * Same as the source interaction id.
     */
    private String id;

    private String title;

    private TaskPriority priority;

    private String description;

    private String filePathGuess;

    /**
     * Time since the interaction, e.g. "12m" or "2h 5m".
     */
    private String elapsed;

    private Instant sourceTimestamp;
}
