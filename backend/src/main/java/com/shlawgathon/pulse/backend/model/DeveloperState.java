package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derived live status for one developer. Never persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeveloperState {

    private String id;

    private String displayName;

    private String initials;

    private DeveloperStatus status;

    private String statusMessage;

    @Builder.Default
    private List<TaskRecord> currentTasks = new ArrayList<>();

    private int totalInteractionsToday;

    private int completedToday;

    private Instant lastActive;

    /**
     * LLM reading of the recent conversation, present only on an enhanced board.
     */
    private StatusInsight insight;

    /**
     * Heuristic status before an insight replaced it.
     */
    private DeveloperStatus originalStatus;

    private String originalStatusMessage;
}
