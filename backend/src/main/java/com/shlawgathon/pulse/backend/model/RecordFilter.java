package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Query scope for fetching interaction records. Null fields are unconstrained.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordFilter {

    private String userId;

    private String projectId;

    /**
     * Inclusive lower bound.
     */
    private Instant fromTimestamp;

    /**
     * Inclusive upper bound.
     */
    private Instant toTimestamp;

    @Builder.Default
    private int limit = 100;
}
