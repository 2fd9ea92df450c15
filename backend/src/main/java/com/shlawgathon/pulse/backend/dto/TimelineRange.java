package com.shlawgathon.pulse.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Scope of a timeline request. Null fields are unconstrained.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineRange {

    private String userId;

    private String projectId;

    private Instant from;

    private Instant to;

    private Integer limit;
}
