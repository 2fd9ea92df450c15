package com.shlawgathon.pulse.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-request digest options. Null values fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestOptions {

    @Builder.Default
    private boolean enabled = true;

    private Long cacheMinutes;

    private Integer maxRecords;
}
