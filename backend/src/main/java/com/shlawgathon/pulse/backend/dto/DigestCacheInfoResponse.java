package com.shlawgathon.pulse.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "State of the cached digest for a user's current record sample")
public class DigestCacheInfoResponse {

    private String userId;

    @Schema(description = "Cache key derived from the sampled record ids, null without records")
    private String cacheKey;

    private boolean cached;

    private Instant createdAt;

    private Instant expiresAt;

    private long remainingSeconds;

    private int recordsInSample;
}
