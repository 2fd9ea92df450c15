package com.shlawgathon.pulse.backend.controller;

import com.shlawgathon.pulse.backend.dto.DigestCacheInfoResponse;
import com.shlawgathon.pulse.backend.dto.DigestOptions;
import com.shlawgathon.pulse.backend.model.ActivityMetrics;
import com.shlawgathon.pulse.backend.model.ActivityTimeframe;
import com.shlawgathon.pulse.backend.model.DigestResult;
import com.shlawgathon.pulse.backend.service.ActivityMetricsService;
import com.shlawgathon.pulse.backend.service.DigestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/api/insights")
@Tag(name = "Insights", description = "AI-generated developer digests")
public class InsightsController {

    private final DigestService digestService;
    private final ActivityMetricsService activityMetricsService;

    public InsightsController(DigestService digestService, ActivityMetricsService activityMetricsService) {
        this.digestService = digestService;
        this.activityMetricsService = activityMetricsService;
    }

    @GetMapping("/{userId}/digest")
    @Operation(summary = "Get digest", description = "Digest of the user's recent records, 204 when there is nothing to analyze")
    public ResponseEntity<DigestResult> getDigest(
            @PathVariable String userId,
            @RequestParam(defaultValue = "true") boolean enabled,
            @RequestParam(required = false) Long cacheMinutes,
            @RequestParam(required = false) Integer maxRecords) {

        DigestResult digest = digestService.getDigest(userId, DigestOptions.builder()
                .enabled(enabled)
                .cacheMinutes(cacheMinutes)
                .maxRecords(maxRecords)
                .build());
        if (digest == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(digest);
    }

    @GetMapping("/{userId}/digest/cache")
    @Operation(summary = "Get digest cache info", description = "Whether the digest for the current sample is cached")
    public ResponseEntity<DigestCacheInfoResponse> getCacheInfo(
            @PathVariable String userId,
            @RequestParam(required = false) Integer maxRecords) {
        return ResponseEntity.ok(digestService.getCacheInfo(userId, DigestOptions.builder()
                .maxRecords(maxRecords)
                .build()));
    }

    @GetMapping("/{userId}/activity")
    @Operation(summary = "Get activity metrics", description = "Interaction counts for day, week or month, 400 for any other timeframe")
    public ResponseEntity<ActivityMetrics> getActivity(
            @PathVariable String userId,
            @RequestParam(defaultValue = "day") String timeframe) {
        Optional<ActivityTimeframe> parsed = ActivityTimeframe.parse(timeframe);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(activityMetricsService.getMetrics(userId, parsed.get()));
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Clear insight cache")
    public ResponseEntity<Void> clearCache() {
        digestService.clearCache();
        return ResponseEntity.noContent().build();
    }
}
