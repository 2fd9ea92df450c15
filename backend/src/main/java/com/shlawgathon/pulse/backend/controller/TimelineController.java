package com.shlawgathon.pulse.backend.controller;

import com.shlawgathon.pulse.backend.dto.TimelineRange;
import com.shlawgathon.pulse.backend.model.TimelineAnalysis;
import com.shlawgathon.pulse.backend.service.TimelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/timeline")
@Tag(name = "Timeline", description = "Categorized development timeline")
public class TimelineController {

    private final TimelineService timelineService;

    public TimelineController(TimelineService timelineService) {
        this.timelineService = timelineService;
    }

    @GetMapping
    @Operation(summary = "Get timeline analysis", description = "Events grouped by day with summary, patterns and recommendations")
    public ResponseEntity<TimelineAnalysis> getTimeline(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String projectId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Integer limit) {

        if (from != null && to != null && from.isAfter(to)) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(timelineService.getTimelineAnalysis(TimelineRange.builder()
                .userId(userId)
                .projectId(projectId)
                .from(from)
                .to(to)
                .limit(limit)
                .build()));
    }
}
