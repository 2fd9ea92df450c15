package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.dto.TimelineRange;
import com.shlawgathon.pulse.backend.exception.RecordStoreUnavailableException;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.RecordFilter;
import com.shlawgathon.pulse.backend.model.TimelineAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class TimelineService {

    private static final Logger log = LoggerFactory.getLogger(TimelineService.class);

    static final String OPERATION = "timeline";

    private final InteractionRecordService interactionRecordService;
    private final TeamStatusService teamStatusService;
    private final TimelineAnalyzer timelineAnalyzer;
    private final InsightCache insightCache;
    private final PulseProperties.Timeline settings;
    private final Clock clock;

    public TimelineService(InteractionRecordService interactionRecordService,
            TeamStatusService teamStatusService,
            TimelineAnalyzer timelineAnalyzer,
            InsightCache insightCache,
            PulseProperties properties,
            Clock clock) {
        this.interactionRecordService = interactionRecordService;
        this.teamStatusService = teamStatusService;
        this.timelineAnalyzer = timelineAnalyzer;
        this.insightCache = insightCache;
        this.settings = properties.getTimeline();
        this.clock = clock;
    }

    /**
     * Timeline analysis of the records in range. Never null.
     */
    public TimelineAnalysis getTimelineAnalysis(TimelineRange range) {
        List<InteractionRecord> records = loadRecords(range);
        if (records.isEmpty()) {
            return timelineAnalyzer.emptyAnalysis();
        }

        String key = InsightCache.fingerprint(OPERATION, records.stream()
                .map(InteractionRecord::getId)
                .collect(Collectors.toList()));
        return insightCache.getOrCompute(key, settings.getCacheTtl(), () -> {
            log.debug("[TIMELINE] Analyzing {} records | user: {}", records.size(), range.getUserId());
            return timelineAnalyzer.analyze(timelineAnalyzer.toEvents(records, clock.instant()));
        });
    }

    List<InteractionRecord> loadRecords(TimelineRange range) {
        int limit = range.getLimit() != null && range.getLimit() > 0 ? range.getLimit() : settings.getDefaultLimit();
        try {
            return interactionRecordService.fetchRecords(RecordFilter.builder()
                    .userId(range.getUserId())
                    .projectId(range.getProjectId())
                    .fromTimestamp(range.getFrom())
                    .toTimestamp(range.getTo())
                    .limit(limit)
                    .build());
        } catch (RecordStoreUnavailableException e) {
            log.warn("[TIMELINE] Store unavailable, using in-memory records: {}", e.getMessage());
            List<InteractionRecord> source = range.getUserId() != null
                    ? teamStatusService.recordsFor(range.getUserId())
                    : teamStatusService.allRecords();
            return source.stream()
                    .filter(record -> range.getProjectId() == null || range.getProjectId().equals(record.getProjectId()))
                    .filter(record -> inRange(record.getTimestamp(), range.getFrom(), range.getTo()))
                    .limit(limit)
                    .collect(Collectors.toList());
        }
    }

    private static boolean inRange(Instant timestamp, Instant from, Instant to) {
        if (timestamp == null) {
            return false;
        }
        return (from == null || !timestamp.isBefore(from)) && (to == null || !timestamp.isAfter(to));
    }
}
