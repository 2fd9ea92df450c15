package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.exception.RecordStoreUnavailableException;
import com.shlawgathon.pulse.backend.model.ActivityMetrics;
import com.shlawgathon.pulse.backend.model.ActivityTimeframe;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.RecordFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-developer activity counts over a day, week or month. Results computed
 * from the store are cached per user and timeframe; results computed from the
 * in-memory records while the store is down are not.
 */
@Service
public class ActivityMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ActivityMetricsService.class);

    static final String OPERATION = "activity";

    private final InteractionRecordService interactionRecordService;
    private final TeamStatusService teamStatusService;
    private final InsightCache insightCache;
    private final PulseProperties.Metrics settings;
    private final ZoneId zone;
    private final Clock clock;

    public ActivityMetricsService(InteractionRecordService interactionRecordService,
            TeamStatusService teamStatusService,
            InsightCache insightCache,
            PulseProperties properties,
            Clock clock) {
        this.interactionRecordService = interactionRecordService;
        this.teamStatusService = teamStatusService;
        this.insightCache = insightCache;
        this.settings = properties.getMetrics();
        this.zone = properties.getTimeline().getZone();
        this.clock = clock;
    }

    public ActivityMetrics getMetrics(String userId, ActivityTimeframe timeframe) {
        Instant now = clock.instant();
        Instant from = timeframe.startAt(now, zone);

        ActivityMetrics metrics = insightCache.getOrCompute(cacheKey(userId, timeframe), settings.getCacheTtl(), () -> {
            try {
                List<InteractionRecord> records = interactionRecordService.fetchRecords(RecordFilter.builder()
                        .userId(userId)
                        .fromTimestamp(from)
                        .limit(settings.getFetchLimit())
                        .build());
                return calculate(userId, timeframe, from, records, now);
            } catch (RecordStoreUnavailableException e) {
                return null;
            }
        });
        if (metrics != null) {
            return metrics;
        }

        log.warn("[METRICS] Store unavailable, computing {} metrics for user: {} from in-memory records",
                timeframe, userId);
        List<InteractionRecord> recent = teamStatusService.recordsFor(userId).stream()
                .filter(record -> record.getTimestamp() != null && !record.getTimestamp().isBefore(from))
                .collect(Collectors.toList());
        return calculate(userId, timeframe, from, recent, now);
    }

    static String cacheKey(String userId, ActivityTimeframe timeframe) {
        return OPERATION + ":" + userId + ":" + timeframe.name().toLowerCase(Locale.ROOT);
    }

    static ActivityMetrics calculate(String userId, ActivityTimeframe timeframe, Instant from,
            List<InteractionRecord> records, Instant now) {
        int total = records.size();
        List<InteractionRecord> completed = records.stream()
                .filter(InteractionRecord::isCompleted)
                .collect(Collectors.toList());
        double completionRate = total == 0 ? 0.0 : (double) completed.size() / total;
        int projects = (int) records.stream()
                .map(InteractionRecord::getProjectId)
                .filter(Objects::nonNull)
                .distinct()
                .count();

        return ActivityMetrics.builder()
                .userId(userId)
                .timeframe(timeframe)
                .from(from)
                .totalInteractions(total)
                .completedInteractions(completed.size())
                .completionRate(completionRate)
                .projectsWorkedOn(projects)
                .topics(topics(records))
                .averageResponseSeconds(averageResponseSeconds(completed))
                .generatedAt(now)
                .build();
    }

    /**
     * Topic labels read from the queries, oldest first.
     */
    static List<String> topics(List<InteractionRecord> records) {
        Set<String> topics = new LinkedHashSet<>();
        records.stream()
                .filter(record -> record.getQueryText() != null)
                .sorted(ActivityWindowService.NEWEST_FIRST.reversed())
                .map(record -> record.getQueryText().toLowerCase(Locale.ROOT))
                .forEach(query -> {
                    if (query.contains("react") || query.contains("component")) {
                        topics.add("React");
                    }
                    if (query.contains("api") || query.contains("endpoint")) {
                        topics.add("API Development");
                    }
                    if (query.contains("database") || query.contains("sql")) {
                        topics.add("Database");
                    }
                    if (query.contains("test")) {
                        topics.add("Testing");
                    }
                    if (query.contains("bug") || query.contains("error")) {
                        topics.add("Debugging");
                    }
                });
        return new ArrayList<>(topics);
    }

    private static long averageResponseSeconds(List<InteractionRecord> completed) {
        List<Duration> durations = completed.stream()
                .filter(record -> record.getTimestamp() != null && record.getCompletedAt() != null)
                .map(record -> Duration.between(record.getTimestamp(), record.getCompletedAt()))
                .filter(duration -> !duration.isNegative())
                .collect(Collectors.toList());
        if (durations.isEmpty()) {
            return 0;
        }
        double totalMillis = durations.stream().mapToLong(Duration::toMillis).sum();
        return Math.round(totalMillis / durations.size() / 1000.0);
    }
}
