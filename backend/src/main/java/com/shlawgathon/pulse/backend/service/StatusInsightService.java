package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.DeveloperState;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.StatusInsight;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * LLM-enhanced team board. The newest team records are analyzed per developer
 * and the resulting insights replace the heuristic status, keeping the
 * original alongside. Insights are memoized by the analyzed record set.
 */
@Service
public class StatusInsightService {

    private static final Logger log = LoggerFactory.getLogger(StatusInsightService.class);

    static final String OPERATION = "status-insights";

    private final TeamStatusService teamStatusService;
    private final ActivityWindowService activityWindowService;
    private final StatusInsightGenerator statusInsightGenerator;
    private final InsightCache insightCache;
    private final PulseProperties.Insights settings;
    private final MeterRegistry meterRegistry;

    public StatusInsightService(TeamStatusService teamStatusService,
            ActivityWindowService activityWindowService,
            StatusInsightGenerator statusInsightGenerator,
            InsightCache insightCache,
            PulseProperties properties,
            MeterRegistry meterRegistry) {
        this.teamStatusService = teamStatusService;
        this.activityWindowService = activityWindowService;
        this.statusInsightGenerator = statusInsightGenerator;
        this.insightCache = insightCache;
        this.settings = properties.getInsights();
        this.meterRegistry = meterRegistry;
    }

    /**
     * The board with insights merged in, blocked developers first.
     * Developers without an insight are returned unchanged.
     */
    public List<DeveloperState> enhance(List<DeveloperState> board, Long cacheMinutes, Integer maxRecords) {
        if (board.isEmpty()) {
            return board;
        }
        return merge(board, getInsights(cacheMinutes, maxRecords));
    }

    /**
     * Insights per user id over the newest {@code maxRecords} team records.
     */
    public Map<String, StatusInsight> getInsights(Long cacheMinutes, Integer maxRecords) {
        int limit = maxRecords != null && maxRecords > 0 ? maxRecords : settings.getMaxRecords();
        List<InteractionRecord> sample = teamStatusService.allRecords().stream()
                .limit(limit)
                .collect(Collectors.toList());
        if (sample.isEmpty()) {
            return Map.of();
        }

        String key = InsightCache.fingerprint(OPERATION, sample.stream()
                .map(InteractionRecord::getId)
                .collect(Collectors.toList()));
        long minutes = cacheMinutes != null && cacheMinutes > 0 ? cacheMinutes : settings.getCacheMinutes();
        return insightCache.getOrCompute(key, Duration.ofMinutes(minutes), () -> analyzeAll(sample));
    }

    private Map<String, StatusInsight> analyzeAll(List<InteractionRecord> sample) {
        Map<String, StatusInsight> insights = new LinkedHashMap<>();
        activityWindowService.groupByUser(sample).forEach((userId, records) -> {
            StatusInsight insight = statusInsightGenerator.analyze(userId, records);
            meterRegistry.counter("pulse_status_insights_generated", "source", insight.getSource().name()).increment();
            insights.put(userId, insight);
        });
        log.info("[INSIGHT] Analyzed {} developers | records: {}", insights.size(), sample.size());
        return Map.copyOf(insights);
    }

    static List<DeveloperState> merge(List<DeveloperState> board, Map<String, StatusInsight> insights) {
        if (insights.isEmpty()) {
            return board;
        }
        return board.stream()
                .map(state -> {
                    StatusInsight insight = insights.get(state.getId());
                    if (insight == null) {
                        return state;
                    }
                    return state.toBuilder()
                            .status(insight.getEnhancedStatus())
                            .statusMessage(insight.getStatusReason())
                            .insight(insight)
                            .originalStatus(state.getStatus())
                            .originalStatusMessage(state.getStatusMessage())
                            .build();
                })
                .sorted(DeveloperStateAssembler.BOARD_ORDER)
                .collect(Collectors.toList());
    }
}
