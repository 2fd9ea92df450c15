package com.shlawgathon.pulse.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.exception.LlmInvocationException;
import com.shlawgathon.pulse.backend.model.DeveloperMood;
import com.shlawgathon.pulse.backend.model.DeveloperStatus;
import com.shlawgathon.pulse.backend.model.DigestSource;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.ProductivityLevel;
import com.shlawgathon.pulse.backend.model.StatusInsight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads a developer's latest conversations through the LLM and returns a
 * {@link StatusInsight}. Any failure yields a keyword-based insight instead.
 */
@Component
public class StatusInsightGenerator {

    private static final Logger log = LoggerFactory.getLogger(StatusInsightGenerator.class);

    public static final double FALLBACK_CONFIDENCE = 0.5;
    static final String FALLBACK_REASON = "Fallback analysis (LLM unavailable)";

    static final int FALLBACK_SAMPLE_SIZE = 3;
    static final int MAX_TOPICS = 3;
    static final List<String> TOPIC_KEYWORDS = List.of(
            "react", "component", "api", "database", "auth", "ui", "bug", "feature", "test");

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final LlmCompletionClient llmCompletionClient;
    private final StatusInsightSchema statusInsightSchema;
    private final ObjectMapper objectMapper;
    private final PulseProperties.Insights settings;
    private final ZoneId zone;

    public StatusInsightGenerator(LlmCompletionClient llmCompletionClient,
            StatusInsightSchema statusInsightSchema,
            ObjectMapper objectMapper,
            PulseProperties properties) {
        this.llmCompletionClient = llmCompletionClient;
        this.statusInsightSchema = statusInsightSchema;
        this.objectMapper = objectMapper;
        this.settings = properties.getInsights();
        this.zone = properties.getTimeline().getZone();
    }

    /**
     * Never throws for LLM failures and never returns null.
     *
     * @param records the developer's records, newest first
     */
    public StatusInsight analyze(String userId, List<InteractionRecord> records) {
        String raw;
        try {
            raw = llmCompletionClient.complete(buildPrompt(records), statusInsightSchema.schema());
        } catch (LlmInvocationException e) {
            log.warn("[INSIGHT] LLM call for user: {} failed, using fallback: {}",
                    userId, e.isRateLimited() ? "rate limited" : e.getMessage());
            return fallback(userId, records);
        } catch (RuntimeException e) {
            log.warn("[INSIGHT] LLM client failed for user: {}, using fallback", userId, e);
            return fallback(userId, records);
        }

        String json = DigestResponseParser.extractJsonObject(raw);
        if (json == null) {
            log.warn("[INSIGHT] No JSON object in reply for user: {}, using fallback", userId);
            return fallback(userId, records);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[INSIGHT] Malformed reply for user: {}, using fallback: {}", userId, e.getOriginalMessage());
            return fallback(userId, records);
        }
        List<String> violations = statusInsightSchema.validate(node);
        if (!violations.isEmpty()) {
            log.warn("[INSIGHT] Reply for user: {} failed validation, using fallback: {}",
                    userId, String.join("; ", violations));
            return fallback(userId, records);
        }

        DeveloperStatus status = DeveloperStatus.valueOf(upper(node.get(StatusInsightSchema.STATUS)));
        DeveloperMood mood = DeveloperMood.valueOf(upper(node.get(StatusInsightSchema.MOOD)));
        List<String> topics = new ArrayList<>();
        node.get(StatusInsightSchema.TOPICS).forEach(topic -> topics.add(topic.asText()));

        return StatusInsight.builder()
                .userId(userId)
                .enhancedStatus(status)
                .confidence(node.get(StatusInsightSchema.CONFIDENCE).asDouble())
                .statusReason(node.get(StatusInsightSchema.REASON).asText())
                .keyTopics(topics)
                .mood(mood)
                .productivity(ProductivityLevel.valueOf(upper(node.get(StatusInsightSchema.PRODUCTIVITY))))
                .recommendations(recommendationsFor(status, mood))
                .source(DigestSource.LLM)
                .build();
    }

    String buildPrompt(List<InteractionRecord> records) {
        StringBuilder conversations = new StringBuilder();
        int count = Math.min(records.size(), settings.getPromptRecords());
        for (int i = 0; i < count; i++) {
            InteractionRecord record = records.get(i);
            String timestamp = record.getTimestamp() != null
                    ? TIMESTAMP_FORMAT.format(record.getTimestamp().atZone(zone))
                    : "unknown";
            conversations.append(i + 1).append(". Query: \"")
                    .append(Objects.toString(record.getQueryText(), "")).append("\"\n")
                    .append("Response: \"")
                    .append(TextUtils.truncate(Objects.toString(record.getResponseText(), ""),
                            settings.getResponseMaxLength()))
                    .append("\"\n")
                    .append("Time: ").append(timestamp).append('\n')
                    .append("---\n");
        }

        return """
                You are analyzing a developer's recent conversations with an AI assistant. \
                Determine their current work state.

                Recent conversations (most recent first):
                %s
                Status definitions:
                - flow: making steady progress, asking for implementation help
                - problem_solving: multiple attempts, debugging, trying different approaches
                - blocked: stuck on errors, asking for help with the same issue repeatedly
                - idle: no recent meaningful development activity

                Reply with one JSON object following schema %s.
                """.formatted(conversations, StatusInsightSchema.VERSION);
    }

    /**
     * Keyword reading of the newest records.
     */
    static StatusInsight fallback(String userId, List<InteractionRecord> records) {
        String recentText = records.stream()
                .limit(FALLBACK_SAMPLE_SIZE)
                .map(record -> Objects.toString(record.getQueryText(), "") + " "
                        + Objects.toString(record.getResponseText(), ""))
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);

        DeveloperStatus status = DeveloperStatus.IDLE;
        DeveloperMood mood = DeveloperMood.NEUTRAL;
        if (recentText.contains("error") || recentText.contains("stuck")) {
            status = DeveloperStatus.BLOCKED;
            mood = DeveloperMood.FRUSTRATED;
        } else if (recentText.contains("debug") || recentText.contains("fix")) {
            status = DeveloperStatus.PROBLEM_SOLVING;
            mood = DeveloperMood.FOCUSED;
        } else if (!records.isEmpty()) {
            status = DeveloperStatus.FLOW;
            mood = DeveloperMood.POSITIVE;
        }

        ProductivityLevel productivity = records.size() > 3 ? ProductivityLevel.HIGH
                : records.size() > 1 ? ProductivityLevel.MEDIUM
                : ProductivityLevel.LOW;

        return StatusInsight.builder()
                .userId(userId)
                .enhancedStatus(status)
                .confidence(FALLBACK_CONFIDENCE)
                .statusReason(FALLBACK_REASON)
                .keyTopics(TOPIC_KEYWORDS.stream()
                        .filter(recentText::contains)
                        .limit(MAX_TOPICS)
                        .collect(Collectors.toList()))
                .mood(mood)
                .productivity(productivity)
                .source(DigestSource.FALLBACK)
                .build();
    }

    static List<String> recommendationsFor(DeveloperStatus status, DeveloperMood mood) {
        if (status == DeveloperStatus.BLOCKED && mood == DeveloperMood.FRUSTRATED) {
            return List.of("Consider taking a short break", "Try pair programming or ask for help");
        }
        if (status == DeveloperStatus.FLOW && mood == DeveloperMood.POSITIVE) {
            return List.of("Great momentum! Document your progress", "Consider helping blocked teammates");
        }
        if (status == DeveloperStatus.PROBLEM_SOLVING) {
            return List.of("Break down the problem into smaller parts", "Consider alternative approaches");
        }
        return List.of();
    }

    private static String upper(JsonNode value) {
        return value.asText().toUpperCase(Locale.ROOT);
    }
}
