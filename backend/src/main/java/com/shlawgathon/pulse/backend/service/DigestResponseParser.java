package com.shlawgathon.pulse.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.model.DigestMomentum;
import com.shlawgathon.pulse.backend.model.DigestResult;
import com.shlawgathon.pulse.backend.model.DigestSource;
import com.shlawgathon.pulse.backend.model.TechnicalDepth;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses raw completion text into a {@link DigestOutcome}.
 * Fields are only read after the reply passed schema validation.
 */
@Component
public class DigestResponseParser {

    private final ObjectMapper objectMapper;
    private final DigestSchema digestSchema;

    public DigestResponseParser(ObjectMapper objectMapper, DigestSchema digestSchema) {
        this.objectMapper = objectMapper;
        this.digestSchema = digestSchema;
    }

    public DigestOutcome parse(String raw, String userId, int recordsAnalyzed, Instant generatedAt) {
        String json = extractJsonObject(raw);
        if (json == null) {
            return DigestOutcome.schemaError("no JSON object in reply");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return DigestOutcome.schemaError("malformed JSON: " + e.getOriginalMessage());
        }

        List<String> violations = digestSchema.validate(node);
        if (!violations.isEmpty()) {
            return DigestOutcome.schemaError(String.join("; ", violations));
        }

        DigestResult digest = DigestResult.builder()
                .userId(userId)
                .generatedAt(generatedAt)
                .recentFocus(node.get(DigestSchema.RECENT_FOCUS).asText())
                .activitySummary(node.get(DigestSchema.ACTIVITY_SUMMARY).asText())
                .keyLearnings(textList(node.get(DigestSchema.KEY_LEARNINGS)))
                .progressHighlights(textList(node.get(DigestSchema.PROGRESS_HIGHLIGHTS)))
                .currentMomentum(DigestMomentum.valueOf(upper(node.get(DigestSchema.CURRENT_MOMENTUM))))
                .learningTrajectory(node.get(DigestSchema.LEARNING_TRAJECTORY).asText())
                .problemSolvingApproach(node.get(DigestSchema.PROBLEM_SOLVING_APPROACH).asText())
                .collaborationPatterns(node.get(DigestSchema.COLLABORATION_PATTERNS).asText())
                .growthAreas(textList(node.get(DigestSchema.GROWTH_AREAS)))
                .technicalDepth(TechnicalDepth.valueOf(upper(node.get(DigestSchema.TECHNICAL_DEPTH))))
                .confidenceScore(node.get(DigestSchema.CONFIDENCE_SCORE).asDouble())
                .source(DigestSource.LLM)
                .recordsAnalyzed(recordsAnalyzed)
                .build();
        return DigestOutcome.ok(digest);
    }

    /**
     * The outermost {...} span of the reply, tolerating code fences and prose around it.
     */
    static String extractJsonObject(String raw) {
        if (raw == null) {
            return null;
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return raw.substring(start, end + 1);
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(item -> values.add(item.asText()));
        return values;
    }

    private static String upper(JsonNode value) {
        return value.asText().toUpperCase(Locale.ROOT);
    }
}
