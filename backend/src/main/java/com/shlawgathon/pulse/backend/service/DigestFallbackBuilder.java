package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.model.DigestMomentum;
import com.shlawgathon.pulse.backend.model.DigestResult;
import com.shlawgathon.pulse.backend.model.DigestSource;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.TechnicalDepth;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic digest built from keyword density when the LLM path fails.
 * Always fills the full field contract.
 */
@Component
public class DigestFallbackBuilder {

    public static final double FALLBACK_CONFIDENCE = 0.4;

    static final int KEYWORD_SAMPLE_SIZE = 10;

    private static final Pattern FRONTEND = Pattern.compile("react|component|jsx|tsx|css|frontend");
    private static final Pattern BACKEND = Pattern.compile("api|server|database|sql|node|backend");
    private static final Pattern ERRORS = Pattern.compile("error|bug|fix|debug|issue");
    private static final Pattern LEARNING = Pattern.compile("how|what|learn|understand|explain");

    /**
     * @param sample the user's records, newest first
     */
    public DigestResult build(String userId, List<InteractionRecord> sample, Instant now) {
        String recentQueries = sample.stream()
                .limit(KEYWORD_SAMPLE_SIZE)
                .map(InteractionRecord::getQueryText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);

        boolean frontend = FRONTEND.matcher(recentQueries).find();
        boolean backend = BACKEND.matcher(recentQueries).find();
        boolean errors = ERRORS.matcher(recentQueries).find();
        boolean learning = LEARNING.matcher(recentQueries).find();

        String focus = "General development work";
        TechnicalDepth depth = TechnicalDepth.INTERMEDIATE;
        if (frontend && backend) {
            focus = "Full-stack development across frontend and backend";
            depth = TechnicalDepth.ADVANCED;
        } else if (frontend) {
            focus = "Frontend development";
        } else if (backend) {
            focus = "Backend development and API work";
        }

        DigestMomentum momentum = DigestMomentum.MEDIUM;
        if (sample.size() > 20) {
            momentum = DigestMomentum.HIGH;
        } else if (sample.size() < 5) {
            momentum = DigestMomentum.LOW;
        }

        List<String> growthAreas = new ArrayList<>();
        if (frontend) {
            growthAreas.add("Frontend technologies");
        }
        if (backend) {
            growthAreas.add("Backend systems");
        }
        if (growthAreas.isEmpty()) {
            growthAreas.add("General development skills");
        }

        long completed = sample.stream().filter(InteractionRecord::isCompleted).count();
        List<String> highlights = new ArrayList<>();
        highlights.add("Consistent engagement with development tasks");
        if (completed > 0) {
            highlights.add(completed + " of " + sample.size() + " interactions completed");
        }

        return DigestResult.builder()
                .userId(userId)
                .generatedAt(now)
                .recentFocus(focus)
                .activitySummary("Active development work with " + sample.size()
                        + " recent conversations covering various technical topics")
                .keyLearnings(learning
                        ? List.of("Exploring new concepts", "Seeking deeper understanding")
                        : List.of("Applying existing knowledge"))
                .progressHighlights(highlights)
                .currentMomentum(momentum)
                .learningTrajectory(learning
                        ? "Actively seeking new knowledge and explanations"
                        : "Focused on implementation and problem-solving")
                .problemSolvingApproach(errors
                        ? "Debug-oriented with focus on resolving issues"
                        : "Implementation-focused development")
                .collaborationPatterns("Regular interaction with AI assistant for guidance and problem-solving")
                .growthAreas(growthAreas)
                .technicalDepth(depth)
                .confidenceScore(FALLBACK_CONFIDENCE)
                .source(DigestSource.FALLBACK)
                .recordsAnalyzed(sample.size())
                .build();
    }
}
