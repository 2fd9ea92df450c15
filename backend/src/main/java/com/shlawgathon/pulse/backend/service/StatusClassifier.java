package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.DeveloperStatus;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-scoring classifier for a developer's live status.
 * <p>
 * Every record in the recent window contributes a recency weight of
 * {@code 1 / (index + 1)} to each keyword category it mentions; the newest
 * record has index 0. The result depends only on the window contents.
 */
@Service
public class StatusClassifier {

    public static final String NO_RECENT_ACTIVITY = "No recent activity";

    private final PulseProperties.Classifier settings;

    public StatusClassifier(PulseProperties properties) {
        this.settings = properties.getClassifier();
    }

    /**
     * Classify a recent window.
     *
     * @param recentNewestFirst the user's recent records, newest first
     */
    public StatusClassification classify(List<InteractionRecord> recentNewestFirst) {
        if (recentNewestFirst.isEmpty()) {
            return new StatusClassification(DeveloperStatus.IDLE, NO_RECENT_ACTIVITY, 0, 0, 0);
        }

        double blockedScore = 0;
        double problemScore = 0;
        double flowScore = 0;

        for (int i = 0; i < recentNewestFirst.size(); i++) {
            double weight = 1.0 / (i + 1);
            String query = lower(recentNewestFirst.get(i).getQueryText());

            blockedScore += weight * countMatches(query, settings.getBlockedKeywords());
            problemScore += weight * countMatches(query, settings.getProblemKeywords());
            flowScore += weight * countMatches(query, settings.getFlowKeywords());
        }

        int recentCount = recentNewestFirst.size();
        DeveloperStatus status;
        if (blockedScore > settings.getBlockedThreshold()
                || (recentCount > settings.getBusyWindowSize() && problemScore < flowScore)) {
            status = DeveloperStatus.BLOCKED;
        } else if (recentCount > settings.getActiveWindowSize()
                || problemScore > flowScore + settings.getProblemMargin()) {
            status = DeveloperStatus.PROBLEM_SOLVING;
        } else {
            status = DeveloperStatus.FLOW;
        }

        String message = buildMessage(status, recentNewestFirst.get(0));
        return new StatusClassification(status, message, blockedScore, problemScore, flowScore);
    }

    private String buildMessage(DeveloperStatus status, InteractionRecord latest) {
        String query = latest.getQueryText() != null ? latest.getQueryText().strip() : "";
        return status.getMessagePrefix() + ": " + TextUtils.truncate(query, settings.getMessageMaxLength());
    }

    private static int countMatches(String text, List<String> keywords) {
        int matches = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                matches++;
            }
        }
        return matches;
    }

    private static String lower(String text) {
        return text != null ? text.toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Classifier verdict with the category scores that produced it.
     */
    public record StatusClassification(
            DeveloperStatus status,
            String message,
            double blockedScore,
            double problemScore,
            double flowScore) {
    }
}
