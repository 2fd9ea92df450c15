package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Renders a record sample and its aggregate metrics into the digest prompt.
 */
@Component
public class DigestPromptBuilder {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final PulseProperties.Digest settings;
    private final ZoneId zone;

    public DigestPromptBuilder(PulseProperties properties) {
        this.settings = properties.getDigest();
        this.zone = properties.getTimeline().getZone();
    }

    /**
     * @param sample the user's records, newest first
     */
    public String build(List<InteractionRecord> sample) {
        return """
                You are analyzing a developer's recent conversations with an AI coding assistant. \
                Generate insights about their development patterns, learning trajectory and current focus areas.

                Conversation data (most recent first):
                %s
                Activity metrics:
                %s

                Analysis guidelines:
                - Focus on patterns and trends rather than specific dates
                - Identify what they are learning and how they are growing
                - Assess their problem-solving approach and collaboration style
                - Determine their current technical momentum and focus areas
                - Be specific about technologies, concepts and methodologies mentioned
                - confidence_score reflects how much evidence the conversations give (0 to 1)

                Reply with one JSON object following schema %s.
                """.formatted(renderSnippets(sample), renderMetrics(sample), DigestSchema.VERSION);
    }

    String renderSnippets(List<InteractionRecord> sample) {
        StringBuilder text = new StringBuilder();
        int count = Math.min(sample.size(), settings.getPromptRecords());
        for (int i = 0; i < count; i++) {
            InteractionRecord record = sample.get(i);
            String timestamp = record.getTimestamp() != null
                    ? TIMESTAMP_FORMAT.format(record.getTimestamp().atZone(zone))
                    : "unknown";
            text.append('[').append(i + 1).append("] Time: ").append(timestamp).append('\n')
                    .append("Query: \"").append(TextUtils.truncate(record.getQueryText(), settings.getQueryMaxLength()))
                    .append("\"\n")
                    .append("Response: \"")
                    .append(TextUtils.truncate(record.getResponseText(), settings.getResponseMaxLength()))
                    .append("\"\n")
                    .append("Status: ").append(record.getCompletionStatus()).append('\n')
                    .append("Project: ").append(Objects.requireNonNullElse(record.getProjectName(),
                            Objects.requireNonNullElse(record.getProjectId(), "Unknown")))
                    .append("\n---\n");
        }
        return text.toString();
    }

    String renderMetrics(List<InteractionRecord> sample) {
        long completed = sample.stream().filter(InteractionRecord::isCompleted).count();
        long projects = sample.stream().map(InteractionRecord::getProjectId).filter(Objects::nonNull).distinct().count();
        long completionRate = sample.isEmpty() ? 0 : Math.round(completed * 100.0 / sample.size());
        return "- Total interactions: " + sample.size() + "\n"
                + "- Completed interactions: " + completed + "\n"
                + "- Completion rate: " + completionRate + "%\n"
                + "- Projects worked on: " + projects;
    }
}
