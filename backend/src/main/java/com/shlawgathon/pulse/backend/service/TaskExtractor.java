package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.TaskPriority;
import com.shlawgathon.pulse.backend.model.TaskRecord;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the newest records of a recent window into task entries for the board.
 */
@Service
public class TaskExtractor {

    static final String DEFAULT_FILE_PATH = "src/utils/helper.ts";

    /**
     * Source-like paths restricted to common extensions.
     */
    static final Pattern FILE_WITH_EXTENSION = Pattern.compile(
            "(?:src/|components/|pages/|hooks/|lib/|utils/|api/)?[\\w\\-./]+"
                    + "\\.(?:tsx|ts|jsx|js|py|java|css|html|json|md|sql|vue|svelte)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> PROJECT_PATHS = List.of(
            Pattern.compile("src/[\\w\\-./]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("components/[\\w\\-./]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("pages/[\\w\\-./]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("hooks/[\\w\\-./]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("lib/[\\w\\-./]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("api/[\\w\\-./]+", Pattern.CASE_INSENSITIVE));

    private static final List<String> URGENT_TERMS = List.of("error", "urgent", "blocked", "critical", "breaking");
    private static final List<String> IMPORTANT_TERMS = List.of("implement", "feature", "debug", "fix", "optimize");

    private final PulseProperties.Tasks settings;

    public TaskExtractor(PulseProperties properties) {
        this.settings = properties.getTasks();
    }

    /**
     * Build at most {@code maxTasks} tasks from the newest records.
     *
     * @param recentNewestFirst recent window, newest first
     */
    public List<TaskRecord> extract(List<InteractionRecord> recentNewestFirst, Instant now) {
        int limit = Math.max(0, settings.getMaxTasks());
        List<TaskRecord> tasks = new ArrayList<>(Math.min(limit, recentNewestFirst.size()));
        for (InteractionRecord record : recentNewestFirst) {
            if (tasks.size() >= limit) {
                break;
            }
            tasks.add(toTask(record, now));
        }
        return tasks;
    }

    TaskRecord toTask(InteractionRecord record, Instant now) {
        String query = record.getQueryText() != null ? record.getQueryText() : "";
        String response = record.getResponseText();
        String fullText = query + " " + (response != null ? response : "");

        String description = response != null && !response.isBlank()
                ? response.substring(0, Math.min(response.length(), settings.getDescriptionMaxLength()))
                        + TextUtils.ELLIPSIS
                : "Working on this task";

        return TaskRecord.builder()
                .id(record.getId())
                .title(TextUtils.abbreviate(query, settings.getTitleMaxLength()))
                .priority(prioritize(query))
                .description(description)
                .filePathGuess(guessFilePath(fullText))
                .elapsed(formatElapsed(Duration.between(record.getTimestamp(), now)))
                .sourceTimestamp(record.getTimestamp())
                .build();
    }

    /**
     * Priority from the query alone, independent of the developer status.
     */
    public TaskPriority prioritize(String query) {
        String lower = query != null ? query.toLowerCase(Locale.ROOT) : "";
        if (URGENT_TERMS.stream().anyMatch(lower::contains)) {
            return TaskPriority.HIGH;
        }
        if (IMPORTANT_TERMS.stream().anyMatch(lower::contains)) {
            return TaskPriority.MEDIUM;
        }
        return TaskPriority.LOW;
    }

    /**
     * Best guess of the file being worked on. Never null.
     */
    public String guessFilePath(String text) {
        if (text == null) {
            return DEFAULT_FILE_PATH;
        }
        Matcher matcher = FILE_WITH_EXTENSION.matcher(text);
        if (matcher.find()) {
            return matcher.group();
        }
        for (Pattern pattern : PROJECT_PATHS) {
            Matcher projectMatcher = pattern.matcher(text);
            if (projectMatcher.find()) {
                return projectMatcher.group();
            }
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("component")) {
            return "src/components/Component.tsx";
        }
        if (lower.contains("auth")) {
            return "src/auth/service.ts";
        }
        if (lower.contains("api")) {
            return "src/api/endpoint.ts";
        }
        if (lower.contains("hook")) {
            return "src/hooks/useCustom.ts";
        }
        if (lower.contains("database") || lower.contains("db")) {
            return "src/lib/database.ts";
        }
        return DEFAULT_FILE_PATH;
    }

    /**
     * All distinct file paths mentioned in the text, in order of appearance.
     */
    public List<String> findFilePaths(String text, int max) {
        if (text == null || max <= 0) {
            return List.of();
        }
        Set<String> paths = new LinkedHashSet<>();
        Matcher matcher = FILE_WITH_EXTENSION.matcher(text);
        while (matcher.find() && paths.size() < max) {
            paths.add(matcher.group());
        }
        return new ArrayList<>(paths);
    }

    /**
     * "Mm" up to an hour, "Hh Mm" above.
     */
    static String formatElapsed(Duration elapsed) {
        long minutes = Math.max(0, elapsed.toMinutes());
        if (minutes > 60) {
            return (minutes / 60) + "h " + (minutes % 60) + "m";
        }
        return minutes + "m";
    }
}
