package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.CollaborationLevel;
import com.shlawgathon.pulse.backend.model.EventSentiment;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.TechnicalDepth;
import com.shlawgathon.pulse.backend.model.TimelineAnalysis;
import com.shlawgathon.pulse.backend.model.TimelineCategory;
import com.shlawgathon.pulse.backend.model.TimelineDay;
import com.shlawgathon.pulse.backend.model.TimelineEvent;
import com.shlawgathon.pulse.backend.model.TimelineEventStatus;
import com.shlawgathon.pulse.backend.model.TimelineEventType;
import com.shlawgathon.pulse.backend.model.TimelineImpact;
import com.shlawgathon.pulse.backend.model.TimelineMomentum;
import com.shlawgathon.pulse.backend.model.TimelinePatterns;
import com.shlawgathon.pulse.backend.model.TimelineSummary;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rule-based categorization of interaction records into timeline events,
 * and aggregation of those events into summary, patterns and recommendations.
 */
@Service
public class TimelineAnalyzer {

    public static final String EMPTY_RECOMMENDATION = "Start coding to see your development timeline";

    static final int MOMENTUM_WINDOW = 5;
    static final int MAX_RECOMMENDATIONS = 4;

    private static final int TITLE_MAX_LENGTH = 100;
    private static final int DESCRIPTION_MAX_LENGTH = 200;
    private static final int MAX_FILES = 5;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private static final Comparator<TimelineEvent> NEWEST_FIRST = Comparator
            .comparing(TimelineEvent::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private static final List<String> TECHNOLOGIES = List.of(
            "react", "typescript", "javascript", "node", "python", "java",
            "css", "html", "sql", "graphql", "rest", "api", "docker",
            "kubernetes", "aws", "azure", "gcp", "git", "webpack", "vite",
            "next", "vue", "angular", "svelte", "tailwind", "supabase",
            "postgresql", "mongodb", "redis", "elasticsearch");

    private static final List<String> BLOCKER_TERMS = List.of("stuck", "blocked", "not working", "broken");

    private static final List<String> COMPLEX_TERMS = List.of(
            "architecture", "optimize", "performance", "scale", "algorithm", "complexity");

    private final TaskExtractor taskExtractor;
    private final Duration abandonAfter;
    private final ZoneId zone;

    public TimelineAnalyzer(TaskExtractor taskExtractor, PulseProperties properties) {
        this.taskExtractor = taskExtractor;
        this.abandonAfter = properties.getWindows().getDaily();
        this.zone = properties.getTimeline().getZone();
    }

    public List<TimelineEvent> toEvents(Collection<InteractionRecord> records, Instant now) {
        return records.stream()
                .map(record -> toEvent(record, now))
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    /**
     * Categorize one record. Type rules are checked in order and the first match wins.
     */
    public TimelineEvent toEvent(InteractionRecord record, Instant now) {
        String query = lower(record.getQueryText());
        String response = record.getResponseText() != null ? record.getResponseText() : "";
        String fullText = query + " " + response;

        TimelineEventType type = TimelineEventType.FEATURE;
        TimelineCategory category = TimelineCategory.CODE;
        TimelineImpact impact = TimelineImpact.MEDIUM;

        if (containsAny(query, "bug", "error", "fix")) {
            type = TimelineEventType.BUG;
            category = TimelineCategory.DEBUGGING;
            impact = TimelineImpact.HIGH;
        } else if (containsAny(query, "test")) {
            type = TimelineEventType.TESTING;
        } else if (containsAny(query, "refactor", "clean", "optimize")) {
            type = TimelineEventType.REFACTOR;
        } else if (containsAny(query, "document", "comment", "readme")) {
            type = TimelineEventType.DOCUMENTATION;
            category = TimelineCategory.PLANNING;
        } else if (containsAny(query, "deploy", "build", "release")) {
            type = TimelineEventType.DEPLOYMENT;
            impact = TimelineImpact.CRITICAL;
        } else if (containsAny(query, "learn", "how", "what", "explain")) {
            type = TimelineEventType.LEARNING;
            category = TimelineCategory.PLANNING;
            impact = TimelineImpact.LOW;
        } else if (containsAny(query, "review", "feedback", "suggest")) {
            type = TimelineEventType.COLLABORATION;
            category = TimelineCategory.REVIEW;
        } else if (containsAny(query, "architect", "design", "structure")) {
            category = TimelineCategory.ARCHITECTURE;
            impact = TimelineImpact.HIGH;
        }

        ZonedDateTime localTime = record.getTimestamp() != null ? record.getTimestamp().atZone(zone) : null;
        String title = record.getQueryText() != null && !record.getQueryText().isBlank()
                ? record.getQueryText()
                : "Development activity";

        return TimelineEvent.builder()
                .id(record.getId())
                .userId(record.getUserId())
                .timestamp(record.getTimestamp())
                .date(localTime != null ? localTime.toLocalDate() : null)
                .time(localTime != null ? TIME_FORMAT.format(localTime) : null)
                .type(type)
                .category(category)
                .impact(impact)
                .status(classifyStatus(record, query, now))
                .title(TextUtils.truncate(title, TITLE_MAX_LENGTH))
                .description(TextUtils.truncate(response.isEmpty() ? "Processing..." : response,
                        DESCRIPTION_MAX_LENGTH))
                .durationMinutes(estimateDuration(record))
                .technologies(extractTechnologies(fullText))
                .filesTouched(taskExtractor.findFilePaths(fullText, MAX_FILES))
                .challenges(extractChallenges(query))
                .learningPoints(extractLearningPoints(response))
                .sentiment(analyzeSentiment(query))
                .complexity(analyzeComplexity(fullText.toLowerCase(Locale.ROOT)))
                .focus(determineFocus(query))
                .build();
    }

    TimelineEventStatus classifyStatus(InteractionRecord record, String lowerQuery, Instant now) {
        if (record.isCompleted()) {
            return TimelineEventStatus.COMPLETED;
        }
        if (BLOCKER_TERMS.stream().anyMatch(lowerQuery::contains)) {
            return TimelineEventStatus.BLOCKED;
        }
        if (record.getTimestamp() != null && record.getTimestamp().isBefore(now.minus(abandonAfter))) {
            return TimelineEventStatus.ABANDONED;
        }
        return TimelineEventStatus.IN_PROGRESS;
    }

    static int estimateDuration(InteractionRecord record) {
        int queryLength = record.getQueryText() != null ? record.getQueryText().length() : 0;
        int responseLength = record.getResponseText() != null ? record.getResponseText().length() : 0;
        double complexityFactor = Math.min((queryLength + responseLength) / 500.0, 10);
        return (int) Math.round(5 + complexityFactor * 5);
    }

    static List<String> extractTechnologies(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> found = new LinkedHashSet<>();
        for (String technology : TECHNOLOGIES) {
            if (lower.contains(technology)) {
                found.add(Character.toUpperCase(technology.charAt(0)) + technology.substring(1));
            }
        }
        return new ArrayList<>(found);
    }

    static EventSentiment analyzeSentiment(String lowerQuery) {
        if (containsAny(lowerQuery, "awesome", "great", "perfect")) {
            return EventSentiment.EXCITED;
        }
        if (containsAny(lowerQuery, "error", "stuck", "help")) {
            return EventSentiment.FRUSTRATED;
        }
        if (lowerQuery.contains("!")) {
            return EventSentiment.POSITIVE;
        }
        return EventSentiment.NEUTRAL;
    }

    static TechnicalDepth analyzeComplexity(String lowerText) {
        long matches = COMPLEX_TERMS.stream().filter(lowerText::contains).count();
        if (matches >= 2) {
            return TechnicalDepth.ADVANCED;
        }
        return matches == 1 ? TechnicalDepth.INTERMEDIATE : TechnicalDepth.BEGINNER;
    }

    static String determineFocus(String lowerQuery) {
        if (containsAny(lowerQuery, "implement", "create", "add")) {
            return "Building new features";
        }
        if (containsAny(lowerQuery, "fix", "debug", "error")) {
            return "Debugging and fixes";
        }
        if (containsAny(lowerQuery, "refactor", "optimize")) {
            return "Code optimization";
        }
        if (lowerQuery.contains("test")) {
            return "Testing";
        }
        return "General development";
    }

    static List<String> extractChallenges(String lowerQuery) {
        List<String> challenges = new ArrayList<>();
        if (lowerQuery.contains("error")) {
            challenges.add("Error resolution");
        }
        if (containsAny(lowerQuery, "slow", "performance")) {
            challenges.add("Performance optimization");
        }
        if (lowerQuery.contains("complex")) {
            challenges.add("Complexity management");
        }
        return challenges;
    }

    static List<String> extractLearningPoints(String response) {
        List<String> points = new ArrayList<>();
        if (response.contains("should") || response.contains("best practice")) {
            points.add("Best practices identified");
        }
        if (response.contains("instead of") || response.contains("better")) {
            points.add("Alternative approaches learned");
        }
        return points;
    }

    /**
     * Aggregate events into days, summary, patterns and recommendations.
     * Events are ordered newest first before aggregation.
     */
    public TimelineAnalysis analyze(List<TimelineEvent> events) {
        if (events.isEmpty()) {
            return emptyAnalysis();
        }
        List<TimelineEvent> sorted = new ArrayList<>(events);
        sorted.sort(NEWEST_FIRST);

        int totalMinutes = sorted.stream().mapToInt(TimelineEvent::getDurationMinutes).sum();
        List<TimelineCategory> focusAreas = topByCount(sorted.stream().map(TimelineEvent::getCategory)
                .collect(Collectors.toList()), 3);
        List<String> topTechnologies = topByCount(sorted.stream().flatMap(e -> e.getTechnologies().stream())
                .collect(Collectors.toList()), 5);
        TimelineMomentum momentum = classifyMomentum(sorted);

        TimelineSummary summary = TimelineSummary.builder()
                .totalEvents(sorted.size())
                .productiveHours(Math.round(totalMinutes / 60.0))
                .focusAreas(focusAreas)
                .topTechnologies(topTechnologies)
                .collaborationLevel(collaborationLevel(sorted))
                .overallMomentum(momentum)
                .build();

        List<String> challenges = sorted.stream()
                .flatMap(e -> e.getChallenges().stream())
                .distinct()
                .limit(3)
                .collect(Collectors.toList());
        List<String> strengths = analyzeStrengths(sorted);

        TimelinePatterns patterns = TimelinePatterns.builder()
                .peakTime(peakTime(sorted))
                .workStyle(workStyle(sorted))
                .challenges(challenges)
                .strengths(strengths)
                .build();

        return TimelineAnalysis.builder()
                .days(groupByDay(sorted))
                .summary(summary)
                .patterns(patterns)
                .recommendations(recommend(sorted, momentum, challenges, strengths))
                .build();
    }

    /**
     * Momentum over the newest events.
     *
     * @param newestFirst events, newest first
     */
    public TimelineMomentum classifyMomentum(List<TimelineEvent> newestFirst) {
        List<TimelineEvent> window = newestFirst.subList(0, Math.min(MOMENTUM_WINDOW, newestFirst.size()));
        long completed = window.stream().filter(e -> e.getStatus() == TimelineEventStatus.COMPLETED).count();
        long blocked = window.stream().filter(e -> e.getStatus() == TimelineEventStatus.BLOCKED).count();
        if (blocked > 2) {
            return TimelineMomentum.BLOCKED;
        }
        if (completed >= 4) {
            return TimelineMomentum.ACCELERATING;
        }
        if (completed >= 2) {
            return TimelineMomentum.STEADY;
        }
        return TimelineMomentum.SLOWING;
    }

    public TimelineAnalysis emptyAnalysis() {
        return TimelineAnalysis.builder()
                .summary(TimelineSummary.builder()
                        .totalEvents(0)
                        .productiveHours(0)
                        .collaborationLevel(CollaborationLevel.SOLO)
                        .overallMomentum(TimelineMomentum.STEADY)
                        .build())
                .patterns(TimelinePatterns.builder()
                        .peakTime("Varies")
                        .workStyle("No data")
                        .build())
                .recommendations(new ArrayList<>(List.of(EMPTY_RECOMMENDATION)))
                .build();
    }

    List<TimelineDay> groupByDay(List<TimelineEvent> newestFirst) {
        Map<LocalDate, List<TimelineEvent>> byDate = new LinkedHashMap<>();
        for (TimelineEvent event : newestFirst) {
            if (event.getDate() != null) {
                byDate.computeIfAbsent(event.getDate(), d -> new ArrayList<>()).add(event);
            }
        }
        List<TimelineDay> days = new ArrayList<>();
        byDate.forEach((date, dayEvents) -> days.add(TimelineDay.builder()
                .date(date)
                .eventCount(dayEvents.size())
                .totalMinutes(dayEvents.stream().mapToInt(TimelineEvent::getDurationMinutes).sum())
                .dominantType(topByCount(dayEvents.stream().map(TimelineEvent::getType)
                        .collect(Collectors.toList()), 1).get(0))
                .events(dayEvents)
                .build()));
        days.sort(Comparator.comparing(TimelineDay::getDate).reversed());
        return days;
    }

    static CollaborationLevel collaborationLevel(List<TimelineEvent> events) {
        long collaboration = events.stream().filter(e -> e.getType() == TimelineEventType.COLLABORATION).count();
        if (collaboration > 10) {
            return CollaborationLevel.HIGH;
        }
        if (collaboration > 5) {
            return CollaborationLevel.MODERATE;
        }
        return collaboration > 0 ? CollaborationLevel.MINIMAL : CollaborationLevel.SOLO;
    }

    static String timeSlot(int hour) {
        if (hour < 6) {
            return "Early morning";
        }
        if (hour < 12) {
            return "Morning";
        }
        if (hour < 18) {
            return "Afternoon";
        }
        return hour < 22 ? "Evening" : "Night";
    }

    private String peakTime(List<TimelineEvent> events) {
        List<String> slots = events.stream()
                .filter(e -> e.getTimestamp() != null)
                .map(e -> timeSlot(e.getTimestamp().atZone(zone).getHour()))
                .collect(Collectors.toList());
        List<String> top = topByCount(slots, 1);
        return top.isEmpty() ? "Varies" : top.get(0);
    }

    private static String workStyle(List<TimelineEvent> events) {
        List<TimelineEventType> dominant = topByCount(events.stream().map(TimelineEvent::getType)
                .collect(Collectors.toList()), 1);
        if (dominant.isEmpty()) {
            return "Versatile developer";
        }
        switch (dominant.get(0)) {
            case FEATURE:
                return "Feature-focused builder";
            case BUG:
                return "Quality-focused debugger";
            case REFACTOR:
                return "Code perfectionist";
            case LEARNING:
                return "Continuous learner";
            case COLLABORATION:
                return "Team collaborator";
            default:
                return "Versatile developer";
        }
    }

    private static List<String> analyzeStrengths(List<TimelineEvent> events) {
        List<String> strengths = new ArrayList<>();
        double total = events.size();
        long completed = events.stream().filter(e -> e.getStatus() == TimelineEventStatus.COMPLETED).count();
        if (completed / total > 0.8) {
            strengths.add("High completion rate");
        }
        long highImpact = events.stream()
                .filter(e -> e.getImpact() == TimelineImpact.HIGH || e.getImpact() == TimelineImpact.CRITICAL)
                .count();
        if (highImpact / total > 0.3) {
            strengths.add("Focus on high-impact work");
        }
        long technologies = events.stream().flatMap(e -> e.getTechnologies().stream()).distinct().count();
        if (technologies > 5) {
            strengths.add("Technology versatility");
        }
        return strengths;
    }

    private static List<String> recommend(List<TimelineEvent> events, TimelineMomentum momentum,
            List<String> challenges, List<String> strengths) {
        List<String> recommendations = new ArrayList<>();
        if (momentum == TimelineMomentum.BLOCKED) {
            recommendations.add("Consider breaking down complex tasks into smaller, manageable pieces");
        }
        if (momentum == TimelineMomentum.SLOWING) {
            recommendations.add("Take a break or switch to a different type of task to regain momentum");
        }
        if (challenges.contains("Performance optimization")) {
            recommendations.add("Dedicate time to learn performance profiling tools");
        }
        if (!strengths.contains("Technology versatility")) {
            recommendations.add("Explore new technologies to broaden your skill set");
        }
        double total = events.size();
        if (events.stream().filter(e -> e.getType() == TimelineEventType.TESTING).count() / total < 0.1) {
            recommendations.add("Increase focus on testing to improve code quality");
        }
        if (events.stream().filter(e -> e.getType() == TimelineEventType.DOCUMENTATION).count() / total < 0.05) {
            recommendations.add("Add more documentation to improve code maintainability");
        }
        return recommendations.size() > MAX_RECOMMENDATIONS
                ? new ArrayList<>(recommendations.subList(0, MAX_RECOMMENDATIONS))
                : recommendations;
    }

    /**
     * Most frequent values first; ties keep first-seen order.
     */
    static <T> List<T> topByCount(List<T> values, int limit) {
        Map<T, Long> counts = values.stream()
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<T, Long>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static boolean containsAny(String text, String... terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text != null ? text.toLowerCase(Locale.ROOT) : "";
    }
}
