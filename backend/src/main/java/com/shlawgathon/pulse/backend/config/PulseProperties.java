package com.shlawgathon.pulse.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the classification and insight engine.
 * Defaults reproduce the behaviour of the original team board.
 */
@Data
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {

    private Windows windows = new Windows();

    private Classifier classifier = new Classifier();

    private Tasks tasks = new Tasks();

    private Digest digest = new Digest();

    private Cache cache = new Cache();

    private Refresh refresh = new Refresh();

    private Timeline timeline = new Timeline();

    private Updates updates = new Updates();

    private Insights insights = new Insights();

    private Metrics metrics = new Metrics();

    /**
     * Known user ids mapped to the name shown on the board.
     */
    private Map<String, String> displayNames = new HashMap<>();

    @Data
    public static class Windows {

        /**
         * Records newer than now minus this value drive the live status.
         */
        private Duration recent = Duration.ofHours(4);

        /**
         * Records newer than now minus this value count as today's activity.
         */
        private Duration daily = Duration.ofHours(24);
    }

    @Data
    public static class Classifier {

        private double blockedThreshold = 0.5;

        /**
         * Above this many recent records, a flow-leaning window is treated as churn.
         */
        private int busyWindowSize = 5;

        /**
         * Above this many recent records the developer is at least problem solving.
         */
        private int activeWindowSize = 3;

        private double problemMargin = 0.5;

        private int messageMaxLength = 80;

        private List<String> blockedKeywords = new ArrayList<>(List.of(
                "error", "stuck", "help", "issue", "problem", "bug", "fail", "not working", "broken"));

        private List<String> problemKeywords = new ArrayList<>(List.of(
                "debug", "fix", "troubleshoot", "optimize", "refactor", "test", "review"));

        private List<String> flowKeywords = new ArrayList<>(List.of(
                "implement", "create", "add", "build", "develop", "make", "design", "setup"));
    }

    @Data
    public static class Tasks {

        private int maxTasks = 6;

        private int titleMaxLength = 50;

        private int descriptionMaxLength = 120;
    }

    @Data
    public static class Digest {

        /**
         * How far back the digest sample reaches.
         */
        private Duration lookback = Duration.ofHours(24);

        private int maxRecords = 50;

        /**
         * Records rendered into the prompt, newest first.
         */
        private int promptRecords = 30;

        private int queryMaxLength = 300;

        private int responseMaxLength = 200;

        private long cacheMinutes = 15;
    }

    @Data
    public static class Cache {

        private Duration defaultTtl = Duration.ofMinutes(15);

        /**
         * Upper bound on memoized insights held at once.
         */
        private long maximumSize = 10_000;
    }

    @Data
    public static class Refresh {

        private Duration interval = Duration.ofSeconds(30);

        /**
         * Upper bound on records pulled by a full refresh.
         */
        private int fetchLimit = 500;
    }

    @Data
    public static class Timeline {

        private ZoneId zone = ZoneId.of("UTC");

        private int defaultLimit = 100;

        private Duration cacheTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class Updates {

        private int queueCapacity = 1000;
    }

    @Data
    public static class Insights {

        /**
         * Newest team records considered by one enhancement pass.
         */
        private int maxRecords = 50;

        /**
         * Records per developer rendered into the status prompt.
         */
        private int promptRecords = 5;

        private int responseMaxLength = 200;

        private long cacheMinutes = 15;
    }

    @Data
    public static class Metrics {

        private Duration cacheTtl = Duration.ofMinutes(10);

        private int fetchLimit = 1000;
    }
}
