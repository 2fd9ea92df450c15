package com.shlawgathon.pulse.backend.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Reporting period of the activity metrics.
 */
public enum ActivityTimeframe {
    DAY,
    WEEK,
    MONTH;

    /**
     * Inclusive lower bound of the period: local midnight for {@link #DAY},
     * a rolling 7 or 30 days otherwise.
     */
    public Instant startAt(Instant now, ZoneId zone) {
        return switch (this) {
            case DAY -> LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
            case WEEK -> now.minus(Duration.ofDays(7));
            case MONTH -> now.minus(Duration.ofDays(30));
        };
    }

    public static Optional<ActivityTimeframe> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(timeframe -> timeframe.name().equals(normalized))
                .findFirst();
    }
}
