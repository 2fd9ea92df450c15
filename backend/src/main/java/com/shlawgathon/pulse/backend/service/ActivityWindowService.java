package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.UserActivityWindow;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups interaction records by user and cuts the recent and daily windows.
 * Pure and synchronous.
 */
@Service
public class ActivityWindowService {

    static final Comparator<InteractionRecord> NEWEST_FIRST = Comparator
            .comparing(InteractionRecord::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(InteractionRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PulseProperties properties;

    public ActivityWindowService(PulseProperties properties) {
        this.properties = properties;
    }

    /**
     * Partition records by user id. Each partition is sorted newest first;
     * partitions are disjoint and together hold every input record.
     */
    public Map<String, List<InteractionRecord>> groupByUser(Collection<InteractionRecord> records) {
        Map<String, List<InteractionRecord>> groups = new LinkedHashMap<>();
        for (InteractionRecord record : records) {
            groups.computeIfAbsent(record.getUserId(), k -> new ArrayList<>()).add(record);
        }
        groups.values().forEach(group -> group.sort(NEWEST_FIRST));
        return groups;
    }

    /**
     * Cut the windows for one user's records.
     *
     * @param sortedRecords the user's records, newest first
     */
    public UserActivityWindow window(String userId, List<InteractionRecord> sortedRecords, Instant now) {
        Instant recentCutoff = now.minus(properties.getWindows().getRecent());
        Instant dailyCutoff = now.minus(properties.getWindows().getDaily());

        List<InteractionRecord> recent = new ArrayList<>();
        List<InteractionRecord> daily = new ArrayList<>();
        for (InteractionRecord record : sortedRecords) {
            Instant timestamp = record.getTimestamp();
            if (timestamp == null || !timestamp.isAfter(dailyCutoff)) {
                continue;
            }
            daily.add(record);
            if (timestamp.isAfter(recentCutoff)) {
                recent.add(record);
            }
        }
        return new UserActivityWindow(userId, List.copyOf(sortedRecords), List.copyOf(recent), List.copyOf(daily));
    }

    /**
     * Windows of every user with activity inside the daily window.
     */
    public List<UserActivityWindow> activeWindows(Collection<InteractionRecord> records, Instant now) {
        List<UserActivityWindow> windows = new ArrayList<>();
        groupByUser(records).forEach((userId, userRecords) -> {
            UserActivityWindow window = window(userId, userRecords, now);
            if (window.isActive()) {
                windows.add(window);
            }
        });
        return windows;
    }
}
