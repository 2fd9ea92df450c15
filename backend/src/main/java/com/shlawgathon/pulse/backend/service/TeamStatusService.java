package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.exception.RecordStoreUnavailableException;
import com.shlawgathon.pulse.backend.model.DeveloperState;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.RecordFilter;
import com.shlawgathon.pulse.backend.websocket.TeamStatusWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Owns the in-memory team board: each user's records and derived state.
 * <p>
 * A full refresh replaces everything; an incremental update replaces only the
 * affected user's entry. All mutations happen under this service's monitor.
 * Refreshes carry increasing request ids and a fetch that completes after a
 * newer one has been applied is discarded. Pushed records are stamped with the
 * latest issued id, so a refresh installs every record pushed after it was
 * issued on top of its fetch.
 */
@Service
public class TeamStatusService {

    private static final Logger log = LoggerFactory.getLogger(TeamStatusService.class);

    private final InteractionRecordService interactionRecordService;
    private final ActivityWindowService activityWindowService;
    private final DeveloperStateAssembler developerStateAssembler;
    private final TeamStatusWebSocketHandler webSocketHandler;
    private final PulseProperties properties;
    private final Clock clock;

    private final AtomicLong requestSequence = new AtomicLong();
    private long lastAppliedRequestId;

    private Map<String, List<InteractionRecord>> recordsByUser = new HashMap<>();
    private final Map<String, DeveloperState> states = new HashMap<>();
    private final List<PushedRecord> pushedRecords = new ArrayList<>();

    public TeamStatusService(InteractionRecordService interactionRecordService,
            ActivityWindowService activityWindowService,
            DeveloperStateAssembler developerStateAssembler,
            TeamStatusWebSocketHandler webSocketHandler,
            PulseProperties properties,
            Clock clock) {
        this.interactionRecordService = interactionRecordService;
        this.activityWindowService = activityWindowService;
        this.developerStateAssembler = developerStateAssembler;
        this.webSocketHandler = webSocketHandler;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${pulse.refresh.interval:PT30S}")
    public void scheduledRefresh() {
        refresh();
    }

    /**
     * Re-fetch recent records and recompute every developer state.
     * When the store is unavailable the last known board is returned unchanged.
     */
    public List<DeveloperState> refresh() {
        long requestId = requestSequence.incrementAndGet();
        Instant now = clock.instant();

        List<InteractionRecord> records;
        try {
            records = interactionRecordService.fetchRecords(RecordFilter.builder()
                    .fromTimestamp(now.minus(properties.getWindows().getDaily()))
                    .limit(properties.getRefresh().getFetchLimit())
                    .build());
        } catch (RecordStoreUnavailableException e) {
            log.warn("[STATUS] Refresh #{} failed, keeping last state: {}", requestId, e.getMessage());
            return getDeveloperStates();
        }

        if (!applyRefresh(requestId, records, now)) {
            return getDeveloperStates();
        }
        List<DeveloperState> board = getDeveloperStates();
        webSocketHandler.sendTeamRefreshed(board);
        return board;
    }

    /**
     * Install a fetched record set unless a newer refresh already landed.
     *
     * @return false when the result was stale and discarded
     */
    boolean applyRefresh(long requestId, List<InteractionRecord> fetched, Instant now) {
        List<InteractionRecord> records;
        List<DeveloperState> computed;
        synchronized (this) {
            if (requestId < lastAppliedRequestId) {
                log.info("[STATUS] Discarding stale refresh #{} (latest applied #{})",
                        requestId, lastAppliedRequestId);
                return false;
            }
            records = withRecordsPushedSince(requestId, fetched);
            computed = developerStateAssembler.assembleAll(records, now);

            lastAppliedRequestId = requestId;
            pushedRecords.removeIf(pushed -> pushed.stamp() < requestId);
            recordsByUser = activityWindowService.groupByUser(records);
            states.clear();
            computed.forEach(state -> states.put(state.getId(), state));
        }

        long blocked = computed.stream().filter(DeveloperStateAssembler::needsAttention).count();
        log.info("[STATUS] Refresh #{} applied | records: {} (merged pushes: {}) | developers: {} | blocked: {}",
                requestId, records.size(), records.size() - fetched.size(), computed.size(), blocked);
        return true;
    }

    /**
     * The fetched set plus records pushed after {@code requestId} was issued,
     * which the fetch may have missed. A pushed record replaces a fetched one
     * with the same id.
     */
    private List<InteractionRecord> withRecordsPushedSince(long requestId, List<InteractionRecord> fetched) {
        List<InteractionRecord> merged = new ArrayList<>(fetched);
        for (PushedRecord pushed : pushedRecords) {
            if (pushed.stamp() >= requestId) {
                merged.removeIf(existing -> sameId(existing, pushed.record()));
                merged.add(pushed.record());
            }
        }
        return merged;
    }

    long nextRequestId() {
        return requestSequence.incrementAndGet();
    }

    /**
     * Merge one new record and recompute only its user's state.
     *
     * @return the user's new state, empty when the user is no longer active
     */
    public Optional<DeveloperState> applyRecord(InteractionRecord record) {
        Instant now = clock.instant();
        Optional<DeveloperState> state;
        synchronized (this) {
            List<InteractionRecord> userRecords = new ArrayList<>(
                    recordsByUser.getOrDefault(record.getUserId(), List.of()));
            userRecords.removeIf(existing -> sameId(existing, record));
            userRecords.add(record);
            pushedRecords.add(new PushedRecord(requestSequence.get(), record));
            userRecords.sort(ActivityWindowService.NEWEST_FIRST);
            recordsByUser.put(record.getUserId(), userRecords);

            state = developerStateAssembler.assemble(record.getUserId(), userRecords, now);
            if (state.isPresent()) {
                states.put(record.getUserId(), state.get());
            } else {
                states.remove(record.getUserId());
            }
        }

        state.ifPresent(s -> {
            log.debug("[STATUS] Updated {} -> {}", s.getId(), s.getStatus());
            webSocketHandler.sendDeveloperStatus(s);
        });
        return state;
    }

    /**
     * Current board, blocked developers first.
     */
    public synchronized List<DeveloperState> getDeveloperStates() {
        return states.values().stream()
                .sorted(DeveloperStateAssembler.BOARD_ORDER)
                .collect(Collectors.toList());
    }

    public synchronized Optional<DeveloperState> getDeveloperState(String userId) {
        return Optional.ofNullable(states.get(userId));
    }

    /**
     * In-memory records of one user, newest first.
     */
    public synchronized List<InteractionRecord> recordsFor(String userId) {
        return List.copyOf(recordsByUser.getOrDefault(userId, List.of()));
    }

    public synchronized List<InteractionRecord> allRecords() {
        return recordsByUser.values().stream()
                .flatMap(List::stream)
                .sorted(ActivityWindowService.NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    private static boolean sameId(InteractionRecord a, InteractionRecord b) {
        return a.getId() != null && a.getId().equals(b.getId());
    }

    private record PushedRecord(long stamp, InteractionRecord record) {
    }
}
