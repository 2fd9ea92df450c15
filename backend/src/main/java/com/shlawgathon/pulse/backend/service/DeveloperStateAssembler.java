package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.DeveloperState;
import com.shlawgathon.pulse.backend.model.DeveloperStatus;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.UserActivityWindow;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds {@link DeveloperState} values from windowed records.
 */
@Service
public class DeveloperStateAssembler {

    public static final Comparator<DeveloperState> BOARD_ORDER = Comparator
            .comparingInt((DeveloperState state) -> state.getStatus().getPriority()).reversed()
            .thenComparing(DeveloperState::getLastActive, Comparator.nullsLast(Comparator.reverseOrder()));

    private final ActivityWindowService activityWindowService;
    private final StatusClassifier statusClassifier;
    private final TaskExtractor taskExtractor;
    private final PulseProperties properties;

    public DeveloperStateAssembler(ActivityWindowService activityWindowService,
            StatusClassifier statusClassifier,
            TaskExtractor taskExtractor,
            PulseProperties properties) {
        this.activityWindowService = activityWindowService;
        this.statusClassifier = statusClassifier;
        this.taskExtractor = taskExtractor;
        this.properties = properties;
    }

    /**
     * States for every user active in the daily window, blocked developers first.
     */
    public List<DeveloperState> assembleAll(Collection<InteractionRecord> records, Instant now) {
        return activityWindowService.activeWindows(records, now).stream()
                .map(window -> toState(window, now))
                .sorted(BOARD_ORDER)
                .collect(Collectors.toList());
    }

    /**
     * State for a single user, empty when the user had no activity in the daily window.
     *
     * @param sortedRecords the user's records, newest first
     */
    public Optional<DeveloperState> assemble(String userId, List<InteractionRecord> sortedRecords, Instant now) {
        UserActivityWindow window = activityWindowService.window(userId, sortedRecords, now);
        if (!window.isActive()) {
            return Optional.empty();
        }
        return Optional.of(toState(window, now));
    }

    private DeveloperState toState(UserActivityWindow window, Instant now) {
        StatusClassifier.StatusClassification classification = statusClassifier.classify(window.recent());
        String displayName = resolveDisplayName(window.userId());

        return DeveloperState.builder()
                .id(window.userId())
                .displayName(displayName)
                .initials(initials(displayName))
                .status(classification.status())
                .statusMessage(classification.message())
                .currentTasks(taskExtractor.extract(window.recent(), now))
                .totalInteractionsToday(window.daily().size())
                .completedToday((int) window.daily().stream().filter(InteractionRecord::isCompleted).count())
                .lastActive(window.all().isEmpty() ? null : window.all().get(0).getTimestamp())
                .build();
    }

    String resolveDisplayName(String userId) {
        String configured = properties.getDisplayNames().get(userId);
        if (configured != null) {
            return configured;
        }
        if (userId.contains("test")) {
            return "Test User " + userId.substring(Math.max(0, userId.length() - 3));
        }
        if (userId.length() > 20) {
            return "Anonymous Developer";
        }
        return userId;
    }

    static String initials(String displayName) {
        String initials = Arrays.stream(displayName.trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1))
                .collect(Collectors.joining())
                .toUpperCase(Locale.ROOT);
        return initials.length() > 2 ? initials.substring(0, 2) : initials;
    }

    /**
     * Whether the state should bubble up on the board.
     */
    public static boolean needsAttention(DeveloperState state) {
        return state.getStatus() == DeveloperStatus.BLOCKED;
    }
}
