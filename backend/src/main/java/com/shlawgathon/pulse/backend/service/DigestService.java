package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.dto.DigestCacheInfoResponse;
import com.shlawgathon.pulse.backend.dto.DigestOptions;
import com.shlawgathon.pulse.backend.exception.RecordStoreUnavailableException;
import com.shlawgathon.pulse.backend.model.CacheEntry;
import com.shlawgathon.pulse.backend.model.DigestResult;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.RecordFilter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-user digests, memoized by the fingerprint of the sampled records.
 * A new record changes the sample and therefore the key, so stale digests are
 * never served and nothing needs explicit invalidation.
 */
@Service
public class DigestService {

    private static final Logger log = LoggerFactory.getLogger(DigestService.class);

    static final String OPERATION = "digest";

    private final InteractionRecordService interactionRecordService;
    private final TeamStatusService teamStatusService;
    private final DigestGenerator digestGenerator;
    private final InsightCache insightCache;
    private final PulseProperties.Digest settings;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DigestService(InteractionRecordService interactionRecordService,
            TeamStatusService teamStatusService,
            DigestGenerator digestGenerator,
            InsightCache insightCache,
            PulseProperties properties,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.interactionRecordService = interactionRecordService;
        this.teamStatusService = teamStatusService;
        this.digestGenerator = digestGenerator;
        this.insightCache = insightCache;
        this.settings = properties.getDigest();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Digest for a user, or null when disabled or when the user has no records
     * in the lookback window.
     */
    public DigestResult getDigest(String userId, DigestOptions options) {
        if (!options.isEnabled()) {
            return null;
        }
        List<InteractionRecord> sample = loadSample(userId, options);
        if (sample.isEmpty()) {
            log.debug("[DIGEST] No records for user: {}", userId);
            return null;
        }

        String key = cacheKey(sample);
        Duration ttl = Duration.ofMinutes(resolveCacheMinutes(options));
        return insightCache.getOrCompute(key, ttl, () -> {
            DigestResult digest = digestGenerator.generate(userId, sample);
            meterRegistry.counter("pulse_digests_generated", "source", digest.getSource().name()).increment();
            return digest;
        });
    }

    /**
     * Whether the digest for the user's current sample is cached, and until when.
     */
    public DigestCacheInfoResponse getCacheInfo(String userId, DigestOptions options) {
        List<InteractionRecord> sample = loadSample(userId, options);
        if (sample.isEmpty()) {
            return DigestCacheInfoResponse.builder()
                    .userId(userId)
                    .cached(false)
                    .build();
        }

        String key = cacheKey(sample);
        Instant now = clock.instant();
        Optional<CacheEntry<?>> entry = insightCache.describe(key);
        return DigestCacheInfoResponse.builder()
                .userId(userId)
                .cacheKey(key)
                .cached(entry.isPresent())
                .createdAt(entry.map(CacheEntry::createdAt).orElse(null))
                .expiresAt(entry.map(CacheEntry::expiresAt).orElse(null))
                .remainingSeconds(entry.map(e -> e.remainingAt(now).toSeconds()).orElse(0L))
                .recordsInSample(sample.size())
                .build();
    }

    public void clearCache() {
        insightCache.clear();
    }

    /**
     * The user's records inside the lookback, newest first. Falls back to the
     * in-memory board when the store is unavailable.
     */
    List<InteractionRecord> loadSample(String userId, DigestOptions options) {
        int maxRecords = resolveMaxRecords(options);
        Instant from = clock.instant().minus(settings.getLookback());
        try {
            return interactionRecordService.fetchRecords(RecordFilter.builder()
                    .userId(userId)
                    .fromTimestamp(from)
                    .limit(maxRecords)
                    .build());
        } catch (RecordStoreUnavailableException e) {
            log.warn("[DIGEST] Store unavailable, using in-memory records for user: {}", userId);
            return teamStatusService.recordsFor(userId).stream()
                    .filter(record -> record.getTimestamp() != null && !record.getTimestamp().isBefore(from))
                    .limit(maxRecords)
                    .collect(Collectors.toList());
        }
    }

    /**
     * Requested sample size; missing or non-positive values use the configured default.
     */
    private int resolveMaxRecords(DigestOptions options) {
        return options.getMaxRecords() != null && options.getMaxRecords() > 0
                ? options.getMaxRecords()
                : settings.getMaxRecords();
    }

    private long resolveCacheMinutes(DigestOptions options) {
        return options.getCacheMinutes() != null && options.getCacheMinutes() > 0
                ? options.getCacheMinutes()
                : settings.getCacheMinutes();
    }

    private static String cacheKey(List<InteractionRecord> sample) {
        return InsightCache.fingerprint(OPERATION, sample.stream()
                .map(InteractionRecord::getId)
                .collect(Collectors.toList()));
    }
}
