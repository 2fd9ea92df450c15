package com.shlawgathon.pulse.backend.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.CacheEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * TTL memoization for expensive insight computations, backed by Caffeine.
 * <p>
 * Keys combine an operation name with a fingerprint of the analyzed record ids,
 * so a changed record set never hits a stale entry. Every entry carries its own
 * TTL and is served while {@code now <= expiresAt}. Time is read from the
 * injected {@link Clock}. Concurrent misses on one key run the producer once;
 * the other callers wait for its result.
 */
@Component
public class InsightCache {

    private static final Logger log = LoggerFactory.getLogger(InsightCache.class);

    private final Cache<String, CacheEntry<?>> entries;
    private final Clock clock;
    private final Duration defaultTtl;

    private final Counter hits;
    private final Counter misses;
    private final Counter writes;

    public InsightCache(Clock clock, PulseProperties properties, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.defaultTtl = properties.getCache().getDefaultTtl();
        this.entries = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getMaximumSize())
                .expireAfter(new EntryExpiry())
                .ticker(clockTicker(clock))
                .build();
        this.hits = meterRegistry.counter("pulse_insight_cache_requests", "result", "hit");
        this.misses = meterRegistry.counter("pulse_insight_cache_requests", "result", "miss");
        this.writes = meterRegistry.counter("pulse_insight_cache_writes");
    }

    /**
     * Stable cache key for an operation over a set of records.
     * Order and duplicates of {@code recordIds} do not matter.
     */
    public static String fingerprint(String operation, Collection<String> recordIds) {
        String joined = String.join(",", new TreeSet<>(recordIds));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(joined.getBytes(StandardCharsets.UTF_8));
            return operation + ":" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Cached payload, or empty on a miss.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        CacheEntry<?> entry = entries.getIfPresent(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of((T) entry.payload());
    }

    public <T> CacheEntry<T> put(String key, T payload) {
        return put(key, payload, defaultTtl);
    }

    public <T> CacheEntry<T> put(String key, T payload, Duration ttl) {
        Objects.requireNonNull(payload, "payload");
        CacheEntry<T> entry = newEntry(key, payload, ttl);
        entries.put(key, entry);
        return entry;
    }

    /**
     * Return the cached payload or compute, store and return a fresh one.
     * A null result from the producer is returned but not cached.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, Duration ttl, Supplier<T> producer) {
        AtomicBoolean computed = new AtomicBoolean();
        CacheEntry<?> entry = entries.get(key, k -> {
            computed.set(true);
            T value = producer.get();
            return value == null ? null : newEntry(k, value, ttl);
        });
        (computed.get() ? misses : hits).increment();
        return entry == null ? null : (T) entry.payload();
    }

    /**
     * Whether a live entry exists. Never counts as a hit or a miss.
     */
    public boolean has(String key) {
        return describe(key).isPresent();
    }

    /**
     * Metadata of a live entry, without counting as a hit.
     */
    public Optional<CacheEntry<?>> describe(String key) {
        CacheEntry<?> entry = entries.policy().getIfPresentQuietly(key);
        if (entry == null || entry.isExpiredAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void invalidate(String key) {
        entries.invalidate(key);
    }

    public void clear() {
        entries.invalidateAll();
        log.info("[CACHE] Cleared");
    }

    /**
     * Number of entries that are still live.
     */
    public int size() {
        Instant now = clock.instant();
        return (int) entries.asMap().values().stream()
                .filter(entry -> !entry.isExpiredAt(now))
                .count();
    }

    private <T> CacheEntry<T> newEntry(String key, T payload, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry<T> entry = new CacheEntry<>(key, payload, now, now.plus(ttl));
        writes.increment();
        log.debug("[CACHE] Stored {} until {}", key, entry.expiresAt());
        return entry;
    }

    static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    /**
     * Expires each entry at its own {@code expiresAt}. Caffeine treats the
     * deadline itself as expired, so one nanosecond is added to keep the
     * expiry instant servable.
     */
    private static final class EntryExpiry implements Expiry<String, CacheEntry<?>> {

        @Override
        public long expireAfterCreate(String key, CacheEntry<?> entry, long currentTime) {
            return lifetime(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return lifetime(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long lifetime(CacheEntry<?> entry) {
            return Duration.between(entry.createdAt(), entry.expiresAt()).toNanos() + 1;
        }
    }
}
