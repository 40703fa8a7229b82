package com.plazaintel.comparisons.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.plazaintel.comparisons.model.ComparisonResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Comparison results keyed by (key1, key2, region filter), held in a
 * size-bounded Caffeine cache.
 *
 * A result older than the TTL is never served, but readers leave it in place;
 * only {@link #purgeExpired(Duration)} removes entries. When the cache is full,
 * Caffeine evicts by recency and frequency of reads. Maintenance runs on the
 * calling thread, so the bound holds as soon as {@code put} returns.
 */
@Slf4j
public class ComparisonResultCache {

    public record Key(int key1, int key2, String regionFilter) {}

    public record EntryInfo(Key key, Instant createdAt, long ageSeconds) {}

    private final Clock clock;
    private final Duration ttl;
    private final Cache<Key, ComparisonResult> results;

    public ComparisonResultCache(Clock clock, Duration ttl, int maxEntries) {
        this.clock = clock;
        this.ttl = ttl;
        RemovalListener<Key, ComparisonResult> onRemoval = (key, value, cause) -> {
            if (cause == RemovalCause.SIZE) {
                log.debug("Result cache full ({}), dropped {}", maxEntries, key);
            }
        };
        this.results = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .executor(Runnable::run)
                .removalListener(onRemoval)
                .build();
    }

    public Optional<ComparisonResult> get(Key key) {
        ComparisonResult result = results.getIfPresent(key);
        if (result == null || isExpired(result.getCreatedAt(), clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    public void put(Key key, ComparisonResult result) {
        results.put(key, result);
    }

    /** @return number of entries removed */
    public int purgeExpired(Duration maxAge) {
        Instant now = clock.instant();
        int removed = 0;
        for (var entry : results.asMap().entrySet()) {
            if (isExpired(entry.getValue().getCreatedAt(), now, maxAge)
                    && results.asMap().remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int purgeExpired() {
        return purgeExpired(ttl);
    }

    public int clear() {
        int n = size();
        results.invalidateAll();
        results.cleanUp();
        return n;
    }

    public int size() {
        results.cleanUp();
        return (int) results.estimatedSize();
    }

    public Duration ttl() {
        return ttl;
    }

    public List<EntryInfo> entries() {
        Instant now = clock.instant();
        List<EntryInfo> out = new ArrayList<>();
        results.asMap().forEach((key, result) -> out.add(new EntryInfo(key, result.getCreatedAt(),
                Duration.between(result.getCreatedAt(), now).toSeconds())));
        out.sort(Comparator.comparing(EntryInfo::createdAt));
        return out;
    }

    private static boolean isExpired(Instant createdAt, Instant now, Duration maxAge) {
        return Duration.between(createdAt, now).compareTo(maxAge) > 0;
    }
}
