package com.mikov.accountvalidator.cache;

import com.mikov.accountvalidator.dtos.ResultCacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Capacity-bounded cache with a lazily enforced TTL. When full, the entry that
 * was accessed least recently is evicted.
 *
 * @author zahari.mikov
 */
public final class ResultCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    // insertion order makes the first-found tie-break deterministic
    private final Map<String, ResultCacheEntry<V>> cache = new LinkedHashMap<>();
    private final long ttlMs;
    private final int maxSize;
    private final Clock clock;
    private long hits;
    private long misses;

    public ResultCache(final long ttlMs, final int maxSize, final Clock clock) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.ttlMs = ttlMs;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    public synchronized Optional<V> get(final String key) {
        final var entry = cache.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }

        final var now = clock.millis();
        if (entry.isExpired(now, ttlMs)) {
            cache.remove(key);
            misses++;
            return Optional.empty();
        }

        hits++;
        entry.recordAccess(now);
        return Optional.of(entry.getValue());
    }

    public synchronized void set(final String key, final V value) {
        if (!cache.containsKey(key) && cache.size() >= maxSize) {
            evictLeastRecentlyAccessed();
        }
        cache.put(key, new ResultCacheEntry<>(value, clock.millis()));
    }

    public synchronized void clear() {
        cache.clear();
        hits = 0;
        misses = 0;
    }

    public synchronized CacheStats stats() {
        final var total = hits + misses;
        return CacheStats.builder()
                .size(cache.size())
                .hits(hits)
                .misses(misses)
                .hitRate(total > 0 ? (double) hits / total : 0.0)
                .maxSize(maxSize)
                .build();
    }

    private void evictLeastRecentlyAccessed() {
        String oldestKey = null;
        var oldestAccess = Long.MAX_VALUE;

        for (final var entry : cache.entrySet()) {
            if (entry.getValue().getLastAccessMs() < oldestAccess) {
                oldestAccess = entry.getValue().getLastAccessMs();
                oldestKey = entry.getKey();
            }
        }

        if (oldestKey != null) {
            cache.remove(oldestKey);
            logger.debug("Evicted cache entry {} (last accessed at {})", oldestKey, oldestAccess);
        }
    }
}
