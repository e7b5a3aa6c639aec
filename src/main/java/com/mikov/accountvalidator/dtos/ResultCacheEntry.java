package com.mikov.accountvalidator.dtos;

/**
 * Cache entry for validation results, with the access bookkeeping used for
 * least-recently-accessed eviction.
 *
 * @author zahari.mikov
 */
public class ResultCacheEntry<V> {

    private final V value;
    private final long createdAtMs;
    private long lastAccessMs;
    private long accessCount;

    public ResultCacheEntry(final V value, final long now) {
        this.value = value;
        this.createdAtMs = now;
        this.lastAccessMs = now;
        this.accessCount = 1;
    }

    public boolean isExpired(final long now, final long ttlMs) {
        return now - createdAtMs > ttlMs;
    }

    public void recordAccess(final long now) {
        lastAccessMs = now;
        accessCount++;
    }

    public V getValue() {
        return value;
    }

    public long getCreatedAtMs() {
        return createdAtMs;
    }

    public long getLastAccessMs() {
        return lastAccessMs;
    }

    public long getAccessCount() {
        return accessCount;
    }
}
