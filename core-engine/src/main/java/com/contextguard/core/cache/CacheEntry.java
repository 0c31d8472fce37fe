package com.contextguard.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached payload with its bookkeeping. Mutable hit count; guarded by
 * the owning {@link CacheStore}.
 */
final class CacheEntry<T> {

    private final T payload;
    private final Instant createdAt;
    private final Duration ttl;
    private final long estimatedSize;
    private long hitCount;

    CacheEntry(T payload, Instant createdAt, Duration ttl, long estimatedSize) {
        this.payload = payload;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.estimatedSize = estimatedSize;
    }

    boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }

    /**
     * Eviction score; lower scores are evicted first. The recency term is
     * fixed at creation.
     */
    double score() {
        return hitCount * 0.3 + (createdAt.toEpochMilli() / 1_000_000.0) * 0.7;
    }

    void recordHit() {
        hitCount++;
    }

    T getPayload() {
        return payload;
    }

    Instant getCreatedAt() {
        return createdAt;
    }

    Duration getTtl() {
        return ttl;
    }

    long getEstimatedSize() {
        return estimatedSize;
    }

    long getHitCount() {
        return hitCount;
    }
}
