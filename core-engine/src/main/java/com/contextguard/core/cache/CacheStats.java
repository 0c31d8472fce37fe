package com.contextguard.core.cache;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Point-in-time snapshot of {@link CacheStore} counters.
 *
 * <p>
 * {@code oldestEntry} and {@code newestEntry} are {@code null} for an empty
 * cache.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CacheStats {

    private final int totalEntries;
    private final long totalSize;
    private final long hits;
    private final long misses;
    private final long evictionCount;
    private final long rejectionCount;
    private final Instant oldestEntry;
    private final Instant newestEntry;

    CacheStats(int totalEntries, long totalSize, long hits, long misses,
            long evictionCount, long rejectionCount, Instant oldestEntry, Instant newestEntry) {
        this.totalEntries = totalEntries;
        this.totalSize = totalSize;
        this.hits = hits;
        this.misses = misses;
        this.evictionCount = evictionCount;
        this.rejectionCount = rejectionCount;
        this.oldestEntry = oldestEntry;
        this.newestEntry = newestEntry;
    }

    public int getTotalEntries() {
        return totalEntries;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public double getHitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public double getMissRate() {
        long total = hits + misses;
        return total > 0 ? (double) misses / total : 0.0;
    }

    public long getEvictionCount() {
        return evictionCount;
    }

    public long getRejectionCount() {
        return rejectionCount;
    }

    public Instant getOldestEntry() {
        return oldestEntry;
    }

    public Instant getNewestEntry() {
        return newestEntry;
    }

    @Override
    public String toString() {
        return "CacheStats{" +
                "totalEntries=" + totalEntries +
                ", totalSize=" + totalSize +
                ", hits=" + hits +
                ", misses=" + misses +
                ", evictionCount=" + evictionCount +
                ", rejectionCount=" + rejectionCount +
                '}';
    }
}
