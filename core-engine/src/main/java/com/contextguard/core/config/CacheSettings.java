package com.contextguard.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Bounds and timing of the result cache.
 *
 * @since 1.0.0
 */
public class CacheSettings {

    private long maxSizeBytes = 100L * 1024 * 1024;
    private int maxEntries = 2000;
    private long defaultTtlMillis = 45L * 60 * 1000;
    private long cleanupIntervalMillis = 10L * 60 * 1000;

    void validate(List<String> errors) {
        if (maxSizeBytes <= 0) {
            errors.add("cache.maxSizeBytes must be > 0, got: " + maxSizeBytes);
        }
        if (maxEntries <= 0) {
            errors.add("cache.maxEntries must be > 0, got: " + maxEntries);
        }
        if (defaultTtlMillis <= 0) {
            errors.add("cache.defaultTtlMillis must be > 0, got: " + defaultTtlMillis);
        }
        if (cleanupIntervalMillis <= 0) {
            errors.add("cache.cleanupIntervalMillis must be > 0, got: " + cleanupIntervalMillis);
        }
    }

    public Duration defaultTtl() {
        return Duration.ofMillis(defaultTtlMillis);
    }

    public Duration cleanupInterval() {
        return Duration.ofMillis(cleanupIntervalMillis);
    }

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    public void setMaxSizeBytes(long maxSizeBytes) {
        this.maxSizeBytes = maxSizeBytes;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getDefaultTtlMillis() {
        return defaultTtlMillis;
    }

    public void setDefaultTtlMillis(long defaultTtlMillis) {
        this.defaultTtlMillis = defaultTtlMillis;
    }

    public long getCleanupIntervalMillis() {
        return cleanupIntervalMillis;
    }

    public void setCleanupIntervalMillis(long cleanupIntervalMillis) {
        this.cleanupIntervalMillis = cleanupIntervalMillis;
    }

    @Override
    public String toString() {
        return "CacheSettings{" +
                "maxSizeBytes=" + maxSizeBytes +
                ", maxEntries=" + maxEntries +
                ", defaultTtlMillis=" + defaultTtlMillis +
                ", cleanupIntervalMillis=" + cleanupIntervalMillis +
                '}';
    }
}
