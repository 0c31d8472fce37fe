package com.contextguard.core.config;

import java.time.Duration;
import java.util.List;

/**
 * History bounds and alert thresholds of the performance monitor.
 *
 * <p>
 * Alert thresholds are advisory: breaching one only logs a warning.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorSettings {

    private int maxMeasurements = 5000;
    private long cleanupIntervalMillis = 5L * 60 * 1000;
    private long slowOperationMillis = 3000;
    private long highMemoryBytes = 200L * 1024 * 1024;
    private double errorRateThreshold = 0.03;
    private boolean trendAnalysisEnabled = true;
    private boolean memoryTrackingEnabled = true;

    void validate(List<String> errors) {
        if (maxMeasurements <= 0) {
            errors.add("monitor.maxMeasurements must be > 0, got: " + maxMeasurements);
        }
        if (cleanupIntervalMillis <= 0) {
            errors.add("monitor.cleanupIntervalMillis must be > 0, got: " + cleanupIntervalMillis);
        }
        if (slowOperationMillis <= 0) {
            errors.add("monitor.slowOperationMillis must be > 0, got: " + slowOperationMillis);
        }
        if (highMemoryBytes <= 0) {
            errors.add("monitor.highMemoryBytes must be > 0, got: " + highMemoryBytes);
        }
        if (errorRateThreshold < 0 || errorRateThreshold > 1) {
            errors.add("monitor.errorRateThreshold must be within [0, 1], got: " + errorRateThreshold);
        }
    }

    public Duration cleanupInterval() {
        return Duration.ofMillis(cleanupIntervalMillis);
    }

    public int getMaxMeasurements() {
        return maxMeasurements;
    }

    public void setMaxMeasurements(int maxMeasurements) {
        this.maxMeasurements = maxMeasurements;
    }

    public long getCleanupIntervalMillis() {
        return cleanupIntervalMillis;
    }

    public void setCleanupIntervalMillis(long cleanupIntervalMillis) {
        this.cleanupIntervalMillis = cleanupIntervalMillis;
    }

    public long getSlowOperationMillis() {
        return slowOperationMillis;
    }

    public void setSlowOperationMillis(long slowOperationMillis) {
        this.slowOperationMillis = slowOperationMillis;
    }

    public long getHighMemoryBytes() {
        return highMemoryBytes;
    }

    public void setHighMemoryBytes(long highMemoryBytes) {
        this.highMemoryBytes = highMemoryBytes;
    }

    public double getErrorRateThreshold() {
        return errorRateThreshold;
    }

    public void setErrorRateThreshold(double errorRateThreshold) {
        this.errorRateThreshold = errorRateThreshold;
    }

    public boolean isTrendAnalysisEnabled() {
        return trendAnalysisEnabled;
    }

    public void setTrendAnalysisEnabled(boolean trendAnalysisEnabled) {
        this.trendAnalysisEnabled = trendAnalysisEnabled;
    }

    public boolean isMemoryTrackingEnabled() {
        return memoryTrackingEnabled;
    }

    public void setMemoryTrackingEnabled(boolean memoryTrackingEnabled) {
        this.memoryTrackingEnabled = memoryTrackingEnabled;
    }

    @Override
    public String toString() {
        return "MonitorSettings{" +
                "maxMeasurements=" + maxMeasurements +
                ", slowOperationMillis=" + slowOperationMillis +
                ", highMemoryBytes=" + highMemoryBytes +
                ", errorRateThreshold=" + errorRateThreshold +
                '}';
    }
}
