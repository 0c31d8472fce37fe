package com.contextguard.core.monitor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * JVM heap usage compared to the baseline taken at construction or
 * {@link PerformanceMonitor#reset()}.
 *
 * @since 1.0.0
 */
public final class MemoryUsage {

    /** Heap delta beyond which the trend is no longer stable. */
    static final long TREND_THRESHOLD_BYTES = 10L * 1024 * 1024;

    public enum Trend {
        INCREASING,
        DECREASING,
        STABLE;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final long currentHeapUsed;
    private final long baselineHeapUsed;
    private final long deltaHeapUsed;
    private final long maxHeap;
    private final Trend trend;

    MemoryUsage(long currentHeapUsed, long baselineHeapUsed, long maxHeap, boolean tracking) {
        this.currentHeapUsed = currentHeapUsed;
        this.baselineHeapUsed = baselineHeapUsed;
        this.deltaHeapUsed = tracking ? currentHeapUsed - baselineHeapUsed : 0;
        this.maxHeap = maxHeap;
        if (deltaHeapUsed > TREND_THRESHOLD_BYTES) {
            this.trend = Trend.INCREASING;
        } else if (deltaHeapUsed < -TREND_THRESHOLD_BYTES) {
            this.trend = Trend.DECREASING;
        } else {
            this.trend = Trend.STABLE;
        }
    }

    public long getCurrentHeapUsed() {
        return currentHeapUsed;
    }

    public long getBaselineHeapUsed() {
        return baselineHeapUsed;
    }

    public long getDeltaHeapUsed() {
        return deltaHeapUsed;
    }

    public long getMaxHeap() {
        return maxHeap;
    }

    public Trend getTrend() {
        return trend;
    }
}
