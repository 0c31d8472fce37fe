package com.contextguard.core.monitor;

import java.util.List;
import java.util.Map;

/**
 * Snapshot returned by {@link PerformanceMonitor#getStats()}.
 *
 * @since 1.0.0
 */
public final class PerformanceStats {

    private final OperationMetrics overall;
    private final Map<String, OperationMetrics> byOperation;
    private final List<Measurement> recentSample;
    private final TrendData trends;
    private final List<Hotspot> hotspots;

    PerformanceStats(OperationMetrics overall, Map<String, OperationMetrics> byOperation,
            List<Measurement> recentSample, TrendData trends, List<Hotspot> hotspots) {
        this.overall = overall;
        this.byOperation = byOperation;
        this.recentSample = List.copyOf(recentSample);
        this.trends = trends;
        this.hotspots = List.copyOf(hotspots);
    }

    public OperationMetrics getOverall() {
        return overall;
    }

    /**
     * @return metrics per operation name, sorted by name
     */
    public Map<String, OperationMetrics> getByOperation() {
        return byOperation;
    }

    /**
     * @return the last 50 closed measurements, oldest first
     */
    public List<Measurement> getRecentSample() {
        return recentSample;
    }

    public TrendData getTrends() {
        return trends;
    }

    /**
     * @return hotspots ordered high impact first
     */
    public List<Hotspot> getHotspots() {
        return hotspots;
    }
}
