package com.contextguard.core.monitor;

import java.util.List;
import java.util.Map;

/**
 * Failed measurements grouped by exception type.
 *
 * @since 1.0.0
 */
public final class ErrorSummary {

    private final long totalErrors;
    private final double errorRate;
    private final Map<String, Long> errorsByType;
    private final List<Measurement> recentErrors;

    ErrorSummary(long totalErrors, double errorRate, Map<String, Long> errorsByType,
            List<Measurement> recentErrors) {
        this.totalErrors = totalErrors;
        this.errorRate = errorRate;
        this.errorsByType = Map.copyOf(errorsByType);
        this.recentErrors = List.copyOf(recentErrors);
    }

    public long getTotalErrors() {
        return totalErrors;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public Map<String, Long> getErrorsByType() {
        return errorsByType;
    }

    /**
     * @return the last ten failed measurements, oldest first
     */
    public List<Measurement> getRecentErrors() {
        return recentErrors;
    }
}
