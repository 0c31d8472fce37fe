package com.contextguard.core.orchestration;

import com.contextguard.core.model.AnalysisResult;

import java.util.List;

/**
 * Risk distribution over the most recent scans.
 *
 * @since 1.0.0
 */
public final class SecuritySummary {

    private final int total;
    private final int high;
    private final int medium;
    private final int low;

    SecuritySummary(int total, int high, int medium, int low) {
        this.total = total;
        this.high = high;
        this.medium = medium;
        this.low = low;
    }

    static SecuritySummary of(List<AnalysisResult> scans) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (AnalysisResult scan : scans) {
            switch (scan.getRiskLevel()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return new SecuritySummary(scans.size(), high, medium, low);
    }

    public int getTotal() {
        return total;
    }

    public int getHigh() {
        return high;
    }

    public int getMedium() {
        return medium;
    }

    public int getLow() {
        return low;
    }

    @Override
    public String toString() {
        return "SecuritySummary{total=" + total + ", high=" + high + ", medium=" + medium + ", low=" + low + '}';
    }
}
