package com.contextguard.core.monitor;

/**
 * Nearest-rank percentiles over a sorted sample.
 */
final class Percentiles {

    private Percentiles() {
        // utility class
    }

    /**
     * @param sorted     ascending sample
     * @param percentile fraction in {@code (0, 1]}
     * @return {@code sorted[clamp(ceil(n * p) - 1, 0, n - 1)]}, or {@code 0}
     *         for an empty sample
     */
    static long of(long[] sorted, double percentile) {
        int n = sorted.length;
        if (n == 0) {
            return 0;
        }
        int index = (int) Math.ceil(n * percentile) - 1;
        index = Math.max(0, Math.min(index, n - 1));
        return sorted[index];
    }
}
