package com.contextguard.core.monitor;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Aggregate statistics over a set of closed measurements. Durations are in
 * milliseconds.
 *
 * @since 1.0.0
 */
public final class OperationMetrics {

    static final OperationMetrics EMPTY = new OperationMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final int totalOperations;
    private final double averageDuration;
    private final long minDuration;
    private final long maxDuration;
    private final long p50Duration;
    private final long p95Duration;
    private final long p99Duration;
    private final double operationsPerSecond;
    private final double errorRate;

    private OperationMetrics(int totalOperations, double averageDuration, long minDuration,
            long maxDuration, long p50Duration, long p95Duration, long p99Duration,
            double operationsPerSecond, double errorRate) {
        this.totalOperations = totalOperations;
        this.averageDuration = averageDuration;
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
        this.p50Duration = p50Duration;
        this.p95Duration = p95Duration;
        this.p99Duration = p99Duration;
        this.operationsPerSecond = operationsPerSecond;
        this.errorRate = errorRate;
    }

    /**
     * Compute metrics for measurements given in completion order.
     *
     * <p>
     * Throughput is {@code n / (lastStart - firstStart)} in operations per
     * second; a single measurement counts over one second.
     * </p>
     *
     * @param measurements closed measurements
     * @return the metrics, all zero for an empty list
     */
    static OperationMetrics from(List<Measurement> measurements) {
        int n = measurements.size();
        if (n == 0) {
            return EMPTY;
        }

        long[] durations = measurements.stream()
                .mapToLong(Measurement::getDurationMillis)
                .filter(d -> d >= 0)
                .sorted()
                .toArray();
        long total = Arrays.stream(durations).sum();
        long errors = measurements.stream().filter(Measurement::isError).count();

        double seconds = n > 1
                ? Duration.between(measurements.get(0).getStartTime(),
                        measurements.get(n - 1).getStartTime()).toMillis() / 1000.0
                : 1.0;

        return new OperationMetrics(
                n,
                durations.length > 0 ? (double) total / durations.length : 0,
                durations.length > 0 ? durations[0] : 0,
                durations.length > 0 ? durations[durations.length - 1] : 0,
                Percentiles.of(durations, 0.50),
                Percentiles.of(durations, 0.95),
                Percentiles.of(durations, 0.99),
                seconds > 0 ? n / seconds : 0,
                (double) errors / n);
    }

    public int getTotalOperations() {
        return totalOperations;
    }

    public double getAverageDuration() {
        return averageDuration;
    }

    public long getMinDuration() {
        return minDuration;
    }

    public long getMaxDuration() {
        return maxDuration;
    }

    public long getP50Duration() {
        return p50Duration;
    }

    public long getP95Duration() {
        return p95Duration;
    }

    public long getP99Duration() {
        return p99Duration;
    }

    public double getOperationsPerSecond() {
        return operationsPerSecond;
    }

    public double getErrorRate() {
        return errorRate;
    }

    @Override
    public String toString() {
        return "OperationMetrics{" +
                "total=" + totalOperations +
                ", avg=" + averageDuration +
                ", p50=" + p50Duration +
                ", p95=" + p95Duration +
                ", p99=" + p99Duration +
                ", opsPerSec=" + operationsPerSecond +
                ", errorRate=" + errorRate +
                '}';
    }
}
