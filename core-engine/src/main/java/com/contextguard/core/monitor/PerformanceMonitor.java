package com.contextguard.core.monitor;

import com.contextguard.core.config.MonitorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Records timed operations and derives latency, throughput and error
 * statistics from them.
 *
 * <h3>Lifecycle of a measurement</h3>
 * <p>
 * {@link #startMeasurement(String, Map)} registers an open measurement in a
 * concurrent map without taking the monitor lock.
 * {@link #endMeasurement(String, Throwable)} closes it, appends it to the
 * bounded global history and to its operation's series, updates error
 * counters and trend buckets, and logs advisory alerts. Ending an unknown
 * or already-ended id logs a warning and returns empty.
 * </p>
 *
 * <h3>Compaction</h3>
 * <p>
 * The global history never exceeds {@code maxMeasurements}. Once per
 * cleanup interval, each operation series is trimmed to its newest
 * {@code maxMeasurements / 10} entries.
 * </p>
 *
 * @since 1.0.0
 */
public class PerformanceMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(PerformanceMonitor.class);

    static final int RECENT_SAMPLE_SIZE = 50;
    static final int RECENT_ERRORS_SIZE = 10;
    static final int ALERT_WINDOW = 100;
    static final double HOTSPOT_OPS_PER_SECOND = 10.0;
    static final double HOTSPOT_FREQUENT_AVG_MILLIS = 1000.0;

    private final int maxMeasurements;
    private final int maxPerOperation;
    private final Duration cleanupInterval;
    private final long slowOperationMillis;
    private final long highMemoryBytes;
    private final double errorRateThreshold;
    private final boolean trendAnalysisEnabled;
    private final boolean memoryTrackingEnabled;
    private final Clock clock;
    private final LongSupplier heapUsed;

    private final AtomicLong idSequence = new AtomicLong();
    private final Map<String, Measurement> open = new ConcurrentHashMap<>();

    // guarded by this
    private final Deque<Measurement> history = new ArrayDeque<>();
    private final Map<String, Deque<Measurement>> byOperation = new LinkedHashMap<>();
    private long totalOperations;
    private long errorCount;
    private long[] hourly = new long[TrendData.HOURS];
    private long[] daily = new long[TrendData.DAYS];
    private long[] weekly = new long[TrendData.WEEKS];
    private long memoryBaseline;
    private Instant lastCleanup;

    public PerformanceMonitor(MonitorSettings settings) {
        this(settings, Clock.systemDefaultZone());
    }

    public PerformanceMonitor(MonitorSettings settings, Clock clock) {
        this(settings, clock, PerformanceMonitor::currentHeapUsed);
    }

    /**
     * @param settings thresholds and bounds
     * @param clock    time source; its zone determines trend buckets
     * @param heapUsed heap usage probe in bytes
     * @throws IllegalArgumentException if a bound is not positive
     */
    PerformanceMonitor(MonitorSettings settings, Clock clock, LongSupplier heapUsed) {
        Objects.requireNonNull(settings, "MonitorSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.heapUsed = Objects.requireNonNull(heapUsed, "heap probe must not be null");
        this.maxMeasurements = settings.getMaxMeasurements();
        this.cleanupInterval = settings.cleanupInterval();
        this.slowOperationMillis = settings.getSlowOperationMillis();
        this.highMemoryBytes = settings.getHighMemoryBytes();
        this.errorRateThreshold = settings.getErrorRateThreshold();
        this.trendAnalysisEnabled = settings.isTrendAnalysisEnabled();
        this.memoryTrackingEnabled = settings.isMemoryTrackingEnabled();

        if (maxMeasurements <= 0) {
            throw new IllegalArgumentException("maxMeasurements must be > 0, got: " + maxMeasurements);
        }
        if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanupInterval must be > 0, got: " + cleanupInterval);
        }
        this.maxPerOperation = Math.max(1, maxMeasurements / 10);
        this.memoryBaseline = memoryTrackingEnabled ? heapUsed.getAsLong() : 0;
        this.lastCleanup = clock.instant();
    }

    public String startMeasurement(String operationName) {
        return startMeasurement(operationName, null, null);
    }

    public String startMeasurement(String operationName, Map<String, ?> metadata) {
        return startMeasurement(operationName, metadata, null);
    }

    /**
     * Open a measurement.
     *
     * @param operationName operation to attribute the time to
     * @param metadata      free-form context, may be {@code null}
     * @param tags          labels, may be {@code null}
     * @return identifier unique among open measurements
     */
    public String startMeasurement(String operationName, Map<String, ?> metadata, List<String> tags) {
        String id = "perf-" + idSequence.incrementAndGet();
        open.put(id, Measurement.open(id, operationName, clock.instant(), metadata, tags));
        return id;
    }

    public Optional<Measurement> endMeasurement(String id) {
        return endMeasurement(id, null);
    }

    /**
     * Close a measurement.
     *
     * @param id    identifier from {@code startMeasurement}
     * @param error failure of the measured operation, may be {@code null}
     * @return the closed measurement, or empty if the id is unknown
     */
    public Optional<Measurement> endMeasurement(String id, Throwable error) {
        Measurement started = id == null ? null : open.remove(id);
        if (started == null) {
            LOG.warn("Measurement {} not found", id);
            return Optional.empty();
        }
        Measurement closed = started.complete(clock.instant(), error);
        synchronized (this) {
            record(closed);
            checkAlerts(closed);
            if (trendAnalysisEnabled) {
                updateTrends(closed);
            }
            compactIfDue();
        }
        return Optional.of(closed);
    }

    /**
     * Time a call. A failure is recorded on the measurement and rethrown.
     *
     * @param operationName operation name
     * @param action        the call to time
     * @param <T>           result type
     * @return the call's result
     */
    public <T> T measure(String operationName, Supplier<T> action) {
        String id = startMeasurement(operationName);
        try {
            T result = action.get();
            endMeasurement(id);
            return result;
        } catch (RuntimeException | Error e) {
            endMeasurement(id, e);
            throw e;
        }
    }

    public synchronized PerformanceStats getStats() {
        List<Measurement> all = new ArrayList<>(history);
        Map<String, OperationMetrics> perOperation = new TreeMap<>();
        byOperation.forEach((name, series) -> perOperation.put(name, OperationMetrics.from(new ArrayList<>(series))));

        List<Measurement> recent = all.subList(Math.max(0, all.size() - RECENT_SAMPLE_SIZE), all.size());
        return new PerformanceStats(
                OperationMetrics.from(all),
                Collections.unmodifiableMap(perOperation),
                recent,
                new TrendData(hourly, daily, weekly),
                identifyHotspots(perOperation));
    }

    /**
     * @param operationName operation name
     * @return metrics for the operation, or empty if it has no measurements
     */
    public synchronized Optional<OperationMetrics> getOperationMetrics(String operationName) {
        Deque<Measurement> series = byOperation.get(operationName);
        if (series == null || series.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(OperationMetrics.from(new ArrayList<>(series)));
    }

    public List<Measurement> getSlowOperations() {
        return getSlowOperations(Duration.ofMillis(slowOperationMillis));
    }

    /**
     * @param threshold minimum duration, exclusive
     * @return measurements slower than the threshold, slowest first
     */
    public synchronized List<Measurement> getSlowOperations(Duration threshold) {
        long limit = threshold.toMillis();
        return history.stream()
                .filter(m -> m.getDurationMillis() > limit)
                .sorted(Comparator.comparingLong(Measurement::getDurationMillis).reversed())
                .toList();
    }

    public synchronized ErrorSummary getErrorSummary() {
        List<Measurement> failed = history.stream().filter(Measurement::isError).toList();
        Map<String, Long> byType = failed.stream()
                .collect(Collectors.groupingBy(Measurement::getErrorType, TreeMap::new, Collectors.counting()));
        List<Measurement> recent = failed.subList(Math.max(0, failed.size() - RECENT_ERRORS_SIZE), failed.size());
        double rate = totalOperations > 0 ? (double) errorCount / totalOperations : 0;
        return new ErrorSummary(errorCount, rate, byType, recent);
    }

    public synchronized MemoryUsage getMemoryUsage() {
        return new MemoryUsage(heapUsed.getAsLong(), memoryBaseline, Runtime.getRuntime().maxMemory(),
                memoryTrackingEnabled);
    }

    /**
     * Render current statistics as a Markdown report.
     *
     * @return the report
     */
    public synchronized String generateReport() {
        PerformanceStats stats = getStats();
        MemoryUsage memory = getMemoryUsage();
        ErrorSummary errors = getErrorSummary();
        OperationMetrics overall = stats.getOverall();

        StringBuilder sb = new StringBuilder();
        sb.append("# Context Guard Performance Report\n\n");
        sb.append("## Overall Metrics\n");
        sb.append(String.format(Locale.ROOT, "- **Total Operations**: %d%n", overall.getTotalOperations()));
        sb.append(String.format(Locale.ROOT, "- **Average Duration**: %.2fms%n", overall.getAverageDuration()));
        sb.append(String.format(Locale.ROOT, "- **p95 Duration**: %dms%n", overall.getP95Duration()));
        sb.append(String.format(Locale.ROOT, "- **Operations/Second**: %.2f%n", overall.getOperationsPerSecond()));
        sb.append(String.format(Locale.ROOT, "- **Error Rate**: %.2f%%%n", overall.getErrorRate() * 100));

        sb.append("\n## Memory Usage\n");
        sb.append("- **Heap Used**: ").append(formatBytes(memory.getCurrentHeapUsed())).append('\n');
        sb.append("- **Max Heap**: ").append(formatBytes(memory.getMaxHeap())).append('\n');
        sb.append("- **Memory Trend**: ").append(memory.getTrend().label()).append('\n');

        sb.append("\n## Top Operations by Duration\n");
        stats.getByOperation().entrySet().stream()
                .sorted(Comparator.comparingDouble(
                        (Map.Entry<String, OperationMetrics> e) -> e.getValue().getAverageDuration()).reversed())
                .limit(5)
                .forEach(e -> sb.append(String.format(Locale.ROOT, "- **%s**: %.2fms avg%n",
                        e.getKey(), e.getValue().getAverageDuration())));

        sb.append("\n## Performance Hotspots\n");
        stats.getHotspots().forEach(h -> sb.append(String.format(Locale.ROOT, "- **%s** (%s): %s%n",
                h.getOperation(), h.getImpact().label(), h.getRecommendation())));

        sb.append("\n## Recent Errors\n");
        errors.getRecentErrors().stream()
                .limit(3)
                .forEach(m -> sb.append(String.format(Locale.ROOT, "- %s: %s (%dms)%n",
                        m.getOperationName(), m.getErrorMessage(), m.getDurationMillis())));
        return sb.toString().trim();
    }

    /**
     * Drop all measurements, counters and trends and take a new memory
     * baseline.
     */
    public synchronized void reset() {
        open.clear();
        history.clear();
        byOperation.clear();
        totalOperations = 0;
        errorCount = 0;
        hourly = new long[TrendData.HOURS];
        daily = new long[TrendData.DAYS];
        weekly = new long[TrendData.WEEKS];
        memoryBaseline = memoryTrackingEnabled ? heapUsed.getAsLong() : 0;
        lastCleanup = clock.instant();
    }

    /**
     * @return number of measurements started but not yet ended
     */
    public int getOpenMeasurementCount() {
        return open.size();
    }

    private void record(Measurement closed) {
        history.addLast(closed);
        while (history.size() > maxMeasurements) {
            history.removeFirst();
        }
        byOperation.computeIfAbsent(closed.getOperationName(), k -> new ArrayDeque<>()).addLast(closed);
        totalOperations++;
        if (closed.isError()) {
            errorCount++;
        }
    }

    private void checkAlerts(Measurement closed) {
        try {
            if (closed.getDurationMillis() > slowOperationMillis) {
                LOG.warn("Slow operation '{}' took {}ms", closed.getOperationName(), closed.getDurationMillis());
            }
            if (memoryTrackingEnabled) {
                long used = heapUsed.getAsLong();
                if (used > highMemoryBytes) {
                    LOG.warn("High memory usage: {}", formatBytes(used));
                }
            }
            double recentErrorRate = recentErrorRate();
            if (recentErrorRate > errorRateThreshold) {
                LOG.warn("High error rate: {}%", String.format(Locale.ROOT, "%.2f", recentErrorRate * 100));
            }
        } catch (RuntimeException e) {
            LOG.warn("Performance alert evaluation failed: {}", e.getMessage());
        }
    }

    private double recentErrorRate() {
        int window = Math.min(ALERT_WINDOW, history.size());
        if (window == 0) {
            return 0;
        }
        int errors = 0;
        Iterator<Measurement> it = history.descendingIterator();
        for (int i = 0; i < window && it.hasNext(); i++) {
            if (it.next().isError()) {
                errors++;
            }
        }
        return (double) errors / window;
    }

    private void updateTrends(Measurement closed) {
        ZonedDateTime at = ZonedDateTime.ofInstant(clock.instant(), clock.getZone());
        long millis = closed.getDurationMillis();
        hourly[at.getHour()] += millis;
        daily[at.getDayOfWeek().getValue() % TrendData.DAYS] += millis;
        weekly[(at.getDayOfMonth() / 7) % TrendData.WEEKS] += millis;
    }

    private void compactIfDue() {
        Instant now = clock.instant();
        if (Duration.between(lastCleanup, now).compareTo(cleanupInterval) < 0) {
            return;
        }
        for (Deque<Measurement> series : byOperation.values()) {
            while (series.size() > maxPerOperation) {
                series.removeFirst();
            }
        }
        lastCleanup = now;
        LOG.debug("Compacted per-operation series to at most {} measurement(s)", maxPerOperation);
    }

    private List<Hotspot> identifyHotspots(Map<String, OperationMetrics> perOperation) {
        List<Hotspot> hotspots = new ArrayList<>();
        perOperation.forEach((name, metrics) -> {
            if (metrics.getAverageDuration() > slowOperationMillis) {
                hotspots.add(new Hotspot(name, Impact.HIGH, String.format(Locale.ROOT,
                        "Average duration %.2fms exceeds threshold. Consider optimization.",
                        metrics.getAverageDuration())));
            } else if (metrics.getOperationsPerSecond() > HOTSPOT_OPS_PER_SECOND
                    && metrics.getAverageDuration() > HOTSPOT_FREQUENT_AVG_MILLIS) {
                hotspots.add(new Hotspot(name, Impact.MEDIUM, String.format(Locale.ROOT,
                        "High frequency operation with %.2fms duration. Consider caching.",
                        metrics.getAverageDuration())));
            } else if (metrics.getErrorRate() > errorRateThreshold) {
                hotspots.add(new Hotspot(name, Impact.HIGH, String.format(Locale.ROOT,
                        "Error rate %.2f%% is above threshold. Investigate error causes.",
                        metrics.getErrorRate() * 100)));
            }
        });
        hotspots.sort(Comparator.comparing(Hotspot::getImpact));
        return hotspots;
    }

    private static long currentHeapUsed() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        String[] units = { "B", "KB", "MB", "GB", "TB" };
        int i = (int) Math.min(units.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
        return String.format(Locale.ROOT, "%.2f %s", bytes / Math.pow(1024, i), units[i]);
    }
}
