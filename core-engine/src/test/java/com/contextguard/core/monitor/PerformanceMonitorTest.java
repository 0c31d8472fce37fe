package com.contextguard.core.monitor;

import com.contextguard.core.config.MonitorSettings;
import com.contextguard.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PerformanceMonitor}.
 */
class PerformanceMonitorTest {

    private static final long MIB = 1024L * 1024;

    // a Sunday
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private MonitorSettings settings;
    private AtomicLong heap;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        settings = new MonitorSettings();
        heap = new AtomicLong(50 * MIB);
    }

    @Test
    @DisplayName("Should compute nearest-rank percentiles over durations 1..100")
    void shouldComputePercentiles() {
        PerformanceMonitor monitor = monitor();
        for (int i = 1; i <= 100; i++) {
            timed(monitor, "op", i);
        }

        OperationMetrics metrics = monitor.getOperationMetrics("op").orElseThrow();
        assertThat(metrics.getTotalOperations()).isEqualTo(100);
        assertThat(metrics.getP50Duration()).isEqualTo(50);
        assertThat(metrics.getP95Duration()).isEqualTo(95);
        assertThat(metrics.getP99Duration()).isEqualTo(99);
        assertThat(metrics.getMinDuration()).isEqualTo(1);
        assertThat(metrics.getMaxDuration()).isEqualTo(100);
        assertThat(metrics.getAverageDuration()).isEqualTo(50.5);
    }

    @Test
    @DisplayName("Percentile index should be clamped to the sample")
    void percentileShouldClamp() {
        assertThat(Percentiles.of(new long[] { 7 }, 0.99)).isEqualTo(7);
        assertThat(Percentiles.of(new long[] { 1, 2 }, 0.01)).isEqualTo(1);
        assertThat(Percentiles.of(new long[0], 0.5)).isZero();
    }

    @Test
    @DisplayName("Ending an unknown or already ended id should return empty")
    void shouldIgnoreUnknownIds() {
        PerformanceMonitor monitor = monitor();
        String id = monitor.startMeasurement("op");

        assertThat(monitor.endMeasurement("perf-unknown")).isEmpty();
        assertThat(monitor.endMeasurement(id)).isPresent();
        assertThat(monitor.endMeasurement(id)).isEmpty();
        assertThat(monitor.endMeasurement(null)).isEmpty();
        assertThat(monitor.getStats().getOverall().getTotalOperations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Open measurements should have unique ids")
    void shouldIssueUniqueIds() {
        PerformanceMonitor monitor = monitor();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            ids.add(monitor.startMeasurement("op", Map.of("i", i)));
        }

        assertThat(ids).doesNotHaveDuplicates();
        assertThat(monitor.getOpenMeasurementCount()).isEqualTo(100);
    }

    @Test
    @DisplayName("measure() should record failures and rethrow")
    void measureShouldRecordErrors() {
        PerformanceMonitor monitor = monitor();

        assertThat(monitor.measure("ok", () -> 42)).isEqualTo(42);
        assertThatThrownBy(() -> monitor.measure("boom", () -> {
            throw new IllegalStateException("exploded");
        })).isInstanceOf(IllegalStateException.class);

        ErrorSummary errors = monitor.getErrorSummary();
        assertThat(errors.getTotalErrors()).isEqualTo(1);
        assertThat(errors.getErrorRate()).isEqualTo(0.5);
        assertThat(errors.getErrorsByType()).containsEntry("IllegalStateException", 1L);
        assertThat(errors.getRecentErrors()).singleElement()
                .satisfies(m -> assertThat(m.getErrorMessage()).isEqualTo("exploded"));
    }

    @Test
    @DisplayName("A single measurement should count over one second")
    void singleMeasurementThroughput() {
        PerformanceMonitor monitor = monitor();
        timed(monitor, "op", 10);

        assertThat(monitor.getOperationMetrics("op").orElseThrow().getOperationsPerSecond()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should flag operations above the slow threshold as high impact")
    void shouldFlagSlowOperations() {
        PerformanceMonitor monitor = monitor();
        timed(monitor, "slow", 3_500);
        timed(monitor, "fast", 5);

        List<Hotspot> hotspots = monitor.getStats().getHotspots();
        assertThat(hotspots).singleElement().satisfies(h -> {
            assertThat(h.getOperation()).isEqualTo("slow");
            assertThat(h.getImpact()).isEqualTo(Impact.HIGH);
            assertThat(h.getRecommendation()).contains("Consider optimization");
        });
    }

    @Test
    @DisplayName("Should flag frequent, moderately slow operations as medium impact")
    void shouldFlagFrequentOperations() {
        PerformanceMonitor monitor = monitor();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            clock.set(T0.plusMillis(50L * i));
            ids.add(monitor.startMeasurement("lookup"));
        }
        for (int i = 0; i < 20; i++) {
            clock.set(T0.plusMillis(50L * i + 1_200));
            monitor.endMeasurement(ids.get(i));
        }

        OperationMetrics metrics = monitor.getOperationMetrics("lookup").orElseThrow();
        assertThat(metrics.getAverageDuration()).isEqualTo(1_200.0);
        assertThat(metrics.getOperationsPerSecond()).isGreaterThan(10.0);
        assertThat(monitor.getStats().getHotspots()).singleElement().satisfies(h -> {
            assertThat(h.getImpact()).isEqualTo(Impact.MEDIUM);
            assertThat(h.getRecommendation()).contains("Consider caching");
        });
    }

    @Test
    @DisplayName("Should flag error-prone operations and list high impact first")
    void shouldOrderHotspotsByImpact() {
        PerformanceMonitor monitor = monitor();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            clock.set(T0.plusMillis(50L * i));
            ids.add(monitor.startMeasurement("a_frequent"));
        }
        for (int i = 0; i < 20; i++) {
            clock.set(T0.plusMillis(50L * i + 1_200));
            monitor.endMeasurement(ids.get(i));
        }
        String failing = monitor.startMeasurement("z_flaky");
        monitor.endMeasurement(failing, new IllegalArgumentException("bad"));

        List<Hotspot> hotspots = monitor.getStats().getHotspots();
        assertThat(hotspots).extracting(Hotspot::getOperation).containsExactly("z_flaky", "a_frequent");
        assertThat(hotspots.get(0).getRecommendation()).contains("Investigate error causes");
    }

    @Test
    @DisplayName("Global history should stay within maxMeasurements")
    void shouldBoundHistory() {
        settings.setMaxMeasurements(10);
        PerformanceMonitor monitor = monitor();
        for (int i = 0; i < 15; i++) {
            timed(monitor, "op", 1);
        }

        assertThat(monitor.getStats().getOverall().getTotalOperations()).isEqualTo(10);
    }

    @Test
    @DisplayName("Per-operation series should be compacted once the cleanup interval elapsed")
    void shouldCompactPerOperationSeries() {
        settings.setMaxMeasurements(100);
        PerformanceMonitor monitor = monitor();
        for (int i = 0; i < 30; i++) {
            timed(monitor, "op", 1);
        }
        assertThat(monitor.getOperationMetrics("op").orElseThrow().getTotalOperations()).isEqualTo(30);

        clock.advance(Duration.ofMinutes(5));
        timed(monitor, "op", 1);

        assertThat(monitor.getOperationMetrics("op").orElseThrow().getTotalOperations()).isEqualTo(10);
        assertThat(monitor.getStats().getOverall().getTotalOperations()).isEqualTo(31);
    }

    @Test
    @DisplayName("Should fold durations into hourly, daily and weekly buckets")
    void shouldUpdateTrends() {
        PerformanceMonitor monitor = monitor();
        timed(monitor, "op", 250);

        TrendData trends = monitor.getStats().getTrends();
        assertThat(trends.getHourly()[10]).isEqualTo(250);
        assertThat(trends.getDaily()[0]).isEqualTo(250);
        assertThat(trends.getWeekly()[0]).isEqualTo(250);
    }

    @Test
    @DisplayName("Should skip trends when trend analysis is disabled")
    void shouldSkipTrendsWhenDisabled() {
        settings.setTrendAnalysisEnabled(false);
        PerformanceMonitor monitor = monitor();
        timed(monitor, "op", 250);

        assertThat(monitor.getStats().getTrends().getHourly()).containsOnly(0L);
    }

    @Test
    @DisplayName("Should report memory trend relative to the baseline")
    void shouldReportMemoryTrend() {
        PerformanceMonitor monitor = monitor();
        assertThat(monitor.getMemoryUsage().getTrend()).isEqualTo(MemoryUsage.Trend.STABLE);

        heap.set(80 * MIB);
        MemoryUsage usage = monitor.getMemoryUsage();
        assertThat(usage.getTrend()).isEqualTo(MemoryUsage.Trend.INCREASING);
        assertThat(usage.getDeltaHeapUsed()).isEqualTo(30 * MIB);

        heap.set(20 * MIB);
        assertThat(monitor.getMemoryUsage().getTrend()).isEqualTo(MemoryUsage.Trend.DECREASING);
    }

    @Test
    @DisplayName("Alert evaluation failures should never reach the caller")
    void alertFailuresShouldBeContained() {
        PerformanceMonitor monitor = new PerformanceMonitor(settings, clock, new FailingAfterFirstCall());
        String id = monitor.startMeasurement("op");

        Optional<Measurement> closed = monitor.endMeasurement(id);

        assertThat(closed).isPresent();
    }

    @Test
    @DisplayName("Should list slow operations slowest first")
    void shouldListSlowOperations() {
        PerformanceMonitor monitor = monitor();
        timed(monitor, "a", 150);
        timed(monitor, "b", 50);
        timed(monitor, "c", 400);

        assertThat(monitor.getSlowOperations(Duration.ofMillis(100)))
                .extracting(Measurement::getOperationName)
                .containsExactly("c", "a");
    }

    @Test
    @DisplayName("generateReport() should render a Markdown summary")
    void shouldGenerateReport() {
        PerformanceMonitor monitor = monitor();
        timed(monitor, "analyze_code", 120);

        String report = monitor.generateReport();

        assertThat(report).startsWith("# Context Guard Performance Report");
        assertThat(report).contains("## Overall Metrics", "**Total Operations**: 1", "**analyze_code**: 120.00ms avg");
    }

    @Test
    @DisplayName("reset() should drop all data")
    void shouldReset() {
        PerformanceMonitor monitor = monitor();
        timed(monitor, "op", 10);
        monitor.startMeasurement("open");

        monitor.reset();

        PerformanceStats stats = monitor.getStats();
        assertThat(stats.getOverall().getTotalOperations()).isZero();
        assertThat(stats.getByOperation()).isEmpty();
        assertThat(stats.getTrends().getHourly()).containsOnly(0L);
        assertThat(monitor.getOpenMeasurementCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PerformanceMonitor monitor() {
        return new PerformanceMonitor(settings, clock, heap::get);
    }

    private void timed(PerformanceMonitor monitor, String operation, long millis) {
        String id = monitor.startMeasurement(operation);
        clock.advanceMillis(millis);
        monitor.endMeasurement(id);
    }

    /** Heap probe that works for the baseline and fails afterwards. */
    private static final class FailingAfterFirstCall implements LongSupplier {
        private boolean called;

        @Override
        public long getAsLong() {
            if (called) {
                throw new IllegalStateException("probe failure");
            }
            called = true;
            return 0;
        }
    }
}
