package com.contextguard.core.orchestration;

import com.contextguard.core.cache.CacheKeyGenerator;
import com.contextguard.core.cache.CacheStats;
import com.contextguard.core.cache.CacheStore;
import com.contextguard.core.cache.JsonSizeEstimator;
import com.contextguard.core.config.CacheSettings;
import com.contextguard.core.config.GuardConfig;
import com.contextguard.core.config.HistorySettings;
import com.contextguard.core.config.MonitorSettings;
import com.contextguard.core.config.RemoteSettings;
import com.contextguard.core.detection.CodeDetector;
import com.contextguard.core.detection.DetectionException;
import com.contextguard.core.detection.DetectorFactory;
import com.contextguard.core.detection.HeuristicDetector;
import com.contextguard.core.detection.RemoteDetector;
import com.contextguard.core.model.AnalysisRequest;
import com.contextguard.core.model.AnalysisResult;
import com.contextguard.core.model.DetectionReport;
import com.contextguard.core.model.Provenance;
import com.contextguard.core.monitor.PerformanceMonitor;
import com.contextguard.core.monitor.PerformanceStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the analysis engine.
 *
 * <h3>Request flow</h3>
 * <ol>
 * <li>A fresh cache entry for the request fingerprint is returned as a copy
 * tagged {@link Provenance#CACHE} with zero latency; no detector runs.</li>
 * <li>If the same fingerprint is already being analysed, the caller waits
 * for that analysis and receives the same result instance.</li>
 * <li>Otherwise the fallback chain runs: the primary detector, then the
 * remote detector when enabled and admitted by the circuit breaker, then
 * the heuristic detector, which always produces a result.</li>
 * <li>The result is written to the cache, appended to the recent-scan log
 * and scheduled for persistence.</li>
 * </ol>
 *
 * <p>
 * Requests with different fingerprints never wait for each other. A failing
 * tier is logged and skipped; only a failure of the heuristic tier reaches
 * the caller, as an {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    static final String OP_ANALYZE = "analyze_code";
    static final String OP_CACHE_LOOKUP = "cache_lookup";
    static final String OP_DETECTOR_PREFIX = "detector.";
    static final int DEFAULT_RECENT_LIMIT = 10;
    static final int SUMMARY_WINDOW = 20;

    private final CodeDetector primary;
    private final CodeDetector remote;
    private final CircuitBreaker breaker;
    private final HeuristicDetector fallback;
    private final CacheStore<AnalysisResult> cache;
    private final PerformanceMonitor monitor;
    private final RecentScanLog recentScans;
    private final ScanHistoryStore historyStore;
    private final PersistenceQueue persistence;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<AnalysisResult>> inFlight =
            new ConcurrentHashMap<>();
    private final AtomicLong coalescedRequests = new AtomicLong();

    private AnalysisOrchestrator(Builder builder) {
        this.clock = builder.clock;
        this.primary = Objects.requireNonNull(builder.primary, "Primary detector must not be null");
        this.fallback = builder.fallback != null ? builder.fallback : new HeuristicDetector();
        this.remote = builder.remote;
        this.breaker = builder.breaker;
        this.cache = builder.cache != null
                ? builder.cache
                : new CacheStore<>(new CacheSettings(), new JsonSizeEstimator(), clock);
        this.monitor = builder.monitor != null
                ? builder.monitor
                : new PerformanceMonitor(new MonitorSettings(), clock);
        this.recentScans = new RecentScanLog(builder.historyCapacity);
        this.historyStore = builder.historyStore;
        this.persistence = historyStore != null
                ? new PersistenceQueue(historyStore, recentScans::snapshot)
                : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnalysisOrchestrator fromConfig(GuardConfig config) {
        return fromConfig(config, Clock.systemDefaultZone());
    }

    /**
     * Wire an orchestrator from configuration: a semantic primary tier over
     * the configured rules, the remote tier when enabled, the heuristic
     * fallback, and a JSON history file when a path is configured.
     *
     * @param config validated configuration
     * @param clock  time source shared by all components
     * @return a new, not yet started orchestrator
     */
    public static AnalysisOrchestrator fromConfig(GuardConfig config, Clock clock) {
        Objects.requireNonNull(config, "GuardConfig must not be null");
        HistorySettings history = config.getHistory();

        Builder builder = builder()
                .clock(clock)
                .primary(DetectorFactory.create("semantic", config))
                .fallback(new HeuristicDetector())
                .cache(new CacheStore<>(config.getCache(), new JsonSizeEstimator(), clock))
                .monitor(new PerformanceMonitor(config.getMonitor(), clock))
                .historyCapacity(history.getMaxEntries());

        RemoteSettings remoteSettings = config.getRemote();
        if (remoteSettings.isEnabled()) {
            RemoteDetector remoteDetector = new RemoteDetector(remoteSettings);
            builder.remote(remoteDetector, new CircuitBreaker(remoteDetector,
                    remoteSettings.probeInterval(), remoteSettings.probeTimeout(), clock));
            LOG.info("Remote detection tier enabled at {}", remoteSettings.getBaseUrl());
        }
        history.snapshotPath().ifPresent(path -> builder.historyStore(
                new JsonFileScanHistoryStore(path, history.getMaxEntries(), history.maxAge(), clock)));
        return builder.build();
    }

    /**
     * Load persisted history and start cache maintenance. A history that
     * cannot be read is logged and replaced by an empty log.
     */
    public void start() {
        if (historyStore != null) {
            try {
                recentScans.replaceAll(historyStore.load());
            } catch (IOException | RuntimeException e) {
                LOG.warn("Could not load scan history, starting empty: {}", e.toString());
            }
        }
        cache.start();
        LOG.info("AnalysisOrchestrator started (remote tier {}, {} scan(s) in history)",
                remote != null ? "enabled" : "disabled", recentScans.size());
    }

    public AnalysisResult analyzeCode(String content, String language) {
        return analyzeCode(content, language, null);
    }

    /**
     * Analyse one snippet.
     *
     * @param content  text to analyse
     * @param language language tag
     * @param name     source name, may be {@code null}
     * @return the result
     * @throws IllegalStateException if every detection tier failed
     */
    public AnalysisResult analyzeCode(String content, String language, String name) {
        return analyze(AnalysisRequest.of(content, language, name));
    }

    /**
     * Analyse one request.
     *
     * @param request the request
     * @return the result
     * @throws IllegalStateException if every detection tier failed
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "AnalysisRequest must not be null");
        String measurement = monitor.startMeasurement(OP_ANALYZE,
                Map.of("language", request.getLanguage(), "length", request.getContent().length()));
        try {
            AnalysisResult result = analyzeOnce(request);
            monitor.endMeasurement(measurement);
            return result;
        } catch (RuntimeException e) {
            monitor.endMeasurement(measurement, e);
            throw e;
        }
    }

    private AnalysisResult analyzeOnce(AnalysisRequest request) {
        String key = CacheKeyGenerator.generate(request);

        Optional<AnalysisResult> cached = monitor.measure(OP_CACHE_LOOKUP, () -> cache.get(key));
        if (cached.isPresent()) {
            LOG.debug("Cache hit for {}", key);
            return cached.get().withProvenance(Provenance.CACHE, Duration.ZERO);
        }

        CompletableFuture<AnalysisResult> mine = new CompletableFuture<>();
        CompletableFuture<AnalysisResult> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            coalescedRequests.incrementAndGet();
            LOG.debug("Joining in-flight analysis for {}", key);
            return await(existing);
        }

        try {
            // a concurrent winner may have completed between the lookup and the claim
            Optional<AnalysisResult> raced = cache.get(key);
            AnalysisResult result;
            if (raced.isPresent()) {
                result = raced.get().withProvenance(Provenance.CACHE, Duration.ZERO);
            } else {
                result = runChain(request);
                if (!cache.set(key, result)) {
                    LOG.debug("Result for {} not cached", key);
                }
                recentScans.add(result);
                if (persistence != null) {
                    persistence.requestSave();
                }
            }
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private AnalysisResult runChain(AnalysisRequest request) {
        Instant started = clock.instant();

        Optional<DetectionReport> report = attempt(primary, request);
        if (report.isPresent()) {
            return normalize(report.get(), Provenance.MODULAR, request, started);
        }

        if (remote != null && breaker.allowRequest()) {
            report = attemptRemote(request);
            if (report.isPresent()) {
                return normalize(report.get(), Provenance.REMOTE, request, started);
            }
        }

        DetectionReport local;
        try {
            local = monitor.measure(OP_DETECTOR_PREFIX + fallback.getName(), () -> fallback.analyze(request));
        } catch (RuntimeException e) {
            LOG.error("All detection tiers failed for {}", request, e);
            throw new IllegalStateException("All detection tiers failed: " + e.getMessage(), e);
        }
        return normalize(local, Provenance.LOCAL_FALLBACK, request, started);
    }

    private Optional<DetectionReport> attempt(CodeDetector detector, AnalysisRequest request) {
        String measurement = monitor.startMeasurement(OP_DETECTOR_PREFIX + detector.getName());
        try {
            Optional<DetectionReport> report = detector.detect(request);
            monitor.endMeasurement(measurement);
            if (report.isEmpty()) {
                LOG.debug("Detector '{}' produced no result, trying next tier", detector.getName());
            }
            return report;
        } catch (DetectionException | RuntimeException e) {
            monitor.endMeasurement(measurement, e);
            LOG.warn("Detector '{}' failed, trying next tier: {}", detector.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<DetectionReport> attemptRemote(AnalysisRequest request) {
        String measurement = monitor.startMeasurement(OP_DETECTOR_PREFIX + remote.getName());
        try {
            Optional<DetectionReport> report = remote.detect(request);
            monitor.endMeasurement(measurement);
            breaker.recordSuccess();
            return report;
        } catch (DetectionException | RuntimeException e) {
            monitor.endMeasurement(measurement, e);
            breaker.recordFailure();
            LOG.warn("Remote detector failed, falling back to local analysis: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private AnalysisResult normalize(DetectionReport report, Provenance provenance,
            AnalysisRequest request, Instant started) {
        Instant now = clock.instant();
        AnalysisResult result = AnalysisResult.fromReport(report, provenance)
                .timestamp(now)
                .sourceName(request.getName().orElse(AnalysisResult.UNKNOWN_SOURCE))
                .latency(Duration.between(started, now))
                .build();
        LOG.debug("Analysis of {} complete: risk={}, patterns={}, provenance={}",
                result.getSourceName(), result.getRiskLevel(), result.getDetectedPatterns(),
                provenance.label());
        return result;
    }

    private static AnalysisResult await(CompletableFuture<AnalysisResult> pending) {
        try {
            return pending.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("In-flight analysis failed", cause);
        }
    }

    public List<AnalysisResult> getRecentScans() {
        return getRecentScans(DEFAULT_RECENT_LIMIT);
    }

    /**
     * @param limit maximum number of results
     * @return the newest results, oldest first
     */
    public List<AnalysisResult> getRecentScans(int limit) {
        return recentScans.latest(limit);
    }

    /**
     * @return risk distribution over the last twenty scans
     */
    /**
     * @return number of requests that joined an identical analysis already in flight
     */
    public long getCoalescedRequestCount() {
        return coalescedRequests.get();
    }

    public SecuritySummary getSecuritySummary() {
        return SecuritySummary.of(recentScans.latest(SUMMARY_WINDOW));
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public PerformanceStats getPerformanceStats() {
        return monitor.getStats();
    }

    public PerformanceMonitor getMonitor() {
        return monitor;
    }

    /**
     * @return state of the remote circuit breaker, empty when the remote
     *         tier is disabled
     */
    public Optional<CircuitBreaker.State> getRemoteState() {
        return breaker == null ? Optional.empty() : Optional.of(breaker.getState());
    }

    /**
     * @param pattern regular expression, or literal text, matched against
     *                cache keys
     * @return number of removed entries
     */
    public int invalidateCache(String pattern) {
        return cache.invalidate(pattern);
    }

    /**
     * Block until all scheduled history saves have run.
     */
    public void flushHistory() {
        if (persistence != null) {
            persistence.flush();
        }
    }

    @Override
    public void close() {
        if (persistence != null) {
            persistence.close();
        }
        cache.close();
        if (breaker != null) {
            breaker.close();
        }
        LOG.info("AnalysisOrchestrator closed");
    }

    /**
     * Fluent builder for {@link AnalysisOrchestrator}.
     */
    public static class Builder {
        private CodeDetector primary;
        private CodeDetector remote;
        private CircuitBreaker breaker;
        private HeuristicDetector fallback;
        private CacheStore<AnalysisResult> cache;
        private PerformanceMonitor monitor;
        private ScanHistoryStore historyStore;
        private int historyCapacity = 50;
        private Clock clock = Clock.systemDefaultZone();

        public Builder primary(CodeDetector primary) {
            this.primary = primary;
            return this;
        }

        /**
         * @param remote  remote tier
         * @param breaker circuit breaker guarding it
         */
        public Builder remote(CodeDetector remote, CircuitBreaker breaker) {
            this.remote = Objects.requireNonNull(remote, "remote detector must not be null");
            this.breaker = Objects.requireNonNull(breaker, "circuit breaker must not be null");
            return this;
        }

        public Builder fallback(HeuristicDetector fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder cache(CacheStore<AnalysisResult> cache) {
            this.cache = cache;
            return this;
        }

        public Builder monitor(PerformanceMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder historyStore(ScanHistoryStore historyStore) {
            this.historyStore = historyStore;
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock must not be null");
            return this;
        }

        /**
         * @return a new orchestrator
         * @throws NullPointerException     if no primary detector was set
         * @throws IllegalArgumentException if the history capacity is not
         *                                  positive
         */
        public AnalysisOrchestrator build() {
            return new AnalysisOrchestrator(this);
        }
    }
}
