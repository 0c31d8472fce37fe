package com.contextguard.core.cache;

import com.contextguard.core.config.CacheSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bounded in-memory cache with per-entry TTL and score-based eviction.
 *
 * <h3>Bounds</h3>
 * <p>
 * Both the entry count and the total estimated size stay within the
 * configured limits after every mutation. When a new entry does not fit,
 * the entries with the lowest score are evicted first, where
 * {@code score = 0.3 * hitCount + 0.7 * (createdAtMillis / 1e6)}.
 * </p>
 *
 * <h3>Expiry</h3>
 * <p>
 * Expiry is checked lazily on every read, {@link #has(String)} included; an
 * expired entry is removed and reported as a miss. {@link #start()}
 * additionally schedules {@link #optimize()} on a daemon thread.
 * </p>
 *
 * <p>
 * All operations are guarded by the instance monitor.
 * </p>
 *
 * @param <T> payload type
 * @since 1.0.0
 */
public class CacheStore<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CacheStore.class);

    private final long maxSizeBytes;
    private final int maxEntries;
    private final Duration defaultTtl;
    private final Duration cleanupInterval;
    private final SizeEstimator sizeEstimator;
    private final Clock clock;

    private final Map<String, CacheEntry<T>> entries = new LinkedHashMap<>();
    private long totalSize;
    private long hits;
    private long misses;
    private long evictions;
    private long rejections;

    private ScheduledExecutorService maintenance;

    public CacheStore(CacheSettings settings) {
        this(settings, new JsonSizeEstimator(), Clock.systemUTC());
    }

    /**
     * @param settings      bounds and TTL
     * @param sizeEstimator payload size estimator
     * @param clock         time source for creation and expiry
     * @throws IllegalArgumentException if a bound is not positive
     */
    public CacheStore(CacheSettings settings, SizeEstimator sizeEstimator, Clock clock) {
        Objects.requireNonNull(settings, "CacheSettings must not be null");
        this.sizeEstimator = Objects.requireNonNull(sizeEstimator, "SizeEstimator must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.maxSizeBytes = settings.getMaxSizeBytes();
        this.maxEntries = settings.getMaxEntries();
        this.defaultTtl = settings.defaultTtl();
        this.cleanupInterval = settings.cleanupInterval();

        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be > 0, got: " + maxSizeBytes);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
        }
        if (defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be > 0, got: " + defaultTtl);
        }
        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("cleanupInterval must be > 0, got: " + cleanupInterval);
        }
    }

    /**
     * Look up a payload. A hit increments the entry's hit count.
     *
     * @param key cache key
     * @return the payload, or empty on a miss or an expired entry
     */
    public synchronized Optional<T> get(String key) {
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            remove(key);
            misses++;
            return Optional.empty();
        }
        entry.recordHit();
        hits++;
        return Optional.of(entry.getPayload());
    }

    /**
     * Store a payload with the default TTL.
     *
     * @see #set(String, Object, Duration)
     */
    public boolean set(String key, T payload) {
        return set(key, payload, null);
    }

    /**
     * Store a payload, replacing any existing entry for the key.
     *
     * <p>
     * The payload is rejected, and {@code false} returned, if its size
     * cannot be estimated or exceeds the total size bound. Otherwise the
     * lowest-scored entries are evicted until the new entry fits.
     * </p>
     *
     * @param key     cache key
     * @param payload value to cache
     * @param ttl     time to live; {@code null} or non-positive means the
     *                default TTL
     * @return {@code true} if the payload was stored
     */
    public synchronized boolean set(String key, T payload, Duration ttl) {
        Objects.requireNonNull(key, "Cache key must not be null");
        if (payload == null) {
            return reject(key, "null payload");
        }
        Duration entryTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;

        long size;
        try {
            size = sizeEstimator.estimate(payload);
        } catch (RuntimeException e) {
            return reject(key, "size estimation failed: " + e.getMessage());
        }
        if (size < 0 || size > maxSizeBytes) {
            return reject(key, "entry too large (" + size + " bytes, limit " + maxSizeBytes + ")");
        }

        remove(key);
        ensureSpace(size);
        entries.put(key, new CacheEntry<>(payload, clock.instant(), entryTtl, size));
        totalSize += size;
        return true;
    }

    /**
     * @param key cache key
     * @return {@code true} if a non-expired entry exists; an expired one is
     *         removed
     */
    public synchronized boolean has(String key) {
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.instant())) {
            remove(key);
            return false;
        }
        return true;
    }

    /**
     * @param key cache key
     * @return {@code true} if an entry was removed
     */
    public synchronized boolean delete(String key) {
        return remove(key);
    }

    /**
     * Remove every entry and reset all counters.
     */
    public synchronized void clear() {
        entries.clear();
        totalSize = 0;
        hits = 0;
        misses = 0;
        evictions = 0;
        rejections = 0;
    }

    /**
     * Remove every entry whose key contains a match of the given pattern.
     * Text that is not a valid regular expression is matched literally.
     *
     * @param patternOrText regular expression or literal text
     * @return number of removed entries
     */
    public synchronized int invalidate(String patternOrText) {
        Objects.requireNonNull(patternOrText, "Invalidation pattern must not be null");
        Pattern pattern;
        try {
            pattern = Pattern.compile(patternOrText);
        } catch (PatternSyntaxException e) {
            LOG.debug("'{}' is not a valid regex, matching literally", patternOrText);
            pattern = Pattern.compile(Pattern.quote(patternOrText));
        }
        return invalidate(pattern);
    }

    public synchronized int invalidate(Pattern pattern) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry<T>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry<T>> e = it.next();
            if (pattern.matcher(e.getKey()).find()) {
                totalSize -= e.getValue().getEstimatedSize();
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Invalidated {} cache entr(ies) matching '{}'", removed, pattern);
        }
        return removed;
    }

    public synchronized List<String> getKeys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * @param pattern filter applied with {@code find} semantics
     * @return keys containing a match, in insertion order
     */
    public synchronized List<String> getKeys(Pattern pattern) {
        return entries.keySet().stream()
                .filter(k -> pattern.matcher(k).find())
                .toList();
    }

    /**
     * Remove every expired entry.
     *
     * @return number of removed entries
     */
    public synchronized int pruneExpired() {
        Instant now = clock.instant();
        int pruned = 0;
        Iterator<CacheEntry<T>> it = entries.values().iterator();
        while (it.hasNext()) {
            CacheEntry<T> entry = it.next();
            if (entry.isExpired(now)) {
                totalSize -= entry.getEstimatedSize();
                it.remove();
                pruned++;
            }
        }
        return pruned;
    }

    /**
     * Prune expired entries, then evict by ascending score while either
     * bound is exceeded.
     */
    public synchronized void optimize() {
        int pruned = pruneExpired();
        int evicted = 0;
        if (entries.size() > maxEntries || totalSize > maxSizeBytes) {
            List<String> byScore = entries.entrySet().stream()
                    .sorted(Comparator.comparingDouble(e -> e.getValue().score()))
                    .map(Map.Entry::getKey)
                    .toList();
            for (String key : byScore) {
                if (entries.size() <= maxEntries && totalSize <= maxSizeBytes) {
                    break;
                }
                remove(key);
                evictions++;
                evicted++;
            }
        }
        if (pruned > 0 || evicted > 0) {
            LOG.debug("Cache optimized: {} expired, {} evicted, {} remaining", pruned, evicted, entries.size());
        }
    }

    public synchronized CacheStats getStats() {
        Instant oldest = null;
        Instant newest = null;
        for (CacheEntry<T> entry : entries.values()) {
            Instant created = entry.getCreatedAt();
            if (oldest == null || created.isBefore(oldest)) {
                oldest = created;
            }
            if (newest == null || created.isAfter(newest)) {
                newest = created;
            }
        }
        return new CacheStats(entries.size(), totalSize, hits, misses, evictions, rejections, oldest, newest);
    }

    /**
     * Preload entries with the default TTL.
     *
     * @param payloads key to payload
     * @return number of payloads stored
     */
    public synchronized int warmup(Map<String, T> payloads) {
        int stored = 0;
        for (Map.Entry<String, T> e : payloads.entrySet()) {
            if (set(e.getKey(), e.getValue())) {
                stored++;
            }
        }
        LOG.info("Cache warmed up with {}/{} entr(ies)", stored, payloads.size());
        return stored;
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Schedule {@link #optimize()} every cleanup interval. Idempotent.
     */
    public synchronized void start() {
        if (maintenance != null) {
            return;
        }
        maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "context-guard-cache-maintenance");
            t.setDaemon(true);
            return t;
        });
        long period = cleanupInterval.toMillis();
        maintenance.scheduleAtFixedRate(this::runMaintenance, period, period, TimeUnit.MILLISECONDS);
        LOG.info("Cache maintenance scheduled every {}", cleanupInterval);
    }

    /**
     * Stop maintenance and drop all entries.
     */
    @Override
    public synchronized void close() {
        if (maintenance != null) {
            maintenance.shutdownNow();
            maintenance = null;
        }
        clear();
    }

    private void runMaintenance() {
        try {
            optimize();
        } catch (RuntimeException e) {
            LOG.warn("Cache maintenance failed: {}", e.getMessage(), e);
        }
    }

    private void ensureSpace(long requiredSize) {
        while ((entries.size() >= maxEntries || totalSize + requiredSize > maxSizeBytes)
                && !entries.isEmpty()) {
            evictLowestScore();
        }
    }

    private void evictLowestScore() {
        String victim = null;
        double lowest = Double.POSITIVE_INFINITY;
        for (Map.Entry<String, CacheEntry<T>> e : entries.entrySet()) {
            double score = e.getValue().score();
            if (score < lowest) {
                lowest = score;
                victim = e.getKey();
            }
        }
        if (victim != null) {
            remove(victim);
            evictions++;
            LOG.debug("Evicted cache entry {}", victim);
        }
    }

    private boolean remove(String key) {
        CacheEntry<T> removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        totalSize -= removed.getEstimatedSize();
        return true;
    }

    private boolean reject(String key, String reason) {
        rejections++;
        LOG.warn("Cache rejected entry {}: {}", key, reason);
        return false;
    }
}
