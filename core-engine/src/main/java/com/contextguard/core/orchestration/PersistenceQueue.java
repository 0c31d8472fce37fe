package com.contextguard.core.orchestration;

import com.contextguard.core.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single-writer queue that saves the recent-scan log in the background.
 *
 * <p>
 * Each {@link #requestSave()} appends a write to a {@link CompletableFuture}
 * chain executed by one writer thread, so a write always runs after its
 * predecessor. The snapshot is read when the write runs, so the last write
 * always reflects the latest log. Failures are logged and counted, never
 * propagated.
 * </p>
 *
 * @since 1.0.0
 */
public class PersistenceQueue implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PersistenceQueue.class);

    private final ScanHistoryStore store;
    private final Supplier<List<AnalysisResult>> source;
    private final ExecutorService writer;
    private final AtomicLong completedWrites = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();

    // guarded by this
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
    private boolean closed;

    /**
     * @param store  destination of the snapshots
     * @param source supplies the snapshot to write
     */
    public PersistenceQueue(ScanHistoryStore store, Supplier<List<AnalysisResult>> source) {
        this.store = Objects.requireNonNull(store, "ScanHistoryStore must not be null");
        this.source = Objects.requireNonNull(source, "Snapshot source must not be null");
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "context-guard-history-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a save behind all previously scheduled ones.
     *
     * @return completes when this save has run
     */
    public synchronized CompletableFuture<Void> requestSave() {
        if (closed) {
            LOG.warn("Persistence queue closed, dropping save request");
            return tail;
        }
        tail = tail.thenRunAsync(this::write, writer);
        return tail;
    }

    /**
     * Block until every save scheduled so far has run.
     */
    public void flush() {
        CompletableFuture<Void> current;
        synchronized (this) {
            current = tail;
        }
        current.join();
    }

    public long getCompletedWrites() {
        return completedWrites.get();
    }

    public long getFailedWrites() {
        return failedWrites.get();
    }

    /**
     * Flush pending saves and stop the writer thread.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        flush();
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("History writer did not terminate in time");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }

    private void write() {
        try {
            store.save(source.get());
            completedWrites.incrementAndGet();
        } catch (IOException | RuntimeException e) {
            failedWrites.incrementAndGet();
            LOG.warn("Could not persist scan history: {}", e.getMessage(), e);
        }
    }
}
