package com.contextguard.core.orchestration;

import com.contextguard.core.model.AnalysisResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, oldest-first log of recent analysis results with FIFO eviction.
 *
 * @since 1.0.0
 */
public class RecentScanLog {

    private final int capacity;
    private final Deque<AnalysisResult> scans = new ArrayDeque<>();

    /**
     * @param capacity maximum number of retained results
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public RecentScanLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void add(AnalysisResult result) {
        scans.addLast(Objects.requireNonNull(result, "AnalysisResult must not be null"));
        while (scans.size() > capacity) {
            scans.removeFirst();
        }
    }

    /**
     * Replace the content, keeping the newest {@code capacity} results.
     *
     * @param results oldest-first results
     */
    public synchronized void replaceAll(Collection<AnalysisResult> results) {
        scans.clear();
        results.forEach(this::add);
    }

    /**
     * @return all results, oldest first
     */
    public synchronized List<AnalysisResult> snapshot() {
        return List.copyOf(scans);
    }

    /**
     * @param limit maximum number of results
     * @return the newest {@code limit} results, oldest first
     */
    public synchronized List<AnalysisResult> latest(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<AnalysisResult> all = new ArrayList<>(scans);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized int size() {
        return scans.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
