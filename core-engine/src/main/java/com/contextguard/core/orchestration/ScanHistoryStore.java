package com.contextguard.core.orchestration;

import com.contextguard.core.model.AnalysisResult;

import java.io.IOException;
import java.util.List;

/**
 * Persistence port for the recent-scan log.
 *
 * @since 1.0.0
 */
public interface ScanHistoryStore {

    /**
     * @return persisted results, oldest first; empty if nothing was saved
     * @throws IOException if the snapshot exists but cannot be read
     */
    List<AnalysisResult> load() throws IOException;

    /**
     * Replace the persisted snapshot.
     *
     * @param scans results, oldest first
     * @throws IOException if the snapshot cannot be written
     */
    void save(List<AnalysisResult> scans) throws IOException;
}
