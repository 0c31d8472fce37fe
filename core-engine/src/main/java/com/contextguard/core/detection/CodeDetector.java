package com.contextguard.core.detection;

import com.contextguard.core.model.AnalysisRequest;
import com.contextguard.core.model.DetectionReport;

import java.util.Optional;

/**
 * Contract for every tier of the detector fallback chain.
 *
 * <p>
 * Implementations must be safe to call from several threads at once; the
 * orchestrator does not serialize requests with different fingerprints.
 * </p>
 *
 * @since 1.0.0
 */
public interface CodeDetector {

    /**
     * Analyse a single request.
     *
     * @param request the snippet to analyse
     * @return a report, or empty if this detector cannot analyse the request
     *         and the next tier should be tried
     * @throws DetectionException if the detector failed; the orchestrator
     *                            treats this as a skip
     */
    Optional<DetectionReport> detect(AnalysisRequest request) throws DetectionException;

    /**
     * Return the name used for logging and performance measurements.
     *
     * @return detector name
     */
    String getName();
}
