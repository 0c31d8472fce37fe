package com.contextguard.core.detection;

/**
 * Raised when a detector tier fails to produce a report, e.g. because the
 * remote service is unreachable or answered with an error.
 *
 * <p>
 * Always recoverable: the orchestrator advances to the next tier.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionException extends Exception {

    private static final long serialVersionUID = 1L;

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
