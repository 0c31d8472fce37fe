package com.contextguard.core.detection;

import java.time.Duration;

/**
 * Reachability check for a detector that depends on an external service.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * @param timeout upper bound for the check
     * @return {@code true} if the service answered healthy within the timeout
     * @throws Exception if the check could not be completed; callers treat
     *                   this as unreachable
     */
    boolean isHealthy(Duration timeout) throws Exception;
}
