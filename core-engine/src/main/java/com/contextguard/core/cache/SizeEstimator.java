package com.contextguard.core.cache;

/**
 * Estimates the memory footprint of a cache payload in bytes.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SizeEstimator {

    /**
     * @param payload the value about to be cached
     * @return estimated size in bytes, never negative
     * @throws RuntimeException if the size cannot be estimated; the cache
     *                          rejects the payload
     */
    long estimate(Object payload);
}
