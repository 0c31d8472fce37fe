/**
 * Result memoization.
 *
 * <p>
 * {@link com.contextguard.core.cache.CacheStore} holds analysis results
 * keyed by the fingerprint computed in
 * {@link com.contextguard.core.cache.CacheKeyGenerator}.
 * </p>
 */
package com.contextguard.core.cache;
