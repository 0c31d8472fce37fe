/**
 * Detector tiers of the analysis fallback chain.
 *
 * <p>
 * {@link com.contextguard.core.detection.SemanticDetector} evaluates the
 * configured rules, {@link com.contextguard.core.detection.RemoteDetector}
 * delegates to the remote detection service, and
 * {@link com.contextguard.core.detection.HeuristicDetector} is the
 * infallible built-in fallback.
 * </p>
 */
package com.contextguard.core.detection;
