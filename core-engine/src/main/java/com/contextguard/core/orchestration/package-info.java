/**
 * Coordination of detection, caching, history and monitoring.
 *
 * <p>
 * {@link com.contextguard.core.orchestration.AnalysisOrchestrator} is the
 * engine's entry point. The remote tier is gated by a
 * {@link com.contextguard.core.orchestration.CircuitBreaker}; the recent-scan
 * log is persisted through a
 * {@link com.contextguard.core.orchestration.PersistenceQueue}.
 * </p>
 */
package com.contextguard.core.orchestration;
