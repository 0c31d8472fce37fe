/**
 * Timing instrumentation.
 *
 * <p>
 * {@link com.contextguard.core.monitor.PerformanceMonitor} brackets each
 * stage of an analysis and derives percentiles, throughput, error rates and
 * hotspots from the recorded measurements.
 * </p>
 */
package com.contextguard.core.monitor;
