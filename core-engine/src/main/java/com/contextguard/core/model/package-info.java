/**
 * Domain model classes for Context Guard.
 *
 * <p>
 * This package contains the value types shared between the detectors, the
 * orchestrator, persistence and the detection server:
 * </p>
 * <ul>
 * <li>{@link com.contextguard.core.model.AnalysisRequest}: one snippet to
 * analyse</li>
 * <li>{@link com.contextguard.core.model.DetectionReport}: raw detector
 * output and remote wire payload</li>
 * <li>{@link com.contextguard.core.model.AnalysisResult}: canonical result
 * tagged with its {@link com.contextguard.core.model.Provenance}</li>
 * <li>{@link com.contextguard.core.model.DetectionRule}: pattern rule
 * configuration POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.contextguard.core.model;
