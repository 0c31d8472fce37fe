/**
 * Remote detection service: a JDK {@code HttpServer} exposing the analysis
 * engine over the health and analyze contract consumed by
 * {@link com.contextguard.core.detection.RemoteDetector}.
 */
package com.contextguard.server;
