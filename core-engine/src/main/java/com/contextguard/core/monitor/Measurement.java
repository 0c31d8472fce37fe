package com.contextguard.core.monitor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One timed operation.
 *
 * <p>
 * An open measurement has no end time; {@link #complete(Instant, Throwable)}
 * returns the closed copy. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Measurement {

    private final String id;
    private final String operationName;
    private final Instant startTime;
    private final Instant endTime;
    private final Duration duration;
    private final Map<String, Object> metadata;
    private final List<String> tags;
    private final String errorMessage;
    private final String errorType;

    private Measurement(String id, String operationName, Instant startTime, Instant endTime,
            Duration duration, Map<String, Object> metadata, List<String> tags,
            String errorMessage, String errorType) {
        this.id = id;
        this.operationName = operationName;
        this.startTime = startTime;
        this.endTime = endTime;
        this.duration = duration;
        this.metadata = metadata;
        this.tags = tags;
        this.errorMessage = errorMessage;
        this.errorType = errorType;
    }

    static Measurement open(String id, String operationName, Instant startTime,
            Map<String, ?> metadata, List<String> tags) {
        return new Measurement(
                Objects.requireNonNull(id, "id must not be null"),
                Objects.requireNonNull(operationName, "operationName must not be null"),
                Objects.requireNonNull(startTime, "startTime must not be null"),
                null, null,
                metadata == null || metadata.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)),
                tags == null ? Collections.emptyList() : List.copyOf(tags),
                null, null);
    }

    /**
     * Close this measurement.
     *
     * @param end   end instant; a clock running backwards yields a zero
     *              duration
     * @param error failure of the measured operation, may be {@code null}
     * @return the closed measurement
     */
    Measurement complete(Instant end, Throwable error) {
        Duration elapsed = Duration.between(startTime, end);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        String message = null;
        String type = null;
        if (error != null) {
            message = error.getMessage() != null ? error.getMessage() : error.toString();
            type = error.getClass().getSimpleName();
        }
        return new Measurement(id, operationName, startTime, end, elapsed, metadata, tags, message, type);
    }

    public String getId() {
        return id;
    }

    public String getOperationName() {
        return operationName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * @return duration in milliseconds, {@code 0} while open
     */
    @JsonIgnore
    public long getDurationMillis() {
        return duration == null ? 0 : duration.toMillis();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public List<String> getTags() {
        return tags;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getErrorType() {
        return errorType;
    }

    @JsonIgnore
    public boolean isOpen() {
        return endTime == null;
    }

    @JsonIgnore
    public boolean isError() {
        return errorType != null;
    }

    @Override
    public String toString() {
        return "Measurement{" +
                "id='" + id + '\'' +
                ", operation='" + operationName + '\'' +
                ", duration=" + duration +
                (errorType != null ? ", error=" + errorType : "") +
                '}';
    }
}
