package com.contextguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical, immutable outcome of analysing one snippet.
 *
 * <p>
 * The {@link Provenance} tag identifies which tier of the fallback chain
 * produced the result, or {@link Provenance#CACHE} when it was served from
 * the result cache. Consumers branch on it with exhaustive {@code switch}
 * expressions rather than probing optional fields.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code riskLevel}, {@code timestamp} and
 * {@code provenance} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisResult {

    /** Source name used when the caller supplies none. */
    public static final String UNKNOWN_SOURCE = "Unknown";

    private final RiskLevel riskLevel;
    private final Set<String> detectedPatterns;
    private final List<String> suggestions;
    private final List<PatternMatch> matches;
    private final Instant timestamp;
    private final String sourceName;
    private final Provenance provenance;
    private final Duration latency;

    private AnalysisResult(Builder builder) {
        this(builder.riskLevel, builder.detectedPatterns, builder.suggestions, builder.matches,
                builder.timestamp, builder.sourceName, builder.provenance, builder.latency);
    }

    @JsonCreator
    private AnalysisResult(@JsonProperty("riskLevel") RiskLevel riskLevel,
            @JsonProperty("detectedPatterns") Collection<String> detectedPatterns,
            @JsonProperty("suggestions") List<String> suggestions,
            @JsonProperty("matches") List<PatternMatch> matches,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("sourceName") String sourceName,
            @JsonProperty("provenance") Provenance provenance,
            @JsonProperty("latency") Duration latency) {
        this.riskLevel = Objects.requireNonNull(riskLevel, "riskLevel must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.provenance = Objects.requireNonNull(provenance, "provenance must not be null");
        this.detectedPatterns = detectedPatterns == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(detectedPatterns));
        this.suggestions = suggestions == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(suggestions));
        this.matches = matches == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(matches));
        this.sourceName = sourceName == null || sourceName.isBlank() ? UNKNOWN_SOURCE : sourceName;
        this.latency = latency == null ? Duration.ZERO : latency;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a result from a detector report.
     *
     * @param report     the raw detector output
     * @param provenance tier that produced the report
     * @return a builder pre-populated with the report's findings
     */
    public static Builder fromReport(DetectionReport report, Provenance provenance) {
        Objects.requireNonNull(report, "report must not be null");
        return builder()
                .riskLevel(report.getRiskLevel())
                .detectedPatterns(report.getDetectedPatterns())
                .suggestions(report.getSuggestions())
                .matches(report.getMatches())
                .provenance(provenance);
    }

    /**
     * Copy of this result re-tagged as served from a different source.
     *
     * @param newProvenance provenance of the copy
     * @param newLatency    latency of the copy
     * @return a new result sharing all findings with this one
     */
    public AnalysisResult withProvenance(Provenance newProvenance, Duration newLatency) {
        return new AnalysisResult(riskLevel, detectedPatterns, suggestions, matches,
                timestamp, sourceName, newProvenance, newLatency);
    }

    /**
     * Strip provenance and timing, keeping only the findings.
     *
     * @return the findings as a detector report
     */
    public DetectionReport toReport() {
        return new DetectionReport(riskLevel, detectedPatterns, suggestions, matches);
    }

    /**
     * Human-readable name of the tier behind this result.
     *
     * @return tier description
     */
    @JsonIgnore
    public String getTierDescription() {
        return switch (provenance) {
            case MODULAR -> "primary rule-based analysis";
            case REMOTE -> "remote detection service";
            case LOCAL_FALLBACK -> "local heuristic fallback";
            case CACHE -> "cached result";
        };
    }

    public boolean hasSecrets() {
        return detectedPatterns.contains(PatternTags.SECRET);
    }

    public boolean hasBusinessLogic() {
        return detectedPatterns.contains(PatternTags.BUSINESS_LOGIC);
    }

    public boolean hasInfrastructureExposure() {
        return detectedPatterns.contains(PatternTags.INFRASTRUCTURE);
    }

    /**
     * Confidence in the classification: a base of 0.5, 0.7 or 0.9 for low,
     * medium and high risk plus 0.1 per detected pattern (at most 0.3),
     * capped at 1.0.
     *
     * @return confidence in {@code [0.5, 1.0]}
     */
    @JsonIgnore
    public double getConfidence() {
        double base = switch (riskLevel) {
            case LOW -> 0.5;
            case MEDIUM -> 0.7;
            case HIGH -> 0.9;
        };
        double patternBonus = Math.min(detectedPatterns.size() * 0.1, 0.3);
        return Math.min(base + patternBonus, 1.0);
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public Set<String> getDetectedPatterns() {
        return detectedPatterns;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public List<PatternMatch> getMatches() {
        return matches;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSourceName() {
        return sourceName;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public Duration getLatency() {
        return latency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisResult that))
            return false;
        return riskLevel == that.riskLevel
                && provenance == that.provenance
                && detectedPatterns.equals(that.detectedPatterns)
                && suggestions.equals(that.suggestions)
                && matches.equals(that.matches)
                && timestamp.equals(that.timestamp)
                && sourceName.equals(that.sourceName)
                && latency.equals(that.latency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(riskLevel, provenance, detectedPatterns, timestamp, sourceName);
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
                "riskLevel=" + riskLevel +
                ", detectedPatterns=" + detectedPatterns +
                ", matches=" + matches.size() +
                ", sourceName='" + sourceName + '\'' +
                ", provenance=" + provenance +
                ", latency=" + latency +
                ", timestamp=" + timestamp +
                '}';
    }

    /**
     * Fluent builder for {@link AnalysisResult} instances.
     */
    public static class Builder {
        private RiskLevel riskLevel;
        private Collection<String> detectedPatterns;
        private List<String> suggestions;
        private List<PatternMatch> matches;
        private Instant timestamp;
        private String sourceName;
        private Provenance provenance;
        private Duration latency;

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder detectedPatterns(Collection<String> detectedPatterns) {
            this.detectedPatterns = detectedPatterns;
            return this;
        }

        public Builder suggestions(List<String> suggestions) {
            this.suggestions = suggestions;
            return this;
        }

        public Builder matches(List<PatternMatch> matches) {
            this.matches = matches;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder latency(Duration latency) {
            this.latency = latency;
            return this;
        }

        /**
         * @return a new {@link AnalysisResult}
         * @throws NullPointerException if {@code riskLevel}, {@code timestamp}
         *                              or {@code provenance} is {@code null}
         */
        public AnalysisResult build() {
            return new AnalysisResult(this);
        }
    }
}
