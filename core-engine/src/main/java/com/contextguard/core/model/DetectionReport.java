package com.contextguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Raw output of a single detector.
 *
 * <p>
 * The orchestrator normalizes a report into an {@link AnalysisResult} by
 * adding provenance, timing and source information. A report is also the
 * {@code result} payload exchanged with the remote detection service.
 * </p>
 *
 * <p>
 * When no explicit risk level is supplied it is derived from the matches
 * and tags via {@link #deriveRiskLevel(Collection, Collection)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionReport {

    private final RiskLevel riskLevel;
    private final Set<String> detectedPatterns;
    private final List<String> suggestions;
    private final List<PatternMatch> matches;

    @JsonCreator
    public DetectionReport(@JsonProperty("riskLevel") RiskLevel riskLevel,
            @JsonProperty("detectedPatterns") Collection<String> detectedPatterns,
            @JsonProperty("suggestions") List<String> suggestions,
            @JsonProperty("matches") List<PatternMatch> matches) {
        this.detectedPatterns = detectedPatterns == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(detectedPatterns));
        this.suggestions = suggestions == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(suggestions));
        this.matches = matches == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(matches));
        this.riskLevel = riskLevel != null
                ? riskLevel
                : deriveRiskLevel(this.detectedPatterns, this.matches);
    }

    /**
     * A report for text with no findings.
     *
     * @return an empty low-risk report
     */
    public static DetectionReport clean() {
        return new DetectionReport(RiskLevel.LOW, null, null, null);
    }

    /**
     * Compute the risk implied by a set of tags and matches: the most severe
     * of every match severity and every tag's implied risk.
     *
     * @param tags    detected pattern tags
     * @param matches located findings
     * @return the derived risk level, {@link RiskLevel#LOW} when both are
     *         empty
     */
    public static RiskLevel deriveRiskLevel(Collection<String> tags, Collection<PatternMatch> matches) {
        RiskLevel level = RiskLevel.LOW;
        for (String tag : tags) {
            level = level.max(PatternTags.impliedRisk(tag));
        }
        for (PatternMatch match : matches) {
            level = level.max(match.getSeverity());
        }
        return level;
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

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionReport that))
            return false;
        return riskLevel == that.riskLevel
                && detectedPatterns.equals(that.detectedPatterns)
                && suggestions.equals(that.suggestions)
                && matches.equals(that.matches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(riskLevel, detectedPatterns, suggestions, matches);
    }

    @Override
    public String toString() {
        return "DetectionReport{" +
                "riskLevel=" + riskLevel +
                ", detectedPatterns=" + detectedPatterns +
                ", matches=" + matches.size() +
                '}';
    }
}
