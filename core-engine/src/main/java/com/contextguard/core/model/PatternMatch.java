package com.contextguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single finding located in the analysed text.
 *
 * <p>
 * Line and column are 1-based. The excerpt is the matched text, truncated
 * to {@value #MAX_EXCERPT_LENGTH} characters.
 * </p>
 *
 * @since 1.0.0
 */
public final class PatternMatch {

    static final int MAX_EXCERPT_LENGTH = 120;

    private final String pattern;
    private final int line;
    private final int column;
    private final String excerpt;
    private final RiskLevel severity;

    /**
     * @param pattern  tag of the pattern that matched, e.g.
     *                 {@code potential_secret}
     * @param line     1-based line number
     * @param column   1-based column number
     * @param excerpt  matched text
     * @param severity severity of the finding
     * @throws NullPointerException     if {@code pattern} or {@code severity} is
     *                                  {@code null}
     * @throws IllegalArgumentException if line or column is below 1
     */
    @JsonCreator
    public PatternMatch(@JsonProperty("pattern") String pattern,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column,
            @JsonProperty("excerpt") String excerpt,
            @JsonProperty("severity") RiskLevel severity) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException(
                    "line and column are 1-based, got: " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
        this.excerpt = truncate(excerpt);
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_EXCERPT_LENGTH ? text.substring(0, MAX_EXCERPT_LENGTH) : text;
    }

    public String getPattern() {
        return pattern;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getExcerpt() {
        return excerpt;
    }

    public RiskLevel getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PatternMatch that))
            return false;
        return line == that.line
                && column == that.column
                && pattern.equals(that.pattern)
                && excerpt.equals(that.excerpt)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, line, column, excerpt, severity);
    }

    @Override
    public String toString() {
        return "PatternMatch{" +
                "pattern='" + pattern + '\'' +
                ", at=" + line + ":" + column +
                ", severity=" + severity +
                '}';
    }
}
