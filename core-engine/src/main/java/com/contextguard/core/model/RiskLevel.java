package com.contextguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Disclosure risk of a snippet, also used as the severity of a single
 * {@link PatternMatch}.
 *
 * <p>
 * Serialized by its lowercase label ({@code low}, {@code medium},
 * {@code high}).
 * </p>
 *
 * @since 1.0.0
 */
public enum RiskLevel {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolve a level from its label, case-insensitively.
     *
     * @param label the label; must not be {@code null}
     * @return the matching level
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static RiskLevel fromLabel(String label) {
        Objects.requireNonNull(label, "Risk level label must not be null");
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.label.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException(
                "Unknown risk level: '" + label + "'. Supported: low, medium, high");
    }

    /**
     * @param other level to compare with
     * @return the more severe of the two levels
     */
    public RiskLevel max(RiskLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
