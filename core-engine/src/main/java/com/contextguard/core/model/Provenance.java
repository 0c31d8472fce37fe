package com.contextguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Which tier of the detector fallback chain produced an
 * {@link AnalysisResult}.
 *
 * @since 1.0.0
 */
public enum Provenance {

    /** In-process rule-driven analysis (primary tier). */
    MODULAR("modular"),

    /** Remote detection service (secondary tier). */
    REMOTE("remote"),

    /** Built-in heuristic scan (tertiary tier, never fails). */
    LOCAL_FALLBACK("local-fallback"),

    /** Served from the result cache, no detector ran. */
    CACHE("cache");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Provenance fromLabel(String label) {
        Objects.requireNonNull(label, "Provenance label must not be null");
        for (Provenance provenance : values()) {
            if (provenance.label.equalsIgnoreCase(label.trim())) {
                return provenance;
            }
        }
        throw new IllegalArgumentException("Unknown provenance: '" + label + "'");
    }
}
