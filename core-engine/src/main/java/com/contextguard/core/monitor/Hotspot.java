package com.contextguard.core.monitor;

/**
 * An operation flagged by the hotspot analysis, with a recommendation.
 *
 * @since 1.0.0
 */
public final class Hotspot {

    private final String operation;
    private final Impact impact;
    private final String recommendation;

    Hotspot(String operation, Impact impact, String recommendation) {
        this.operation = operation;
        this.impact = impact;
        this.recommendation = recommendation;
    }

    public String getOperation() {
        return operation;
    }

    public Impact getImpact() {
        return impact;
    }

    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public String toString() {
        return operation + " (" + impact.label() + "): " + recommendation;
    }
}
