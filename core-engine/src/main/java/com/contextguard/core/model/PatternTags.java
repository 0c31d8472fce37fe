package com.contextguard.core.model;

/**
 * Well-known pattern tags shared by all detectors.
 *
 * @since 1.0.0
 */
public final class PatternTags {

    /** Credentials, API keys, tokens and private keys. */
    public static final String SECRET = "potential_secret";

    /** Proprietary algorithms and business rules. */
    public static final String BUSINESS_LOGIC = "business_logic";

    /** Internal hosts, private addresses and endpoints. */
    public static final String INFRASTRUCTURE = "infrastructure";

    /** Dynamic code or command execution. */
    public static final String DANGEROUS_EXECUTION = "dangerous_execution";

    private PatternTags() {
        // constants holder
    }

    /**
     * Risk implied by a tag alone, independent of individual matches.
     *
     * @param tag pattern tag
     * @return implied risk level
     */
    public static RiskLevel impliedRisk(String tag) {
        if (SECRET.equals(tag) || DANGEROUS_EXECUTION.equals(tag)) {
            return RiskLevel.HIGH;
        }
        if (BUSINESS_LOGIC.equals(tag) || INFRASTRUCTURE.equals(tag)) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
