package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Binary risk level carried by every verdict and every derived view.
 *
 * <p>Always derived from a risk score with {@link #HIGH_RISK_THRESHOLD}; no view
 * may copy a level from another record. Distinct from {@link RiskTier}, which is a
 * jurisdiction's own baseline classification used only for routing.</p>
 */
public enum RiskLevel {
    LOW,
    HIGH;

    /** Scores at or above this value are high risk. */
    public static final double HIGH_RISK_THRESHOLD = 0.6;

    public static RiskLevel fromScore(double riskScore) {
        return riskScore >= HIGH_RISK_THRESHOLD ? HIGH : LOW;
    }

    /**
     * Parses a wire value. Anything other than "low" or "high" is empty,
     * so callers must decide how to coerce it.
     */
    public static Optional<RiskLevel> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> Optional.of(LOW);
            case "high" -> Optional.of(HIGH);
            default -> Optional.empty();
        };
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
