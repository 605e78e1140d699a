package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Baseline risk tier of a jurisdiction. Drives strategy selection in the dispatcher.
 */
public enum RiskTier {
    HIGH,
    MEDIUM,
    LOW;

    @JsonCreator
    public static RiskTier fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Risk tier must not be null");
        }
        return RiskTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
