package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EnforcementStrength {
    LENIENT,
    MODERATE,
    STRICT;

    @JsonCreator
    public static EnforcementStrength fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Enforcement strength must not be null");
        }
        return EnforcementStrength.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
