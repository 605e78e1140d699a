package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Regulation profile of one jurisdiction, loaded once from the reference table.
 *
 * @param code              upper-case unique code, e.g. "CA"
 * @param name              display name
 * @param regulations       applicable regulation names
 * @param riskTier          baseline tier used for strategy routing
 * @param enforcement       enforcement strength
 * @param requiredPractices free-text practices, e.g. "Consent for sensitive data"
 * @param penalties         penalty descriptions
 * @param effectiveDate     date the regime took effect
 * @param notes             free-text notes
 */
public record JurisdictionProfile(
        @JsonProperty("code")               String code,
        @JsonProperty("name")               String name,
        @JsonProperty("regulations")        List<String> regulations,
        @JsonProperty("risk_tier")          RiskTier riskTier,
        @JsonProperty("enforcement")        EnforcementStrength enforcement,
        @JsonProperty("required_practices") List<String> requiredPractices,
        @JsonProperty("penalties")          List<String> penalties,
        @JsonProperty("effective_date")
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
                                            LocalDate effectiveDate,
        @JsonProperty("notes")              String notes
) {

    public JurisdictionProfile {
        regulations = regulations != null ? List.copyOf(regulations) : List.of();
        requiredPractices = requiredPractices != null ? List.copyOf(requiredPractices) : List.of();
        penalties = penalties != null ? List.copyOf(penalties) : List.of();
        notes = notes != null ? notes : "";
    }

    public boolean isStrict() {
        return enforcement == EnforcementStrength.STRICT;
    }
}
