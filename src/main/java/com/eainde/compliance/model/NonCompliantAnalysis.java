package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Headline numbers over the non-compliant summary.
 *
 * @param totalNonCompliant     number of jurisdictions in the summary
 * @param highestRiskCodes      codes whose worst risk score is at least 0.8
 * @param overallRisk           "high", "medium" or "low"
 */
public record NonCompliantAnalysis(
        @JsonProperty("total_non_compliant_states") int totalNonCompliant,
        @JsonProperty("highest_risk_states")        List<String> highestRiskCodes,
        @JsonProperty("overall_compliance_risk")    String overallRisk
) {

    public NonCompliantAnalysis {
        highestRiskCodes = highestRiskCodes != null ? List.copyOf(highestRiskCodes) : List.of();
    }
}
