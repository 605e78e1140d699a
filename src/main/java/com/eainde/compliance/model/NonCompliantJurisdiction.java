package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Merged view of one jurisdiction across every feature that failed it.
 * The risk score is the worst observed, never an average.
 */
public record NonCompliantJurisdiction(
        @JsonProperty("jurisdiction_name")         String jurisdictionName,
        @JsonProperty("risk_score")                double riskScore,
        @JsonProperty("risk_level")                RiskLevel riskLevel,
        @JsonProperty("reasoning")                 String reasoning,
        @JsonProperty("non_compliant_features")    List<String> nonCompliantFeatures,
        @JsonProperty("non_compliant_regulations") List<String> violatedRegulations,
        @JsonProperty("required_actions")          List<String> remediationActions
) {

    public NonCompliantJurisdiction {
        nonCompliantFeatures = nonCompliantFeatures != null ? List.copyOf(nonCompliantFeatures) : List.of();
        violatedRegulations = violatedRegulations != null ? List.copyOf(violatedRegulations) : List.of();
        remediationActions = remediationActions != null ? List.copyOf(remediationActions) : List.of();
    }
}
