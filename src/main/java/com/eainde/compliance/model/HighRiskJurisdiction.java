package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Jurisdiction with at least one high-risk verdict, as listed in the rollup.
 */
public record HighRiskJurisdiction(
        @JsonProperty("jurisdiction_code")  String jurisdictionCode,
        @JsonProperty("jurisdiction_name")  String jurisdictionName,
        @JsonProperty("high_risk_features") int highRiskFeatures,
        @JsonProperty("total_features")     int totalFeatures
) {}
