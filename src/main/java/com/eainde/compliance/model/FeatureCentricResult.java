package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One feature's view across every analyzed jurisdiction.
 *
 * @param featureId                 feature id
 * @param featureName               feature name
 * @param meanRiskScore             mean risk score of this feature's own verdicts
 * @param nonCompliantJurisdictions codes where this feature is non-compliant
 * @param jurisdictions             per-jurisdiction entries keyed by code
 * @param recommendations           deduplicated recommendations
 */
@JsonIgnoreProperties(value = "risk_level", allowGetters = true)
public record FeatureCentricResult(
        @JsonProperty("feature_id")                  String featureId,
        @JsonProperty("feature_name")                String featureName,
        @JsonProperty("mean_risk_score")             double meanRiskScore,
        @JsonProperty("non_compliant_jurisdictions") List<String> nonCompliantJurisdictions,
        @JsonProperty("jurisdiction_compliance")     Map<String, JurisdictionCompliance> jurisdictions,
        @JsonProperty("recommendations")             List<String> recommendations
) {

    public FeatureCentricResult {
        nonCompliantJurisdictions = nonCompliantJurisdictions != null
                ? List.copyOf(nonCompliantJurisdictions) : List.of();
        jurisdictions = jurisdictions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(jurisdictions)) : Map.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    /** Derived from this feature's own mean, never copied from a jurisdiction. */
    @JsonProperty("risk_level")
    public RiskLevel riskLevel() {
        return RiskLevel.fromScore(meanRiskScore);
    }
}
