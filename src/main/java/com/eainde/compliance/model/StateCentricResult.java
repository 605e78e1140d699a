package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All verdicts for one jurisdiction plus their per-jurisdiction aggregates.
 *
 * @param jurisdictionCode    jurisdiction code
 * @param jurisdictionName    display name
 * @param meanRiskScore       mean risk score across the jurisdiction's verdicts
 * @param totalFeatures       number of verdicts (one per feature)
 * @param nonCompliantFeatures number of non-compliant verdicts
 * @param complianceRate      (total - nonCompliant) / total, 0.0 when there are no features
 * @param path                dispatcher route that produced the verdicts
 * @param verdicts            one verdict per feature, in feature order
 */
@JsonIgnoreProperties(value = "risk_level", allowGetters = true)
public record StateCentricResult(
        @JsonProperty("jurisdiction_code")      String jurisdictionCode,
        @JsonProperty("jurisdiction_name")      String jurisdictionName,
        @JsonProperty("mean_risk_score")        double meanRiskScore,
        @JsonProperty("total_features")         int totalFeatures,
        @JsonProperty("non_compliant_features") int nonCompliantFeatures,
        @JsonProperty("compliance_rate")        double complianceRate,
        @JsonProperty("path")                   DispatchPath path,
        @JsonProperty("verdicts")               List<ComplianceVerdict> verdicts
) {

    public StateCentricResult {
        verdicts = verdicts != null ? List.copyOf(verdicts) : List.of();
    }

    /**
     * Builds the aggregate from a complete verdict list.
     */
    public static StateCentricResult of(String code, String name,
                                        List<ComplianceVerdict> verdicts, DispatchPath path) {
        int total = verdicts.size();
        int nonCompliant = (int) verdicts.stream().filter(v -> !v.compliant()).count();
        double mean = verdicts.stream().mapToDouble(ComplianceVerdict::riskScore).average().orElse(0.0);
        double rate = total > 0 ? (double) (total - nonCompliant) / total : 0.0;
        return new StateCentricResult(code, name, mean, total, nonCompliant, rate, path, verdicts);
    }

    @JsonProperty("risk_level")
    public RiskLevel riskLevel() {
        return RiskLevel.fromScore(meanRiskScore);
    }

    public long highRiskFeatureCount() {
        return verdicts.stream().filter(v -> v.riskLevel() == RiskLevel.HIGH).count();
    }
}
