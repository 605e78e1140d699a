package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch-wide statistics computed over every verdict in a run.
 *
 * @param totalVerdicts          total (feature, jurisdiction) verdicts
 * @param totalJurisdictions     jurisdictions with an entry in the report
 * @param totalFeatures          features supplied to the run
 * @param complianceRate         compliant verdicts / total verdicts, 0.0 when empty
 * @param riskDistribution       verdict count per risk level
 * @param highRiskJurisdictions  jurisdictions with at least one high-risk verdict
 * @param averageRiskScore       mean risk score over all verdicts, 0.0 when empty
 * @param processingTimeMillis   wall time of the batch
 */
public record RollupStats(
        @JsonProperty("total_analyses")          int totalVerdicts,
        @JsonProperty("total_jurisdictions")     int totalJurisdictions,
        @JsonProperty("total_features")          int totalFeatures,
        @JsonProperty("compliance_rate")         double complianceRate,
        @JsonProperty("risk_distribution")       Map<RiskLevel, Integer> riskDistribution,
        @JsonProperty("high_risk_jurisdictions") List<HighRiskJurisdiction> highRiskJurisdictions,
        @JsonProperty("average_risk_score")      double averageRiskScore,
        @JsonProperty("processing_time_ms")      long processingTimeMillis
) {

    public RollupStats {
        riskDistribution = riskDistribution != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(riskDistribution)) : Map.of();
        highRiskJurisdictions = highRiskJurisdictions != null ? List.copyOf(highRiskJurisdictions) : List.of();
    }
}
