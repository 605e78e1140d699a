package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One jurisdiction's entry inside a {@link FeatureCentricResult}. Carries everything
 * the originating verdict carried, so the state-centric view can be rebuilt from it.
 */
@JsonIgnoreProperties(value = {"compliance_score", "risk_level"}, allowGetters = true)
public record JurisdictionCompliance(
        @JsonProperty("jurisdiction_code")         String jurisdictionCode,
        @JsonProperty("jurisdiction_name")         String jurisdictionName,
        @JsonProperty("risk_score")                double riskScore,
        @JsonProperty("is_compliant")              boolean compliant,
        @JsonProperty("non_compliant_regulations") Set<String> violatedRegulations,
        @JsonProperty("required_actions")          List<String> remediationActions,
        @JsonProperty("reasoning")                 String reasoning,
        @JsonProperty("confidence_score")          double confidenceScore,
        @JsonProperty("source")                    VerdictSource source
) {

    public JurisdictionCompliance {
        violatedRegulations = violatedRegulations != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(violatedRegulations)) : Set.of();
        remediationActions = remediationActions != null ? List.copyOf(remediationActions) : List.of();
    }

    public static JurisdictionCompliance from(ComplianceVerdict verdict) {
        return new JurisdictionCompliance(
                verdict.jurisdictionCode(),
                verdict.jurisdictionName(),
                verdict.riskScore(),
                verdict.compliant(),
                verdict.violatedRegulations(),
                verdict.remediationActions(),
                verdict.reasoning(),
                verdict.confidenceScore(),
                verdict.source());
    }

    @JsonProperty("compliance_score")
    public double complianceScore() {
        return 1.0 - riskScore;
    }

    @JsonProperty("risk_level")
    public RiskLevel riskLevel() {
        return RiskLevel.fromScore(riskScore);
    }

    /**
     * Rebuilds the verdict this entry was made from.
     */
    public ComplianceVerdict toVerdict(String featureId, String featureName) {
        return new ComplianceVerdict(jurisdictionCode, jurisdictionName, featureId, featureName,
                riskScore, compliant, violatedRegulations, remediationActions,
                reasoning, confidenceScore, source);
    }
}
