package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compliance judgment for one (feature, jurisdiction) pair.
 *
 * <p>{@code riskScore} and {@code confidenceScore} are clamped to [0, 1]. The risk level
 * is not a component: it is always derived from the score, see {@link #riskLevel()}.
 * Remediation actions keep first-seen order with duplicates removed.</p>
 */
@JsonIgnoreProperties(value = "risk_level", allowGetters = true)
public record ComplianceVerdict(
        @JsonProperty("jurisdiction_code")         String jurisdictionCode,
        @JsonProperty("jurisdiction_name")         String jurisdictionName,
        @JsonProperty("feature_id")                String featureId,
        @JsonProperty("feature_name")              String featureName,
        @JsonProperty("risk_score")                double riskScore,
        @JsonProperty("is_compliant")              boolean compliant,
        @JsonProperty("non_compliant_regulations") Set<String> violatedRegulations,
        @JsonProperty("required_actions")          List<String> remediationActions,
        @JsonProperty("reasoning")                 String reasoning,
        @JsonProperty("confidence_score")          double confidenceScore,
        @JsonProperty("source")                    VerdictSource source
) {

    public ComplianceVerdict {
        riskScore = clamp(riskScore);
        confidenceScore = clamp(confidenceScore);
        violatedRegulations = violatedRegulations != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(violatedRegulations))
                : Set.of();
        remediationActions = remediationActions != null
                ? List.copyOf(new LinkedHashSet<>(remediationActions))
                : List.of();
        reasoning = reasoning != null ? reasoning : "";
    }

    @JsonProperty("risk_level")
    public RiskLevel riskLevel() {
        return RiskLevel.fromScore(riskScore);
    }

    /** 1 - risk score, the per-jurisdiction score shown in the feature-centric view. */
    public double complianceScore() {
        return 1.0 - riskScore;
    }

    /**
     * Copy with a different source tag, used when a review call confirms a verdict.
     */
    public ComplianceVerdict withSource(VerdictSource newSource) {
        return new ComplianceVerdict(jurisdictionCode, jurisdictionName, featureId, featureName,
                riskScore, compliant, violatedRegulations, new ArrayList<>(remediationActions),
                reasoning, confidenceScore, newSource);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
