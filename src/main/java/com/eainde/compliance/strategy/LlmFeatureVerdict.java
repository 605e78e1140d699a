package com.eainde.compliance.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One per-feature record as returned by the completion service. Fields are nullable;
 * defaults and enum coercion are applied when converting to a verdict.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmFeatureVerdict(
        @JsonProperty("feature_id")                String featureId,
        @JsonProperty("risk_score")                Double riskScore,
        @JsonProperty("risk_level")                String riskLevel,
        @JsonProperty("is_compliant")              Boolean compliant,
        @JsonProperty("non_compliant_regulations") List<String> violatedRegulations,
        @JsonProperty("required_actions")          List<String> remediationActions,
        @JsonProperty("reasoning")                 String reasoning,
        @JsonProperty("confidence_score")          Double confidenceScore
) {}
