package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The three views produced by one analysis run.
 */
public record ComplianceMatrix(
        @JsonProperty("run_id")                    String runId,
        @JsonProperty("state_centric")             StateCentricReport stateCentric,
        @JsonProperty("feature_centric")           List<FeatureCentricResult> featureCentric,
        @JsonProperty("non_compliant_summary")     NonCompliantSummary nonCompliantSummary
) {

    public ComplianceMatrix {
        featureCentric = featureCentric != null ? List.copyOf(featureCentric) : List.of();
    }
}
