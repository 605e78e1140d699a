package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jurisdiction code to merged non-compliance entry. Jurisdictions no feature failed are absent.
 */
public record NonCompliantSummary(
        @JsonProperty("non_compliant_states_dict") Map<String, NonCompliantJurisdiction> jurisdictions,
        @JsonProperty("analysis_summary")          NonCompliantAnalysis analysis,
        @JsonProperty("recommendations")           List<String> recommendations
) {

    public NonCompliantSummary {
        jurisdictions = jurisdictions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(jurisdictions)) : Map.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
