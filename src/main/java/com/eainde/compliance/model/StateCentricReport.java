package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one batch run: state-centric results keyed by jurisdiction code, plus rollup.
 *
 * @param results                  completed jurisdictions, in processing-priority order
 * @param rollup                   statistics over {@code results}
 * @param skippedJurisdictions     requested codes unknown to the reference store
 * @param cancelledJurisdictions   jurisdictions not started because the run was cancelled
 */
@JsonIgnoreProperties(value = "cancelled", allowGetters = true)
public record StateCentricReport(
        @JsonProperty("state_results")           Map<String, StateCentricResult> results,
        @JsonProperty("overall_stats")           RollupStats rollup,
        @JsonProperty("skipped_jurisdictions")   List<String> skippedJurisdictions,
        @JsonProperty("cancelled_jurisdictions") List<String> cancelledJurisdictions
) {

    public StateCentricReport {
        results = results != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(results))
                : Map.of();
        skippedJurisdictions = skippedJurisdictions != null ? List.copyOf(skippedJurisdictions) : List.of();
        cancelledJurisdictions = cancelledJurisdictions != null ? List.copyOf(cancelledJurisdictions) : List.of();
    }

    @JsonProperty("cancelled")
    public boolean cancelled() {
        return !cancelledJurisdictions.isEmpty();
    }

    public int verdictCount() {
        return results.values().stream().mapToInt(r -> r.verdicts().size()).sum();
    }
}
