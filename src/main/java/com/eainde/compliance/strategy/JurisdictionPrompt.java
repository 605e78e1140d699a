package com.eainde.compliance.strategy;

/**
 * Rendered inputs for one completion call.
 *
 * @param jurisdictionCode    code of the jurisdiction under analysis
 * @param jurisdictionName    display name
 * @param jurisdictionContext regulations, requirements, penalties and enforcement as text
 * @param featuresJson        compact JSON array of feature summaries
 * @param featureCount        number of features in {@code featuresJson}
 */
public record JurisdictionPrompt(
        String jurisdictionCode,
        String jurisdictionName,
        String jurisdictionContext,
        String featuresJson,
        int featureCount
) {}
