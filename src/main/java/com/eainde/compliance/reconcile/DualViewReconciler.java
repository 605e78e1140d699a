package com.eainde.compliance.reconcile;

import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.DispatchPath;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.FeatureCentricResult;
import com.eainde.compliance.model.JurisdictionCompliance;
import com.eainde.compliance.model.RiskLevel;
import com.eainde.compliance.model.StateCentricResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts between the state-centric view (jurisdiction → verdicts) and the
 * feature-centric view (feature → per-jurisdiction entries).
 *
 * <h3>Feature-centric rules:</h3>
 * <ul>
 *   <li>Exactly one result per input feature, in input order</li>
 *   <li>The feature's risk level comes from the mean of its own matches, never copied</li>
 *   <li>A feature with no matches is compliant with mean risk 0.0</li>
 *   <li>Recommendations: remediation actions + "Ensure compliance with &lt;regulation&gt;",
 *       deduplicated case-insensitively, capped, then two risk-level boilerplate entries</li>
 * </ul>
 */
@Slf4j
public class DualViewReconciler {

    public static final int DEFAULT_MAX_RECOMMENDATIONS = 10;

    static final List<String> HIGH_RISK_RECOMMENDATIONS = List.of(
            "Conduct a comprehensive compliance audit before launch",
            "Engage legal counsel to review high-risk jurisdictions");

    static final List<String> LOW_RISK_RECOMMENDATIONS = List.of(
            "Monitor regulatory changes in all analyzed jurisdictions",
            "Schedule periodic compliance reviews");

    private final int maxRecommendations;

    public DualViewReconciler() {
        this(DEFAULT_MAX_RECOMMENDATIONS);
    }

    public DualViewReconciler(int maxRecommendations) {
        if (maxRecommendations < 0) {
            throw new IllegalArgumentException("maxRecommendations must be >= 0, got " + maxRecommendations);
        }
        this.maxRecommendations = maxRecommendations;
    }

    // =========================================================================
    //  State-centric → feature-centric
    // =========================================================================

    public List<FeatureCentricResult> toFeatureCentric(List<Feature> features,
                                                       Map<String, StateCentricResult> stateResults) {
        if (features == null) {
            throw new IllegalArgumentException("features must not be null");
        }
        List<FeatureCentricResult> results = new ArrayList<>(features.size());
        for (Feature feature : features) {
            results.add(buildFeatureView(feature, stateResults));
        }
        return results;
    }

    private FeatureCentricResult buildFeatureView(Feature feature, Map<String, StateCentricResult> stateResults) {
        Map<String, JurisdictionCompliance> entries = new LinkedHashMap<>();
        List<String> nonCompliant = new ArrayList<>();
        List<ComplianceVerdict> matches = new ArrayList<>();

        for (StateCentricResult stateResult : stateResults.values()) {
            for (ComplianceVerdict verdict : stateResult.verdicts()) {
                if (!feature.id().equals(verdict.featureId())) {
                    continue;
                }
                matches.add(verdict);
                entries.put(verdict.jurisdictionCode(), JurisdictionCompliance.from(verdict));
                if (!verdict.compliant()) {
                    nonCompliant.add(verdict.jurisdictionCode());
                }
            }
        }

        if (matches.isEmpty()) {
            log.warn("Feature '{}' has no verdict in any jurisdiction, reported as compliant", feature.id());
        }

        double mean = matches.stream().mapToDouble(ComplianceVerdict::riskScore).average().orElse(0.0);
        List<String> recommendations = recommendations(matches, RiskLevel.fromScore(mean));
        return new FeatureCentricResult(feature.id(), feature.name(), mean, nonCompliant, entries, recommendations);
    }

    List<String> recommendations(List<ComplianceVerdict> matches, RiskLevel featureLevel) {
        Map<String, String> byLowerCase = new LinkedHashMap<>();
        Set<String> regulations = new LinkedHashSet<>();
        for (ComplianceVerdict verdict : matches) {
            for (String action : verdict.remediationActions()) {
                byLowerCase.putIfAbsent(action.toLowerCase(Locale.ROOT), action);
            }
            regulations.addAll(verdict.violatedRegulations());
        }
        for (String regulation : regulations) {
            String recommendation = "Ensure compliance with " + regulation;
            byLowerCase.putIfAbsent(recommendation.toLowerCase(Locale.ROOT), recommendation);
        }

        List<String> recommendations = new ArrayList<>(byLowerCase.values());
        if (recommendations.size() > maxRecommendations) {
            recommendations = new ArrayList<>(recommendations.subList(0, maxRecommendations));
        }
        recommendations.addAll(featureLevel == RiskLevel.HIGH ? HIGH_RISK_RECOMMENDATIONS : LOW_RISK_RECOMMENDATIONS);
        return recommendations;
    }

    // =========================================================================
    //  Feature-centric → state-centric
    // =========================================================================

    /**
     * Rebuilds the state-centric map. Jurisdictions appear in first-seen order and every
     * rebuilt entry is tagged {@link DispatchPath#RECONSTRUCTED}.
     */
    public Map<String, StateCentricResult> toStateCentric(List<FeatureCentricResult> featureResults) {
        Map<String, List<ComplianceVerdict>> verdictsByCode = new LinkedHashMap<>();
        Map<String, String> namesByCode = new LinkedHashMap<>();

        for (FeatureCentricResult featureResult : featureResults) {
            for (JurisdictionCompliance entry : featureResult.jurisdictions().values()) {
                verdictsByCode.computeIfAbsent(entry.jurisdictionCode(), code -> new ArrayList<>())
                        .add(entry.toVerdict(featureResult.featureId(), featureResult.featureName()));
                namesByCode.putIfAbsent(entry.jurisdictionCode(), entry.jurisdictionName());
            }
        }

        Map<String, StateCentricResult> stateResults = new LinkedHashMap<>();
        verdictsByCode.forEach((code, verdicts) -> stateResults.put(code,
                StateCentricResult.of(code, namesByCode.get(code), verdicts, DispatchPath.RECONSTRUCTED)));
        return stateResults;
    }
}
