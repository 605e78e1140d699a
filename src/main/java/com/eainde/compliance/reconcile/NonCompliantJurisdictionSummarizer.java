package com.eainde.compliance.reconcile;

import com.eainde.compliance.model.FeatureCentricResult;
import com.eainde.compliance.model.JurisdictionCompliance;
import com.eainde.compliance.model.NonCompliantAnalysis;
import com.eainde.compliance.model.NonCompliantJurisdiction;
import com.eainde.compliance.model.NonCompliantSummary;
import com.eainde.compliance.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds the feature-centric view into one entry per jurisdiction that at least one
 * feature failed. A jurisdiction's risk score is the maximum over its failing features.
 */
public class NonCompliantJurisdictionSummarizer {

    private static final Logger log = LoggerFactory.getLogger(NonCompliantJurisdictionSummarizer.class);

    static final double HIGHEST_RISK_THRESHOLD = 0.8;
    static final double MEDIUM_RISK_THRESHOLD = 0.5;

    static final List<String> CROSS_JURISDICTION_RECOMMENDATIONS = List.of(
            "Implement state-specific consent mechanisms",
            "Add comprehensive data security measures",
            "Establish user rights portal for data access and deletion",
            "Monitor for regulation updates in all states");

    public NonCompliantSummary summarize(List<FeatureCentricResult> featureResults) {
        Map<String, Accumulator> byCode = new LinkedHashMap<>();

        for (FeatureCentricResult feature : featureResults) {
            for (String code : feature.nonCompliantJurisdictions()) {
                JurisdictionCompliance entry = feature.jurisdictions().get(code);
                if (entry == null) {
                    log.warn("Feature '{}' lists {} as non-compliant without an entry, ignored",
                            feature.featureId(), code);
                    continue;
                }
                Accumulator accumulator = byCode.get(code);
                if (accumulator == null) {
                    byCode.put(code, new Accumulator(feature.featureName(), entry));
                } else {
                    accumulator.merge(feature.featureName(), entry);
                }
            }
        }

        Map<String, NonCompliantJurisdiction> jurisdictions = new LinkedHashMap<>();
        byCode.forEach((code, accumulator) -> jurisdictions.put(code, accumulator.toEntry()));

        List<String> highestRisk = new ArrayList<>();
        boolean anyMedium = false;
        for (Map.Entry<String, NonCompliantJurisdiction> entry : jurisdictions.entrySet()) {
            double score = entry.getValue().riskScore();
            if (score >= HIGHEST_RISK_THRESHOLD) {
                highestRisk.add(entry.getKey());
            }
            if (score >= MEDIUM_RISK_THRESHOLD) {
                anyMedium = true;
            }
        }
        String overallRisk = !highestRisk.isEmpty() ? "high" : anyMedium ? "medium" : "low";

        log.info("{} non-compliant jurisdictions, overall risk {}", jurisdictions.size(), overallRisk);
        return new NonCompliantSummary(
                jurisdictions,
                new NonCompliantAnalysis(jurisdictions.size(), highestRisk, overallRisk),
                jurisdictions.isEmpty() ? List.of() : CROSS_JURISDICTION_RECOMMENDATIONS);
    }

    private static final class Accumulator {

        private final String jurisdictionName;
        private double riskScore;
        private String reasoning;
        private final List<String> featureNames = new ArrayList<>();
        private final Set<String> regulations = new LinkedHashSet<>();
        private final Set<String> actions = new LinkedHashSet<>();

        Accumulator(String featureName, JurisdictionCompliance first) {
            this.jurisdictionName = first.jurisdictionName();
            this.riskScore = first.riskScore();
            this.reasoning = first.reasoning();
            add(featureName, first);
        }

        void merge(String featureName, JurisdictionCompliance next) {
            if (next.riskScore() > riskScore) {
                riskScore = next.riskScore();
                reasoning = next.reasoning();
            }
            add(featureName, next);
        }

        private void add(String featureName, JurisdictionCompliance entry) {
            featureNames.add(featureName);
            regulations.addAll(entry.violatedRegulations());
            actions.addAll(entry.remediationActions());
        }

        NonCompliantJurisdiction toEntry() {
            return new NonCompliantJurisdiction(jurisdictionName, riskScore, RiskLevel.fromScore(riskScore),
                    reasoning, featureNames, new ArrayList<>(regulations), new ArrayList<>(actions));
        }
    }
}
