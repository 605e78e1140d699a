package com.eainde.compliance.strategy;

import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.JurisdictionProfile;
import com.eainde.compliance.model.RiskLevel;
import com.eainde.compliance.model.VerdictSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic keyword matcher. No external calls; the verdict is a pure function
 * of the feature and the jurisdiction profile.
 *
 * <h3>Scoring:</h3>
 * <pre>
 * risk = 0.30                                   baseline
 *      + 0.20 per sensitive data category        (PII, biometric, health, financial, location, behavioral)
 *      + 0.10 if enforcement is strict
 * risk = clamp(risk, 0, 1)                       level = high iff risk &gt;= 0.6
 * </pre>
 *
 * <h3>Compliance:</h3>
 * Every required practice is checked against the feature's name + description with the
 * keyword rules in {@link PrivacyRequirement}. One missing practice makes the verdict
 * non-compliant and adds the jurisdiction's regulations to the violated set.
 */
@Slf4j
public class RuleBasedMatcher implements ComplianceClassifier {

    public static final double BASELINE_RISK = 0.3;
    public static final double STRICT_ENFORCEMENT_RISK = 0.1;

    /** Confidence for a plain rule-based run. */
    public static final double STANDARD_CONFIDENCE = 0.7;
    /** Confidence when rules stand in for a failed high-tier completion call. */
    public static final double ELEVATED_CONFIDENCE = 0.8;

    static final List<String> NON_COMPLIANCE_ACTIONS = List.of(
            "Conduct a compliance gap analysis",
            "Update privacy policies and user-facing notices",
            "Train staff on state privacy obligations",
            "Establish ongoing compliance monitoring");

    @Override
    public StrategyOutcome classify(List<Feature> features, JurisdictionProfile jurisdiction) {
        return classify(features, jurisdiction, STANDARD_CONFIDENCE);
    }

    public StrategyOutcome classify(List<Feature> features, JurisdictionProfile jurisdiction, double confidence) {
        List<ComplianceVerdict> verdicts = new ArrayList<>(features.size());
        for (Feature feature : features) {
            verdicts.add(evaluate(feature, jurisdiction, confidence));
        }
        log.debug("Rule-based matcher produced {} verdicts for {}", verdicts.size(), jurisdiction.code());
        return StrategyOutcome.success(verdicts);
    }

    /**
     * Evaluates one (feature, jurisdiction) pair.
     */
    public ComplianceVerdict evaluate(Feature feature, JurisdictionProfile jurisdiction, double confidence) {
        double risk = BASELINE_RISK;
        List<String> findings = new ArrayList<>();

        // ── Data sensitivity ────────────────────────────────────────────
        Set<SensitiveDataCategory> categories = EnumSet.noneOf(SensitiveDataCategory.class);
        for (String tag : feature.dataTypes()) {
            SensitiveDataCategory.fromTag(tag).ifPresent(categories::add);
        }
        for (SensitiveDataCategory category : categories) {
            risk += SensitiveDataCategory.RISK_WEIGHT;
            findings.add(category.note());
        }

        // ── Required practices ──────────────────────────────────────────
        boolean compliant = true;
        Set<String> violated = new LinkedHashSet<>();
        Set<String> actions = new LinkedHashSet<>();
        Set<PrivacyRequirement> checked = EnumSet.noneOf(PrivacyRequirement.class);
        String featureText = feature.searchableText();

        for (String practice : jurisdiction.requiredPractices()) {
            for (PrivacyRequirement requirement : PrivacyRequirement.triggeredBy(practice)) {
                if (!checked.add(requirement)) {
                    continue;
                }
                if (requirement.isSatisfiedBy(featureText)) {
                    findings.add("Requirement '" + practice + "' addressed (" + requirement.capability() + ").");
                } else {
                    compliant = false;
                    violated.addAll(jurisdiction.regulations());
                    actions.add(requirement.remediationAction());
                    findings.add("Requirement '" + practice + "' not evidenced: no mention of "
                            + String.join("/", requirement.evidenceTokens()) + ".");
                }
            }
        }

        // ── Enforcement ─────────────────────────────────────────────────
        if (jurisdiction.isStrict()) {
            risk += STRICT_ENFORCEMENT_RISK;
            findings.add(jurisdiction.name() + " enforces strictly.");
        }

        risk = round(Math.max(0.0, Math.min(1.0, risk)));

        // ── Remediation ─────────────────────────────────────────────────
        for (SensitiveDataCategory category : categories) {
            actions.addAll(category.remediationActions());
        }
        if (!compliant) {
            actions.addAll(NON_COMPLIANCE_ACTIONS);
        }

        return new ComplianceVerdict(
                jurisdiction.code(),
                jurisdiction.name(),
                feature.id(),
                feature.name(),
                risk,
                compliant,
                violated,
                new ArrayList<>(actions),
                buildReasoning(feature, jurisdiction, findings, risk, compliant),
                confidence,
                VerdictSource.RULE_BASED);
    }

    private String buildReasoning(Feature feature, JurisdictionProfile jurisdiction,
                                  List<String> findings, double risk, boolean compliant) {
        StringBuilder sb = new StringBuilder();
        sb.append("Rule-based assessment of '").append(feature.name()).append("' against ")
                .append(jurisdiction.name()).append(" (").append(String.join(", ", jurisdiction.regulations()))
                .append("). ");
        for (String finding : findings) {
            sb.append(finding).append(' ');
        }
        sb.append(compliant ? "No practice gaps found. " : "Practice gaps found. ");
        sb.append(String.format(Locale.ROOT, "Risk score %.2f (%s).",
                risk, RiskLevel.fromScore(risk).wireValue()));
        return sb.toString();
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
