package com.eainde.compliance.strategy;

import com.eainde.compliance.ComplianceFixtures;
import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.EnforcementStrength;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.JurisdictionProfile;
import com.eainde.compliance.model.RiskLevel;
import com.eainde.compliance.model.RiskTier;
import com.eainde.compliance.model.VerdictSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedMatcherTest {

    private final RuleBasedMatcher matcher = new RuleBasedMatcher();

    // =========================================================================
    //  Reference scenarios
    // =========================================================================

    @Nested
    @DisplayName("Reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("biometric feature without consent wording against strict consent state is high risk")
        void biometricWithoutConsent() {
            ComplianceVerdict verdict = matcher.evaluate(
                    ComplianceFixtures.faceUnlock(), ComplianceFixtures.strictHighTier(),
                    RuleBasedMatcher.STANDARD_CONFIDENCE);

            assertThat(verdict.riskScore()).isGreaterThanOrEqualTo(0.6);
            assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(verdict.compliant()).isFalse();
            assertThat(verdict.remediationActions()).anyMatch(a -> a.toLowerCase().contains("consent"));
            assertThat(verdict.violatedRegulations()).containsExactly("CCPA", "CPRA");
        }

        @Test
        @DisplayName("untagged feature against lenient state with no requirements is baseline low risk")
        void plainFeatureLenientState() {
            ComplianceVerdict verdict = matcher.evaluate(
                    ComplianceFixtures.darkMode(), ComplianceFixtures.lenientLowTier(),
                    RuleBasedMatcher.STANDARD_CONFIDENCE);

            assertThat(verdict.riskScore()).isEqualTo(0.3);
            assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(verdict.compliant()).isTrue();
            assertThat(verdict.violatedRegulations()).isEmpty();
            assertThat(verdict.remediationActions()).isEmpty();
        }
    }

    // =========================================================================
    //  Scoring
    // =========================================================================

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("should add each distinct sensitive category once")
        void distinctCategories() {
            Feature feature = Feature.of("F-9", "Tracker", "Records where the user goes",
                    List.of("gps", "location", "email"));

            ComplianceVerdict verdict = matcher.evaluate(feature, ComplianceFixtures.lenientLowTier(), 0.7);

            // location + pii
            assertThat(verdict.riskScore()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("should clamp the score at 1.0")
        void clampsAtOne() {
            Feature feature = Feature.of("F-9", "Everything", "All the data",
                    List.of("biometric", "health", "financial", "location", "browsing", "email"));

            ComplianceVerdict verdict = matcher.evaluate(feature, ComplianceFixtures.strictHighTier(), 0.7);

            assertThat(verdict.riskScore()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should satisfy every triggered requirement from name and description")
        void satisfiesRequirements() {
            ComplianceVerdict verdict = matcher.evaluate(
                    ComplianceFixtures.locationHistory(), ComplianceFixtures.moderateMediumTier(), 0.7);

            assertThat(verdict.compliant()).isTrue();
            assertThat(verdict.riskScore()).isEqualTo(0.7);
            assertThat(verdict.reasoning()).contains("Texas").contains("No practice gaps found");
        }

        @Test
        @DisplayName("should list generic and requirement actions when non-compliant")
        void nonCompliantActions() {
            JurisdictionProfile deletionState = new JurisdictionProfile("VT", "Vermont", List.of("Act 171"),
                    RiskTier.LOW, EnforcementStrength.MODERATE, List.of("Data deletion on request"),
                    List.of(), LocalDate.of(2019, 1, 1), "");

            ComplianceVerdict verdict = matcher.evaluate(ComplianceFixtures.darkMode(), deletionState, 0.7);

            assertThat(verdict.compliant()).isFalse();
            assertThat(verdict.remediationActions())
                    .startsWith("Implement data deletion rights")
                    .containsAll(RuleBasedMatcher.NON_COMPLIANCE_ACTIONS);
        }
    }

    // =========================================================================
    //  Batch behaviour
    // =========================================================================

    @Nested
    @DisplayName("Batch classification")
    class Batch {

        @Test
        @DisplayName("should return one verdict per feature in input order")
        void oneVerdictPerFeature() {
            StrategyOutcome outcome = matcher.classify(ComplianceFixtures.features(), ComplianceFixtures.strictHighTier());

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getVerdicts()).extracting(ComplianceVerdict::featureId)
                    .containsExactly("F-1", "F-2", "F-3");
            assertThat(outcome.getVerdicts()).allSatisfy(v -> {
                assertThat(v.source()).isEqualTo(VerdictSource.RULE_BASED);
                assertThat(v.confidenceScore()).isEqualTo(RuleBasedMatcher.STANDARD_CONFIDENCE);
            });
        }

        @Test
        @DisplayName("should carry the requested confidence")
        void elevatedConfidence() {
            StrategyOutcome outcome = matcher.classify(ComplianceFixtures.features(),
                    ComplianceFixtures.strictHighTier(), RuleBasedMatcher.ELEVATED_CONFIDENCE);

            assertThat(outcome.getVerdicts()).allSatisfy(v ->
                    assertThat(v.confidenceScore()).isEqualTo(RuleBasedMatcher.ELEVATED_CONFIDENCE));
        }

        @Test
        @DisplayName("should produce identical verdicts when run twice")
        void idempotent() {
            for (Feature feature : ComplianceFixtures.features()) {
                for (JurisdictionProfile jurisdiction : ComplianceFixtures.jurisdictions()) {
                    assertThat(matcher.evaluate(feature, jurisdiction, 0.7))
                            .isEqualTo(matcher.evaluate(feature, jurisdiction, 0.7));
                }
            }
        }

        @Test
        @DisplayName("should always derive the risk level from the score")
        void levelMatchesScore() {
            for (JurisdictionProfile jurisdiction : ComplianceFixtures.jurisdictions()) {
                matcher.classify(ComplianceFixtures.features(), jurisdiction).getVerdicts().forEach(v ->
                        assertThat(v.riskLevel()).isEqualTo(v.riskScore() >= 0.6 ? RiskLevel.HIGH : RiskLevel.LOW));
            }
        }
    }
}
