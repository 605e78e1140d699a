package com.eainde.compliance.reconcile;

import com.eainde.compliance.ComplianceFixtures;
import com.eainde.compliance.dispatch.TieredDispatcher;
import com.eainde.compliance.jurisdiction.JurisdictionReferenceStore;
import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.DispatchPath;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.FeatureCentricResult;
import com.eainde.compliance.model.RiskLevel;
import com.eainde.compliance.model.StateCentricResult;
import com.eainde.compliance.orchestration.BatchOrchestrator;
import com.eainde.compliance.orchestration.MdcAwareExecutor;
import com.eainde.compliance.orchestration.RollupCalculator;
import com.eainde.compliance.strategy.RuleBasedMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.eainde.compliance.ComplianceFixtures.verdict;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DualViewReconcilerTest {

    private final DualViewReconciler reconciler = new DualViewReconciler();

    private static Map<String, StateCentricResult> states(StateCentricResult... results) {
        Map<String, StateCentricResult> map = new LinkedHashMap<>();
        for (StateCentricResult result : results) {
            map.put(result.jurisdictionCode(), result);
        }
        return map;
    }

    // =========================================================================
    //  Feature-centric conversion
    // =========================================================================

    @Nested
    @DisplayName("toFeatureCentric")
    class ToFeatureCentric {

        @Test
        @DisplayName("should derive the feature level from its own mean, not from any one jurisdiction")
        void derivesOwnLevel() {
            Feature feature = Feature.of("F-1", "Face unlock", "", List.of());
            Map<String, StateCentricResult> states = states(
                    StateCentricResult.of("CA", "California",
                            List.of(verdict("CA", "F-1", 0.9, false, List.of("CCPA"), List.of())), DispatchPath.LLM),
                    StateCentricResult.of("AL", "Alabama",
                            List.of(verdict("AL", "F-1", 0.2, true, List.of(), List.of())), DispatchPath.RULES));

            FeatureCentricResult result = reconciler.toFeatureCentric(List.of(feature), states).get(0);

            assertThat(result.meanRiskScore()).isCloseTo(0.55, within(1e-9));
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(result.jurisdictions().get("CA").riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(result.jurisdictions().get("CA").complianceScore()).isCloseTo(0.1, within(1e-9));
            assertThat(result.nonCompliantJurisdictions()).containsExactly("CA");
        }

        @Test
        @DisplayName("should report a feature with no matches as compliant and low risk")
        void unmatchedFeature() {
            Feature orphan = Feature.of("F-404", "Orphan", "", List.of());

            List<FeatureCentricResult> results = reconciler.toFeatureCentric(List.of(orphan), Map.of());

            assertThat(results).hasSize(1);
            FeatureCentricResult result = results.get(0);
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(result.meanRiskScore()).isEqualTo(0.0);
            assertThat(result.nonCompliantJurisdictions()).isEmpty();
            assertThat(result.jurisdictions()).isEmpty();
            assertThat(result.recommendations()).containsExactlyElementsOf(DualViewReconciler.LOW_RISK_RECOMMENDATIONS);
        }

        @Test
        @DisplayName("should produce one result per input feature in input order")
        void onePerFeature() {
            List<Feature> features = ComplianceFixtures.features();

            List<FeatureCentricResult> results = reconciler.toFeatureCentric(features, Map.of());

            assertThat(results).extracting(FeatureCentricResult::featureId).containsExactly("F-1", "F-2", "F-3");
        }

        @Test
        @DisplayName("should reject a null feature list")
        void nullFeatures() {
            assertThatThrownBy(() -> reconciler.toFeatureCentric(null, Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    //  Recommendations
    // =========================================================================

    @Nested
    @DisplayName("Recommendations")
    class Recommendations {

        @Test
        @DisplayName("should merge actions and regulations case-insensitively, then append high-risk boilerplate")
        void mergesAndAppends() {
            List<ComplianceVerdict> matches = List.of(
                    verdict("CA", "F-1", 0.9, false, List.of("CCPA"), List.of("Add consent", "Encrypt data")),
                    verdict("VA", "F-1", 0.7, false, List.of("VCDPA", "CCPA"), List.of("add CONSENT")));

            List<String> recommendations = reconciler.recommendations(matches, RiskLevel.HIGH);

            assertThat(recommendations).containsExactly(
                    "Add consent",
                    "Encrypt data",
                    "Ensure compliance with CCPA",
                    "Ensure compliance with VCDPA",
                    "Conduct a comprehensive compliance audit before launch",
                    "Engage legal counsel to review high-risk jurisdictions");
        }

        @Test
        @DisplayName("should cap merged entries before appending boilerplate")
        void capsEntries() {
            List<String> actions = new ArrayList<>();
            for (int i = 0; i < 15; i++) {
                actions.add("Action " + i);
            }
            List<ComplianceVerdict> matches = List.of(verdict("CA", "F-1", 0.2, true, List.of(), actions));

            List<String> recommendations = new DualViewReconciler(10).recommendations(matches, RiskLevel.LOW);

            assertThat(recommendations).hasSize(12);
            assertThat(recommendations.subList(0, 10)).allMatch(r -> r.startsWith("Action "));
            assertThat(recommendations.subList(10, 12))
                    .containsExactlyElementsOf(DualViewReconciler.LOW_RISK_RECOMMENDATIONS);
        }
    }

    // =========================================================================
    //  Round trip
    // =========================================================================

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("should preserve verdict count and non-compliant memberships")
        void preservesCountsAndMemberships() {
            MdcAwareExecutor executor = new MdcAwareExecutor("round-trip", 2);
            try {
                BatchOrchestrator orchestrator = new BatchOrchestrator(
                        new JurisdictionReferenceStore(ComplianceFixtures.loader()),
                        new TieredDispatcher(new RuleBasedMatcher(), Optional.empty()),
                        executor, new RollupCalculator(), List.of());
                Map<String, StateCentricResult> original =
                        orchestrator.analyze(ComplianceFixtures.features()).results();

                List<FeatureCentricResult> featureView =
                        reconciler.toFeatureCentric(ComplianceFixtures.features(), original);
                Map<String, StateCentricResult> rebuilt = reconciler.toStateCentric(featureView);

                assertThat(countVerdicts(rebuilt)).isEqualTo(countVerdicts(original)).isEqualTo(9);
                assertThat(nonCompliantPairs(rebuilt)).isEqualTo(nonCompliantPairs(original)).isNotEmpty();
                assertThat(rebuilt.values()).allSatisfy(r -> assertThat(r.path()).isEqualTo(DispatchPath.RECONSTRUCTED));
                original.forEach((code, result) -> assertThat(rebuilt.get(code).meanRiskScore())
                        .isCloseTo(result.meanRiskScore(), within(1e-9)));
            } finally {
                executor.shutdownNow();
            }
        }

        private int countVerdicts(Map<String, StateCentricResult> results) {
            return results.values().stream().mapToInt(r -> r.verdicts().size()).sum();
        }

        private Set<String> nonCompliantPairs(Map<String, StateCentricResult> results) {
            Set<String> pairs = new TreeSet<>();
            results.values().forEach(r -> r.verdicts().stream()
                    .filter(v -> !v.compliant())
                    .forEach(v -> pairs.add(v.jurisdictionCode() + "/" + v.featureId())));
            return pairs;
        }
    }
}
