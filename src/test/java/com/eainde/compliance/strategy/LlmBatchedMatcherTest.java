package com.eainde.compliance.strategy;

import com.eainde.compliance.ComplianceFixtures;
import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.RiskLevel;
import com.eainde.compliance.model.VerdictSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmBatchedMatcherTest {

    @Mock private ComplianceCompletionClient client;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private LlmBatchedMatcher matcher;
    private final List<Feature> features = ComplianceFixtures.features();

    @BeforeEach
    void setUp() {
        matcher = new LlmBatchedMatcher(client, new VerdictResponseParser(objectMapper), objectMapper);
    }

    private static String results(String... entries) {
        return "{\"feature_results\": [" + String.join(",", entries) + "]}";
    }

    // =========================================================================
    //  Batched analysis
    // =========================================================================

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        @DisplayName("should map results to features by position")
        void mapsByPosition() {
            when(client.analyze(any())).thenReturn(results(
                    "{\"feature_id\": \"F-1\", \"risk_score\": 0.9, \"risk_level\": \"high\", \"is_compliant\": false,"
                            + " \"non_compliant_regulations\": [\"CCPA\"], \"required_actions\": [\"Get consent\"],"
                            + " \"reasoning\": \"Biometric\", \"confidence_score\": 0.95}",
                    "{\"feature_id\": \"F-2\", \"risk_score\": 0.1, \"risk_level\": \"low\", \"is_compliant\": true}",
                    "{\"feature_id\": \"F-3\", \"risk_score\": 0.4, \"risk_level\": \"low\", \"is_compliant\": true}"));

            StrategyOutcome outcome = matcher.classify(features, ComplianceFixtures.strictHighTier());

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getVerdicts()).hasSize(3);
            ComplianceVerdict first = outcome.getVerdicts().get(0);
            assertThat(first.featureId()).isEqualTo("F-1");
            assertThat(first.featureName()).isEqualTo("Face unlock");
            assertThat(first.jurisdictionCode()).isEqualTo("CA");
            assertThat(first.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(first.violatedRegulations()).containsExactly("CCPA");
            assertThat(first.confidenceScore()).isEqualTo(0.95);
            assertThat(outcome.getVerdicts()).allSatisfy(v -> assertThat(v.source()).isEqualTo(VerdictSource.LLM_BATCH));
        }

        @Test
        @DisplayName("should coerce a stray risk level from the score")
        void coercesStrayLevel() {
            when(client.analyze(any())).thenReturn(results(
                    "{\"risk_score\": 0.65, \"risk_level\": \"medium\"}",
                    "{\"risk_score\": 0.3, \"risk_level\": \"critical\"}",
                    "{\"risk_score\": 0.8, \"risk_level\": \"low\"}"));

            List<ComplianceVerdict> verdicts = matcher.classify(features, ComplianceFixtures.strictHighTier()).getVerdicts();

            assertThat(verdicts).extracting(ComplianceVerdict::riskLevel)
                    .containsExactly(RiskLevel.HIGH, RiskLevel.LOW, RiskLevel.HIGH);
        }

        @Test
        @DisplayName("should default missing fields")
        void defaultsMissingFields() {
            when(client.analyze(any())).thenReturn(results("{}", "{}", "{}"));

            ComplianceVerdict verdict = matcher.classify(features, ComplianceFixtures.strictHighTier())
                    .getVerdicts().get(0);

            assertThat(verdict.riskScore()).isEqualTo(LlmBatchedMatcher.DEFAULT_RISK_SCORE);
            assertThat(verdict.compliant()).isTrue();
            assertThat(verdict.confidenceScore()).isEqualTo(LlmBatchedMatcher.DEFAULT_CONFIDENCE);
            assertThat(verdict.violatedRegulations()).isEmpty();
        }

        @Test
        @DisplayName("should convert only the returned prefix when results are short")
        void shortResponse() {
            when(client.analyze(any())).thenReturn(results("{\"risk_score\": 0.2}", "{\"risk_score\": 0.3}"));

            StrategyOutcome outcome = matcher.classify(features, ComplianceFixtures.strictHighTier());

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getVerdicts()).extracting(ComplianceVerdict::featureId).containsExactly("F-1", "F-2");
        }

        @Test
        @DisplayName("should ignore extra results")
        void extraResults() {
            when(client.analyze(any())).thenReturn(results("{}", "{}", "{}", "{}"));

            assertThat(matcher.classify(features, ComplianceFixtures.strictHighTier()).getVerdicts()).hasSize(3);
        }

        @Test
        @DisplayName("should fail on an empty results array")
        void emptyResults() {
            when(client.analyze(any())).thenReturn(results());

            StrategyOutcome outcome = matcher.classify(features, ComplianceFixtures.strictHighTier());

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getVerdicts()).isEmpty();
        }

        @Test
        @DisplayName("should fail when the completion call fails")
        void callFailure() {
            CompletionFailedException failure = new CompletionFailedException("timed out");
            when(client.analyze(any())).thenThrow(failure);

            StrategyOutcome outcome = matcher.classify(features, ComplianceFixtures.strictHighTier());

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getCause()).isSameAs(failure);
        }

        @Test
        @DisplayName("should fail on an unparseable payload")
        void unparseable() {
            when(client.analyze(any())).thenReturn("Sorry, I cannot comply.");

            StrategyOutcome outcome = matcher.classify(features, ComplianceFixtures.strictHighTier());

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getCause()).isInstanceOf(ResponseParseException.class);
        }

        @Test
        @DisplayName("should not call the service without features")
        void noFeatures() {
            StrategyOutcome outcome = matcher.classify(List.of(), ComplianceFixtures.strictHighTier());

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getVerdicts()).isEmpty();
            verifyNoInteractions(client);
        }
    }

    // =========================================================================
    //  Prompt
    // =========================================================================

    @Nested
    @DisplayName("Prompt")
    class Prompt {

        @Test
        @DisplayName("should truncate descriptions and limit technical requirements")
        void compactSummaries() throws Exception {
            Feature verbose = new Feature("F-9", "Verbose", "x".repeat(500), "",
                    List.of("health"), List.of("r1", "r2", "r3", "r4", "r5", "r6", "r7"), "");
            when(client.analyze(any())).thenReturn(results("{}"));

            matcher.classify(List.of(verbose), ComplianceFixtures.strictHighTier());

            ArgumentCaptor<JurisdictionPrompt> captor = ArgumentCaptor.forClass(JurisdictionPrompt.class);
            verify(client).analyze(captor.capture());
            JurisdictionPrompt prompt = captor.getValue();
            JsonNode summary = objectMapper.readTree(prompt.featuresJson()).get(0);

            assertThat(summary.get("feature_description").asText()).hasSize(LlmBatchedMatcher.DESCRIPTION_LIMIT);
            assertThat(summary.get("technical_requirements")).hasSize(LlmBatchedMatcher.TECHNICAL_REQUIREMENT_LIMIT);
            assertThat(summary.get("data_types").get(0).asText()).isEqualTo("health");
            assertThat(prompt.featureCount()).isEqualTo(1);
            assertThat(prompt.jurisdictionContext())
                    .contains("CCPA, CPRA")
                    .contains("Written consent for biometric data")
                    .contains("STRICT")
                    .contains("2023-01-01");
        }
    }

    // =========================================================================
    //  Review
    // =========================================================================

    @Nested
    @DisplayName("review")
    class Review {

        private final RuleBasedMatcher rules = new RuleBasedMatcher();

        @Test
        @DisplayName("should replace only the revised verdicts")
        void mergesRevisions() {
            List<ComplianceVerdict> prior = rules.classify(features, ComplianceFixtures.moderateMediumTier()).getVerdicts();
            when(client.review(any(), anyString())).thenReturn(results(
                    "{\"feature_id\": \"F-3\", \"risk_score\": 0.85, \"is_compliant\": false,"
                            + " \"non_compliant_regulations\": [\"TDPSA\"]}",
                    "{\"feature_id\": \"F-404\", \"risk_score\": 0.1}"));

            StrategyOutcome outcome = matcher.review(features, ComplianceFixtures.moderateMediumTier(), prior);

            assertThat(outcome.isSuccess()).isTrue();
            List<ComplianceVerdict> merged = outcome.getVerdicts();
            assertThat(merged.get(0)).isEqualTo(prior.get(0));
            assertThat(merged.get(1)).isEqualTo(prior.get(1));
            assertThat(merged.get(2).source()).isEqualTo(VerdictSource.LLM_VALIDATED);
            assertThat(merged.get(2).riskScore()).isEqualTo(0.85);
            assertThat(merged.get(2).compliant()).isFalse();
        }

        @Test
        @DisplayName("should keep every verdict when nothing is revised")
        void noRevisions() {
            List<ComplianceVerdict> prior = rules.classify(features, ComplianceFixtures.moderateMediumTier()).getVerdicts();
            when(client.review(any(), anyString())).thenReturn(results());

            assertThat(matcher.review(features, ComplianceFixtures.moderateMediumTier(), prior).getVerdicts())
                    .isEqualTo(prior);
        }

        @Test
        @DisplayName("should fail when the review call fails")
        void reviewFailure() {
            List<ComplianceVerdict> prior = rules.classify(features, ComplianceFixtures.moderateMediumTier()).getVerdicts();
            when(client.review(any(), anyString())).thenThrow(new CompletionFailedException("boom"));

            assertThat(matcher.review(features, ComplianceFixtures.moderateMediumTier(), prior).isSuccess()).isFalse();
        }
    }
}
