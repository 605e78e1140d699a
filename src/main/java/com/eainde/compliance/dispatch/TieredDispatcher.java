package com.eainde.compliance.dispatch;

import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.DispatchPath;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.JurisdictionProfile;
import com.eainde.compliance.model.StateCentricResult;
import com.eainde.compliance.strategy.LlmBatchedMatcher;
import com.eainde.compliance.strategy.RuleBasedMatcher;
import com.eainde.compliance.strategy.StrategyOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Chooses the classification strategy for one jurisdiction from its baseline risk tier.
 *
 * <pre>
 *   high   : LLM batch  --failure-->  rules for every feature (confidence 0.8)
 *   medium : rules  --complex signals-->  LLM review (failure keeps rule verdicts)
 *   low    : rules
 * </pre>
 *
 * Each transition happens at most once per jurisdiction per run. Without a completion
 * service every tier runs rules only.
 */
@Slf4j
public class TieredDispatcher {

    static final List<String> COMPLEX_SIGNALS = List.of(
            "biometric", "health", "financial", "location", "behavioral", "tracking", "analytics");

    private final RuleBasedMatcher ruleMatcher;
    private final Optional<LlmBatchedMatcher> llmMatcher;

    public TieredDispatcher(RuleBasedMatcher ruleMatcher, Optional<LlmBatchedMatcher> llmMatcher) {
        this.ruleMatcher = ruleMatcher;
        this.llmMatcher = llmMatcher;
    }

    public boolean isLlmAvailable() {
        return llmMatcher.isPresent();
    }

    /**
     * Produces one verdict per feature for the jurisdiction. Never throws for
     * completion-service problems.
     */
    public StateCentricResult dispatch(List<Feature> features, JurisdictionProfile jurisdiction) {
        if (features == null) {
            throw new IllegalArgumentException("features must not be null");
        }
        if (llmMatcher.isEmpty() || features.isEmpty()) {
            return result(jurisdiction, rules(features, jurisdiction, RuleBasedMatcher.STANDARD_CONFIDENCE),
                    DispatchPath.RULES);
        }

        switch (jurisdiction.riskTier()) {
            case HIGH:
                return dispatchHighTier(features, jurisdiction, llmMatcher.get());
            case MEDIUM:
                return dispatchMediumTier(features, jurisdiction, llmMatcher.get());
            case LOW:
            default:
                return result(jurisdiction, rules(features, jurisdiction, RuleBasedMatcher.STANDARD_CONFIDENCE),
                        DispatchPath.RULES);
        }
    }

    private StateCentricResult dispatchHighTier(List<Feature> features, JurisdictionProfile jurisdiction,
                                                LlmBatchedMatcher matcher) {
        StrategyOutcome outcome = guarded(() -> matcher.classify(features, jurisdiction));
        if (outcome.isSuccess() && outcome.getVerdicts().size() == features.size()) {
            log.info("{}: {} verdicts from batched analysis", jurisdiction.code(), features.size());
            return result(jurisdiction, outcome.getVerdicts(), DispatchPath.LLM);
        }

        String reason = outcome.isSuccess()
                ? "incomplete response (" + outcome.getVerdicts().size() + "/" + features.size() + " verdicts)"
                : outcome.getFailureReason();
        log.warn("{}: batched analysis failed, falling back to rules for all {} features: {}",
                jurisdiction.code(), features.size(), reason);
        return result(jurisdiction, rules(features, jurisdiction, RuleBasedMatcher.ELEVATED_CONFIDENCE),
                DispatchPath.LLM_FALLBACK_TO_RULES);
    }

    private StateCentricResult dispatchMediumTier(List<Feature> features, JurisdictionProfile jurisdiction,
                                                  LlmBatchedMatcher matcher) {
        List<ComplianceVerdict> ruleVerdicts = rules(features, jurisdiction, RuleBasedMatcher.STANDARD_CONFIDENCE);
        if (!hasComplexSignals(features)) {
            return result(jurisdiction, ruleVerdicts, DispatchPath.RULES);
        }

        StrategyOutcome review = guarded(() -> matcher.review(features, jurisdiction, ruleVerdicts));
        if (!review.isSuccess() || review.getVerdicts().size() != ruleVerdicts.size()) {
            log.warn("{}: review failed, keeping rule-based verdicts: {}",
                    jurisdiction.code(), review.getFailureReason());
            return result(jurisdiction, ruleVerdicts, DispatchPath.RULES);
        }
        return result(jurisdiction, review.getVerdicts(), DispatchPath.RULES_LLM_VALIDATED);
    }

    /** Unexpected runtime errors from the completion path count as a failed outcome. */
    private static StrategyOutcome guarded(Supplier<StrategyOutcome> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return StrategyOutcome.failure("unexpected error: " + e, e);
        }
    }

    static boolean hasComplexSignals(List<Feature> features) {
        for (Feature feature : features) {
            String text = (feature.searchableText() + " " + String.join(" ", feature.dataTypes()))
                    .toLowerCase(Locale.ROOT);
            for (String signal : COMPLEX_SIGNALS) {
                if (text.contains(signal)) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<ComplianceVerdict> rules(List<Feature> features, JurisdictionProfile jurisdiction,
                                          double confidence) {
        return ruleMatcher.classify(features, jurisdiction, confidence).getVerdicts();
    }

    private static StateCentricResult result(JurisdictionProfile jurisdiction,
                                             List<ComplianceVerdict> verdicts, DispatchPath path) {
        return StateCentricResult.of(jurisdiction.code(), jurisdiction.name(), verdicts, path);
    }
}
