package com.eainde.compliance.strategy;

import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.JurisdictionProfile;
import com.eainde.compliance.model.RiskLevel;
import com.eainde.compliance.model.VerdictSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Evaluates every feature against one jurisdiction with a single completion call.
 *
 * <h3>Conversion rules:</h3>
 * <ul>
 *   <li>Results are matched to features by position; only the returned prefix is converted</li>
 *   <li>A {@code risk_level} outside {low, high} is coerced from {@code risk_score} and logged</li>
 *   <li>Missing fields default to risk 0.5, compliant, confidence 0.8</li>
 *   <li>Null and blank regulation/action entries are dropped</li>
 *   <li>Empty, failed, unparseable or unconvertible responses yield {@link StrategyOutcome#failure}</li>
 * </ul>
 */
public class LlmBatchedMatcher implements ComplianceClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmBatchedMatcher.class);

    static final int DESCRIPTION_LIMIT = 300;
    static final int TECHNICAL_REQUIREMENT_LIMIT = 5;

    static final double DEFAULT_RISK_SCORE = 0.5;
    static final double DEFAULT_CONFIDENCE = 0.8;

    private final ComplianceCompletionClient completionClient;
    private final VerdictResponseParser responseParser;
    private final ObjectMapper objectMapper;

    public LlmBatchedMatcher(ComplianceCompletionClient completionClient,
                             VerdictResponseParser responseParser,
                             ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.responseParser = responseParser;
        this.objectMapper = objectMapper;
    }

    // =========================================================================
    //  Batched analysis
    // =========================================================================

    @Override
    public StrategyOutcome classify(List<Feature> features, JurisdictionProfile jurisdiction) {
        if (features.isEmpty()) {
            return StrategyOutcome.success(List.of());
        }

        JurisdictionPrompt prompt;
        try {
            prompt = buildPrompt(features, jurisdiction);
        } catch (JsonProcessingException e) {
            return StrategyOutcome.failure("Could not serialize feature summaries", e);
        }

        List<LlmFeatureVerdict> results;
        try {
            String raw = completionClient.analyze(prompt);
            log.debug("Raw analysis response for {}: {}", jurisdiction.code(), preview(raw));
            results = responseParser.parse(raw);
        } catch (CompletionFailedException e) {
            return StrategyOutcome.failure(e.getMessage(), e);
        } catch (ResponseParseException e) {
            return StrategyOutcome.failure("Unparseable analysis response: " + e.getMessage(), e);
        }

        if (results.isEmpty()) {
            return StrategyOutcome.failure("No feature results in analysis response");
        }
        if (results.size() > features.size()) {
            log.warn("{} returned {} results for {} features, extra results ignored",
                    jurisdiction.code(), results.size(), features.size());
        } else if (results.size() < features.size()) {
            log.warn("{} returned {} results for {} features, only the returned prefix is converted",
                    jurisdiction.code(), results.size(), features.size());
        }

        int count = Math.min(results.size(), features.size());
        List<ComplianceVerdict> verdicts = new ArrayList<>(count);
        try {
            for (int i = 0; i < count; i++) {
                verdicts.add(toVerdict(features.get(i), jurisdiction, results.get(i), VerdictSource.LLM_BATCH));
            }
        } catch (RuntimeException e) {
            return StrategyOutcome.failure("Could not convert analysis response: " + e.getMessage(), e);
        }
        return StrategyOutcome.success(verdicts);
    }

    // =========================================================================
    //  Review of rule-based verdicts
    // =========================================================================

    /**
     * Asks the service to review existing verdicts. Records it returns replace the matching
     * verdict (by feature id, or by position when the id is missing); every other verdict
     * is kept as is. A failed call returns a failure and the caller keeps {@code prior}.
     */
    public StrategyOutcome review(List<Feature> features, JurisdictionProfile jurisdiction,
                                  List<ComplianceVerdict> prior) {
        if (features.isEmpty()) {
            return StrategyOutcome.success(prior);
        }

        List<LlmFeatureVerdict> revisions;
        try {
            JurisdictionPrompt prompt = buildPrompt(features, jurisdiction);
            String verdictsJson = objectMapper.writeValueAsString(prior);
            String raw = completionClient.review(prompt, verdictsJson);
            log.debug("Raw review response for {}: {}", jurisdiction.code(), preview(raw));
            revisions = responseParser.parse(raw);
        } catch (JsonProcessingException e) {
            return StrategyOutcome.failure("Could not serialize review request", e);
        } catch (CompletionFailedException e) {
            return StrategyOutcome.failure(e.getMessage(), e);
        } catch (ResponseParseException e) {
            return StrategyOutcome.failure("Unparseable review response: " + e.getMessage(), e);
        }

        Map<String, Integer> positionById = new HashMap<>();
        for (int i = 0; i < features.size(); i++) {
            positionById.put(features.get(i).id(), i);
        }

        List<ComplianceVerdict> merged = new ArrayList<>(prior);
        int revised = 0;
        try {
            for (int i = 0; i < revisions.size(); i++) {
                LlmFeatureVerdict revision = revisions.get(i);
                Integer position = revision.featureId() != null
                        ? positionById.get(revision.featureId())
                        : (i < features.size() ? Integer.valueOf(i) : null);
                if (position == null) {
                    log.warn("Review for {} referenced unknown feature '{}', ignored",
                            jurisdiction.code(), revision.featureId());
                    continue;
                }
                merged.set(position,
                        toVerdict(features.get(position), jurisdiction, revision, VerdictSource.LLM_VALIDATED));
                revised++;
            }
        } catch (RuntimeException e) {
            return StrategyOutcome.failure("Could not convert review response: " + e.getMessage(), e);
        }
        log.info("Review for {} revised {}/{} rule-based verdicts", jurisdiction.code(), revised, prior.size());
        return StrategyOutcome.success(merged);
    }

    // =========================================================================
    //  Internal Helpers
    // =========================================================================

    JurisdictionPrompt buildPrompt(List<Feature> features, JurisdictionProfile jurisdiction)
            throws JsonProcessingException {
        ArrayNode summaries = objectMapper.createArrayNode();
        for (Feature feature : features) {
            ObjectNode summary = summaries.addObject();
            summary.put("feature_id", feature.id());
            summary.put("feature_name", feature.name());
            summary.put("feature_description", truncate(feature.description(), DESCRIPTION_LIMIT));
            ArrayNode dataTypes = summary.putArray("data_types");
            feature.dataTypes().forEach(dataTypes::add);
            ArrayNode technical = summary.putArray("technical_requirements");
            feature.technicalRequirements().stream()
                    .limit(TECHNICAL_REQUIREMENT_LIMIT)
                    .forEach(technical::add);
        }

        return new JurisdictionPrompt(
                jurisdiction.code(),
                jurisdiction.name(),
                describe(jurisdiction),
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summaries),
                features.size());
    }

    private String describe(JurisdictionProfile jurisdiction) {
        StringBuilder sb = new StringBuilder();
        sb.append("- State: ").append(jurisdiction.name()).append(" (").append(jurisdiction.code()).append(")\n");
        sb.append("- Applicable Regulations: ").append(String.join(", ", jurisdiction.regulations())).append('\n');
        sb.append("- Risk Tier: ").append(jurisdiction.riskTier().wireValue().toUpperCase()).append('\n');
        sb.append("- Enforcement Level: ").append(jurisdiction.enforcement().wireValue().toUpperCase()).append('\n');
        sb.append("- Key Requirements: ").append(String.join(", ", jurisdiction.requiredPractices())).append('\n');
        sb.append("- Potential Penalties: ").append(String.join(", ", jurisdiction.penalties())).append('\n');
        if (jurisdiction.effectiveDate() != null) {
            sb.append("- Effective Date: ").append(jurisdiction.effectiveDate()).append('\n');
        }
        return sb.toString();
    }

    private ComplianceVerdict toVerdict(Feature feature, JurisdictionProfile jurisdiction,
                                        LlmFeatureVerdict result, VerdictSource source) {
        double riskScore = result.riskScore() != null ? result.riskScore() : DEFAULT_RISK_SCORE;
        RiskLevel derived = RiskLevel.fromScore(riskScore);

        RiskLevel.parse(result.riskLevel()).ifPresentOrElse(
                returned -> {
                    if (returned != derived) {
                        log.debug("{} / {}: returned risk_level '{}' disagrees with score {}, using '{}'",
                                jurisdiction.code(), feature.id(), returned.wireValue(), riskScore, derived.wireValue());
                    }
                },
                () -> log.warn("{} / {}: coerced risk_level '{}' to '{}' from risk_score {}",
                        jurisdiction.code(), feature.id(), result.riskLevel(), derived.wireValue(), riskScore));

        return new ComplianceVerdict(
                jurisdiction.code(),
                jurisdiction.name(),
                feature.id(),
                feature.name(),
                riskScore,
                result.compliant() != null ? result.compliant() : true,
                new LinkedHashSet<>(nonBlank(result.violatedRegulations())),
                nonBlank(result.remediationActions()),
                result.reasoning(),
                result.confidenceScore() != null ? result.confidenceScore() : DEFAULT_CONFIDENCE,
                source);
    }

    private static List<String> nonBlank(Collection<String> entries) {
        if (entries == null) return List.of();
        return entries.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(entry -> !entry.isEmpty())
                .collect(Collectors.toList());
    }

    private static String truncate(String text, int limit) {
        if (text == null) return "";
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    private static String preview(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
