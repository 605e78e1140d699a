package com.eainde.compliance.config;

import com.eainde.compliance.dispatch.TieredDispatcher;
import com.eainde.compliance.jurisdiction.ClasspathJurisdictionLoader;
import com.eainde.compliance.jurisdiction.JurisdictionLoader;
import com.eainde.compliance.jurisdiction.JurisdictionReferenceStore;
import com.eainde.compliance.orchestration.BatchOrchestrator;
import com.eainde.compliance.orchestration.MdcAwareExecutor;
import com.eainde.compliance.orchestration.RollupCalculator;
import com.eainde.compliance.reconcile.DualViewReconciler;
import com.eainde.compliance.reconcile.NonCompliantJurisdictionSummarizer;
import com.eainde.compliance.strategy.ComplianceAnalystAssistant;
import com.eainde.compliance.strategy.ComplianceCompletionClient;
import com.eainde.compliance.strategy.LlmBatchedMatcher;
import com.eainde.compliance.strategy.RuleBasedMatcher;
import com.eainde.compliance.strategy.VerdictResponseParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.vertexai.VertexAiGeminiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Wires the compliance engine.
 *
 * <h3>Configuration (application.yml):</h3>
 * <pre>
 * compliance:
 *   jurisdictions:
 *     resource: jurisdictions/us-states.json
 *   llm:
 *     enabled: false            # true → Vertex AI Gemini for high/medium tiers
 *     project: my-gcp-project
 *     location: us-central1
 *     model-name: gemini-1.5-pro
 *     temperature: 0.1
 *     max-output-tokens: 8192
 *     timeout-seconds: 60
 *   batch:
 *     max-concurrency: 4
 *     target-jurisdictions: []  # empty → all
 *   recommendations:
 *     max: 10
 * </pre>
 */
@Slf4j
@Configuration
public class ComplianceEngineConfig {

    // =========================================================================
    //  Reference data
    // =========================================================================

    @Bean
    public JurisdictionLoader jurisdictionLoader(
            ObjectMapper objectMapper,
            @Value("${compliance.jurisdictions.resource:" + ClasspathJurisdictionLoader.DEFAULT_RESOURCE + "}")
            String resource) {
        return new ClasspathJurisdictionLoader(objectMapper, resource);
    }

    @Bean
    public JurisdictionReferenceStore jurisdictionReferenceStore(JurisdictionLoader jurisdictionLoader) {
        return new JurisdictionReferenceStore(jurisdictionLoader);
    }

    // =========================================================================
    //  Completion service
    // =========================================================================

    @Bean
    public ComplianceTelemetryListener complianceTelemetryListener() {
        return new ComplianceTelemetryListener();
    }

    @Bean
    @ConditionalOnProperty(name = "compliance.llm.enabled", havingValue = "true")
    public ChatModel complianceChatModel(
            @Value("${compliance.llm.project}") String project,
            @Value("${compliance.llm.location}") String location,
            @Value("${compliance.llm.model-name}") String modelName,
            @Value("${compliance.llm.temperature:0.1}") float temperature,
            @Value("${compliance.llm.max-output-tokens:8192}") int maxOutputTokens,
            ComplianceTelemetryListener telemetryListener) {
        log.info("Completion service: Vertex AI {} ({}/{})", modelName, project, location);
        return VertexAiGeminiChatModel.builder()
                .project(project)
                .location(location)
                .modelName(modelName)
                .temperature(temperature)
                .maxOutputTokens(maxOutputTokens)
                .listeners(List.of(telemetryListener))
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public MdcAwareExecutor completionCallExecutor(
            @Value("${compliance.batch.max-concurrency:4}") int maxConcurrency) {
        return new MdcAwareExecutor("compliance-llm", maxConcurrency);
    }

    // =========================================================================
    //  Strategies & dispatch
    // =========================================================================

    @Bean
    public RuleBasedMatcher ruleBasedMatcher() {
        return new RuleBasedMatcher();
    }

    @Bean
    public TieredDispatcher tieredDispatcher(
            RuleBasedMatcher ruleBasedMatcher,
            ObjectProvider<ChatModel> chatModel,
            ObjectMapper objectMapper,
            @Qualifier("completionCallExecutor") MdcAwareExecutor completionCallExecutor,
            @Value("${compliance.llm.timeout-seconds:60}") long timeoutSeconds) {

        Optional<LlmBatchedMatcher> llmMatcher = Optional.ofNullable(chatModel.getIfAvailable())
                .map(model -> {
                    ComplianceAnalystAssistant assistant = AiServices.builder(ComplianceAnalystAssistant.class)
                            .chatModel(model)
                            .build();
                    ComplianceCompletionClient client = new ComplianceCompletionClient(
                            assistant, completionCallExecutor, Duration.ofSeconds(timeoutSeconds));
                    return new LlmBatchedMatcher(client, new VerdictResponseParser(objectMapper), objectMapper);
                });

        if (llmMatcher.isEmpty()) {
            log.warn("No completion service configured, every jurisdiction runs rule-based only");
        }
        return new TieredDispatcher(ruleBasedMatcher, llmMatcher);
    }

    // =========================================================================
    //  Orchestration & views
    // =========================================================================

    @Bean(destroyMethod = "shutdownNow")
    public MdcAwareExecutor jurisdictionWorkerExecutor(
            @Value("${compliance.batch.max-concurrency:4}") int maxConcurrency) {
        return new MdcAwareExecutor("compliance-worker", maxConcurrency);
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(
            JurisdictionReferenceStore referenceStore,
            TieredDispatcher tieredDispatcher,
            @Qualifier("jurisdictionWorkerExecutor") MdcAwareExecutor workerExecutor,
            @Value("${compliance.batch.target-jurisdictions:}") List<String> targetJurisdictions) {
        return new BatchOrchestrator(referenceStore, tieredDispatcher, workerExecutor,
                new RollupCalculator(), targetJurisdictions);
    }

    @Bean
    public DualViewReconciler dualViewReconciler(
            @Value("${compliance.recommendations.max:" + DualViewReconciler.DEFAULT_MAX_RECOMMENDATIONS + "}")
            int maxRecommendations) {
        return new DualViewReconciler(maxRecommendations);
    }

    @Bean
    public NonCompliantJurisdictionSummarizer nonCompliantJurisdictionSummarizer() {
        return new NonCompliantJurisdictionSummarizer();
    }
}
