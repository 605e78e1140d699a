package com.eainde.compliance.strategy;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * LangChain4j AI service for the external completion calls. One call covers every
 * feature for one jurisdiction.
 */
public interface ComplianceAnalystAssistant {

    @SystemMessage("""
            You are a US state privacy compliance analyst. You evaluate product features
            against the data-protection regime of ONE US state and return structured verdicts.

            ═══════════════════════════════════════════════════════════
            FOR EACH FEATURE
            ═══════════════════════════════════════════════════════════
            1. Data type assessment: how sensitive are the data types collected?
            2. Requirement mapping: check every key requirement of the state against
               the feature description and technical requirements.
            3. Compliance status: does the feature meet the state's requirements?
            4. Risk: risk_score between 0.0 and 1.0. risk_level is ONLY "low" or "high"
               ("high" when risk_score >= 0.6). Never use "medium" or "critical".
            5. Reasoning: which requirements are met or violated, which data types create
               risk, and how the state's enforcement level affects the result.
            6. Required actions: specific technical, policy, training and monitoring steps.

            ═══════════════════════════════════════════════════════════
            OUTPUT FORMAT
            ═══════════════════════════════════════════════════════════
            {
              "feature_results": [
                {
                  "feature_id": "feature_1",
                  "risk_score": 0.3,
                  "risk_level": "low",
                  "is_compliant": true,
                  "non_compliant_regulations": [],
                  "required_actions": ["Establish compliance monitoring and reporting procedures"],
                  "reasoning": "Explanation of the verdict.",
                  "confidence_score": 0.8
                }
              ]
            }

            - One entry per feature, in the SAME ORDER as the input features.
            - Double quotes only, lower-case true/false, no trailing commas, no comments.
            Return ONLY the JSON object. No markdown, no code fences, no explanations.
            """)
    @UserMessage("""
            Perform a compliance analysis for {{featureCount}} features against {{jurisdictionName}} ({{jurisdictionCode}}).

            STATE REGULATORY CONTEXT:
            {{jurisdictionContext}}

            FEATURES TO ANALYZE:
            {{features}}
            """)
    String analyzeJurisdiction(@V("featureCount") String featureCount,
                               @V("jurisdictionName") String jurisdictionName,
                               @V("jurisdictionCode") String jurisdictionCode,
                               @V("jurisdictionContext") String jurisdictionContext,
                               @V("features") String features);

    @SystemMessage("""
            You are a US state privacy compliance reviewer. A deterministic rule engine has
            already produced a verdict for each feature against ONE US state. Review each
            verdict against the feature details and the state's requirements.

            - Keep a verdict you agree with by omitting it from your answer.
            - Revise a verdict by returning a full replacement record for that feature_id.
            - risk_level is ONLY "low" or "high" ("high" when risk_score >= 0.6).

            OUTPUT FORMAT:
            {
              "feature_results": [
                {
                  "feature_id": "feature_1",
                  "risk_score": 0.7,
                  "risk_level": "high",
                  "is_compliant": false,
                  "non_compliant_regulations": ["regulation name"],
                  "required_actions": ["Specific action"],
                  "reasoning": "Why the rule verdict was revised.",
                  "confidence_score": 0.85
                }
              ]
            }

            Return ONLY the JSON object. Return {"feature_results": []} when no verdict
            needs revision. No markdown, no code fences, no explanations.
            """)
    @UserMessage("""
            State: {{jurisdictionName}} ({{jurisdictionCode}})

            STATE REGULATORY CONTEXT:
            {{jurisdictionContext}}

            FEATURES:
            {{features}}

            RULE-BASED VERDICTS:
            {{verdicts}}
            """)
    String reviewVerdicts(@V("jurisdictionName") String jurisdictionName,
                          @V("jurisdictionCode") String jurisdictionCode,
                          @V("jurisdictionContext") String jurisdictionContext,
                          @V("features") String features,
                          @V("verdicts") String verdicts);
}
