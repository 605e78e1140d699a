package com.eainde.compliance.model;

/**
 * Route the dispatcher took for one jurisdiction.
 *
 * <ul>
 *   <li>{@code LLM} - high tier, batched completion call succeeded</li>
 *   <li>{@code LLM_FALLBACK_TO_RULES} - high tier, completion call failed, rules used for every feature</li>
 *   <li>{@code RULES} - rule-based only (low tier, or no completion service)</li>
 *   <li>{@code RULES_LLM_VALIDATED} - medium tier, rule verdicts reviewed by the completion service</li>
 *   <li>{@code RECONSTRUCTED} - rebuilt from the feature-centric view</li>
 * </ul>
 */
public enum DispatchPath {
    LLM,
    LLM_FALLBACK_TO_RULES,
    RULES,
    RULES_LLM_VALIDATED,
    RECONSTRUCTED
}
