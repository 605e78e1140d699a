package com.eainde.compliance.model;

/**
 * Which strategy produced a verdict.
 */
public enum VerdictSource {
    RULE_BASED,
    LLM_BATCH,
    LLM_VALIDATED
}
