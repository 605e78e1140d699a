package com.eainde.compliance.strategy;

import com.eainde.compliance.model.ComplianceVerdict;

import java.util.List;

/**
 * Result of running one classification strategy for one jurisdiction: either the
 * verdicts it produced, or the reason it could not produce them. The dispatcher
 * branches on {@link #isSuccess()} instead of catching exceptions.
 */
public final class StrategyOutcome {

    private final boolean success;
    private final List<ComplianceVerdict> verdicts;
    private final String failureReason;
    private final Throwable cause;

    private StrategyOutcome(boolean success, List<ComplianceVerdict> verdicts,
                            String failureReason, Throwable cause) {
        this.success = success;
        this.verdicts = verdicts;
        this.failureReason = failureReason;
        this.cause = cause;
    }

    public static StrategyOutcome success(List<ComplianceVerdict> verdicts) {
        return new StrategyOutcome(true, List.copyOf(verdicts), null, null);
    }

    public static StrategyOutcome failure(String reason) {
        return new StrategyOutcome(false, List.of(), reason, null);
    }

    public static StrategyOutcome failure(String reason, Throwable cause) {
        return new StrategyOutcome(false, List.of(), reason, cause);
    }

    public boolean isSuccess() {
        return success;
    }

    public List<ComplianceVerdict> getVerdicts() {
        return verdicts;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return success
                ? "StrategyOutcome[success, " + verdicts.size() + " verdicts]"
                : "StrategyOutcome[failure: " + failureReason + "]";
    }
}
