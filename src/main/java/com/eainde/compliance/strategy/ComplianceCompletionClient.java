package com.eainde.compliance.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the completion service with a hard per-call timeout.
 *
 * <p>Every call runs on {@code callExecutor} and is cancelled after {@code timeout}, which
 * interrupts the worker so the pool slot is released;
 * a timeout, an interruption, a transport error and an empty payload all surface as
 * {@link CompletionFailedException}, which the strategies turn into a failed outcome.</p>
 */
public class ComplianceCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(ComplianceCompletionClient.class);

    private final ComplianceAnalystAssistant assistant;
    private final ExecutorService callExecutor;
    private final Duration timeout;

    public ComplianceCompletionClient(ComplianceAnalystAssistant assistant,
                                      ExecutorService callExecutor,
                                      Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.assistant = assistant;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
    }

    /**
     * Batched analysis of every feature against one jurisdiction.
     */
    public String analyze(JurisdictionPrompt prompt) {
        return callWithTimeout(prompt.jurisdictionCode(), "analysis", () -> assistant.analyzeJurisdiction(
                String.valueOf(prompt.featureCount()),
                prompt.jurisdictionName(),
                prompt.jurisdictionCode(),
                prompt.jurisdictionContext(),
                prompt.featuresJson()));
    }

    /**
     * Review of existing rule-based verdicts for one jurisdiction.
     */
    public String review(JurisdictionPrompt prompt, String verdictsJson) {
        return callWithTimeout(prompt.jurisdictionCode(), "review", () -> assistant.reviewVerdicts(
                prompt.jurisdictionName(),
                prompt.jurisdictionCode(),
                prompt.jurisdictionContext(),
                prompt.featuresJson(),
                verdictsJson));
    }

    public Duration getTimeout() {
        return timeout;
    }

    private String callWithTimeout(String jurisdictionCode, String callKind, Callable<String> call) {
        long start = System.currentTimeMillis();
        Future<String> future = callExecutor.submit(call);
        String response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CompletionFailedException(
                    callKind + " call for " + jurisdictionCode + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompletionFailedException(callKind + " call for " + jurisdictionCode + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CompletionFailedException(
                    callKind + " call for " + jurisdictionCode + " failed: " + cause.getMessage(), cause);
        }

        if (response == null || response.isBlank()) {
            throw new CompletionFailedException(callKind + " call for " + jurisdictionCode + " returned an empty payload");
        }

        log.debug("{} call for {} returned {} chars in {}ms",
                callKind, jurisdictionCode, response.length(), System.currentTimeMillis() - start);
        return response;
    }
}
