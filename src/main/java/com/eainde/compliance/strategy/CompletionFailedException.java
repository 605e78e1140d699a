package com.eainde.compliance.strategy;

/**
 * The completion service returned nothing usable: empty payload, timeout,
 * interruption or transport error. Never escapes a strategy.
 */
public class CompletionFailedException extends RuntimeException {

    public CompletionFailedException(String message) {
        super(message);
    }

    public CompletionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
