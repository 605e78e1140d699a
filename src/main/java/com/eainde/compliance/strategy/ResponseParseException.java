package com.eainde.compliance.strategy;

/**
 * A completion payload could not be turned into verdict records, even after
 * sanitizing and balanced-brace extraction.
 */
public class ResponseParseException extends Exception {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
