package com.eainde.compliance.jurisdiction;

/**
 * The reference table could not be read or violates its invariants. Raised at startup only.
 */
public class JurisdictionLoadException extends RuntimeException {

    public JurisdictionLoadException(String message) {
        super(message);
    }

    public JurisdictionLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
