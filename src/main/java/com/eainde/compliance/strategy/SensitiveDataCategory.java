package com.eainde.compliance.strategy;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Sensitive data categories recognised in a feature's declared data-type tags.
 * Each matched category adds {@link #RISK_WEIGHT} to the rule-based risk score.
 *
 * <p>PII is declared last so that tags like "personal_health" resolve to the more
 * specific category.</p>
 */
public enum SensitiveDataCategory {

    BIOMETRIC("Biometric data",
            "is immutable and most regimes require explicit written consent before collection",
            List.of("biometric", "fingerprint", "facial", "voiceprint"),
            List.of("Obtain explicit consent for biometric processing",
                    "Publish a biometric retention and destruction schedule")),

    HEALTH("Health data",
            "is a sensitive category requiring opt-in consent and heightened safeguards",
            List.of("health", "medical", "wellness"),
            List.of("Obtain opt-in consent before collecting health data",
                    "Restrict access to health data to authorized personnel")),

    FINANCIAL("Financial data",
            "exposes users to fraud and falls under payment-card and financial privacy rules",
            List.of("financial", "payment", "credit", "bank"),
            List.of("Implement PCI-DSS-aligned encryption for financial data",
                    "Tokenize stored payment credentials")),

    LOCATION("Location data",
            "precise geolocation is sensitive data and geofencing is restricted in some states",
            List.of("location", "geolocation", "gps", "geo"),
            List.of("Obtain consent before collecting precise geolocation",
                    "Reduce location precision where exact coordinates are not needed")),

    BEHAVIORAL("Behavioral data",
            "profiling and targeted advertising trigger opt-out rights",
            List.of("behavioral", "behavioural", "behavior", "browsing", "tracking"),
            List.of("Provide an opt-out of profiling and targeted advertising",
                    "Document the purposes of behavioral profiling")),

    PII("Personally identifiable information",
            "identifies individuals directly and triggers notice, access and breach obligations",
            List.of("pii", "personal", "identifiable", "contact", "email", "phone"),
            List.of("Encrypt personal data at rest and in transit",
                    "Maintain an inventory of personal data fields"));

    public static final double RISK_WEIGHT = 0.2;

    private final String label;
    private final String rationale;
    private final List<String> tagMarkers;
    private final List<String> remediationActions;

    SensitiveDataCategory(String label, String rationale,
                          List<String> tagMarkers, List<String> remediationActions) {
        this.label = label;
        this.rationale = rationale;
        this.tagMarkers = tagMarkers;
        this.remediationActions = remediationActions;
    }

    /**
     * Maps a declared tag such as "biometric_data" to its category, if any.
     */
    public static Optional<SensitiveDataCategory> fromTag(String tag) {
        if (tag == null || tag.isBlank()) return Optional.empty();
        String normalized = tag.toLowerCase(Locale.ROOT);
        for (SensitiveDataCategory category : values()) {
            for (String marker : category.tagMarkers) {
                if (normalized.contains(marker)) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }

    public String label() {
        return label;
    }

    /** Human-readable note naming the category and why it matters. */
    public String note() {
        return label + " detected: " + rationale + ".";
    }

    public List<String> remediationActions() {
        return remediationActions;
    }
}
