package com.eainde.compliance.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword rules for the privacy practices a jurisdiction may require.
 *
 * <p>A required-practice string triggers a rule when it contains one of the rule's
 * {@code practiceMarkers}. The feature satisfies the rule when its name + description
 * contains at least one of the {@code evidenceTokens} (case-insensitive substring).</p>
 */
public enum PrivacyRequirement {

    CONSENT("consent management",
            List.of("consent"),
            List.of("consent", "opt-in", "permission")),

    DELETION("data deletion rights",
            List.of("deletion", "delete"),
            List.of("delete", "remove", "erase")),

    ACCESS("data access rights",
            List.of("access"),
            List.of("access", "view", "retrieve")),

    PORTABILITY("data portability",
            List.of("portability"),
            List.of("export", "download", "portability")),

    MINIMIZATION("data minimization",
            List.of("minimization", "minimisation"),
            List.of("minimal", "necessary", "limited")),

    PURPOSE_LIMITATION("purpose limitation controls",
            List.of("purpose"),
            List.of("purpose", "use"));

    private final String capability;
    private final List<String> practiceMarkers;
    private final List<String> evidenceTokens;

    PrivacyRequirement(String capability, List<String> practiceMarkers, List<String> evidenceTokens) {
        this.capability = capability;
        this.practiceMarkers = practiceMarkers;
        this.evidenceTokens = evidenceTokens;
    }

    /**
     * Rules triggered by one required-practice string. "Consumer rights (access, deletion,
     * portability)" triggers three.
     */
    public static List<PrivacyRequirement> triggeredBy(String requiredPractice) {
        List<PrivacyRequirement> triggered = new ArrayList<>();
        if (requiredPractice == null) return triggered;
        String practice = requiredPractice.toLowerCase(Locale.ROOT);
        for (PrivacyRequirement requirement : values()) {
            if (requirement.practiceMarkers.stream().anyMatch(practice::contains)) {
                triggered.add(requirement);
            }
        }
        return triggered;
    }

    public boolean isSatisfiedBy(String featureText) {
        if (featureText == null) return false;
        String text = featureText.toLowerCase(Locale.ROOT);
        return evidenceTokens.stream().anyMatch(text::contains);
    }

    public String capability() {
        return capability;
    }

    public String remediationAction() {
        return "Implement " + capability;
    }

    public List<String> evidenceTokens() {
        return evidenceTokens;
    }
}
