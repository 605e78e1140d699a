package com.eainde.compliance.jurisdiction;

import com.eainde.compliance.model.EnforcementStrength;
import com.eainde.compliance.model.JurisdictionProfile;
import com.eainde.compliance.model.RiskTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of jurisdiction regulation profiles, keyed by upper-case code.
 *
 * <p>Loaded once through a {@link JurisdictionLoader}; every query afterwards is a pure
 * lookup with no I/O and no locking, so one instance is shared by all batch workers.
 * Unknown codes yield empty results and never throw.</p>
 */
public class JurisdictionReferenceStore {

    private static final Logger log = LoggerFactory.getLogger(JurisdictionReferenceStore.class);

    private final Map<String, JurisdictionProfile> profiles;

    public JurisdictionReferenceStore(JurisdictionLoader loader) {
        List<JurisdictionProfile> loaded = loader.load();
        if (loaded == null) {
            throw new JurisdictionLoadException("Jurisdiction loader returned null");
        }

        Map<String, JurisdictionProfile> byCode = new LinkedHashMap<>();
        for (JurisdictionProfile profile : loaded) {
            String code = profile.code();
            if (code == null || code.isBlank() || !code.equals(code.toUpperCase(Locale.ROOT))) {
                throw new JurisdictionLoadException("Jurisdiction code must be upper-case: '" + code + "'");
            }
            if (profile.riskTier() == null || profile.enforcement() == null) {
                throw new JurisdictionLoadException("Jurisdiction " + code + " is missing tier or enforcement");
            }
            if (byCode.putIfAbsent(code, profile) != null) {
                throw new JurisdictionLoadException("Duplicate jurisdiction code: " + code);
            }
        }
        this.profiles = Collections.unmodifiableMap(byCode);
        log.info("Jurisdiction reference store ready: {} jurisdictions", profiles.size());
    }

    // =========================================================================
    //  Lookups
    // =========================================================================

    public Optional<JurisdictionProfile> get(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(profiles.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    /** All codes in table order. */
    public Set<String> allCodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(profiles.keySet()));
    }

    public List<String> byTier(RiskTier tier) {
        return profiles.values().stream()
                .filter(p -> p.riskTier() == tier)
                .map(JurisdictionProfile::code)
                .toList();
    }

    /**
     * Codes whose applicable regulations include {@code regulationName} (exact match).
     */
    public List<String> byRegulation(String regulationName) {
        if (regulationName == null) return List.of();
        return profiles.values().stream()
                .filter(p -> p.regulations().contains(regulationName))
                .map(JurisdictionProfile::code)
                .toList();
    }

    public List<String> byEnforcement(EnforcementStrength strength) {
        return profiles.values().stream()
                .filter(p -> p.enforcement() == strength)
                .map(JurisdictionProfile::code)
                .toList();
    }

    public int size() {
        return profiles.size();
    }

    // =========================================================================
    //  Export
    // =========================================================================

    /**
     * Writes the table in the same shape {@link ClasspathJurisdictionLoader} reads.
     */
    public void exportJson(ObjectMapper objectMapper, Writer writer) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("jurisdictions", objectMapper.valueToTree(List.copyOf(profiles.values())));
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, root);
    }
}
