package com.eainde.compliance.jurisdiction;

import com.eainde.compliance.model.JurisdictionProfile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the jurisdiction table from a classpath JSON resource.
 *
 * <pre>
 * {
 *   "jurisdictions": [
 *     { "code": "CA", "name": "California", "regulations": [...], "risk_tier": "high",
 *       "enforcement": "strict", "required_practices": [...], "penalties": [...],
 *       "effective_date": "2020-01-01", "notes": "..." }
 *   ]
 * }
 * </pre>
 */
public class ClasspathJurisdictionLoader implements JurisdictionLoader {

    private static final Logger log = LoggerFactory.getLogger(ClasspathJurisdictionLoader.class);

    public static final String DEFAULT_RESOURCE = "jurisdictions/us-states.json";

    private final ObjectMapper objectMapper;
    private final String resource;

    public ClasspathJurisdictionLoader(ObjectMapper objectMapper, String resource) {
        this.objectMapper = objectMapper;
        this.resource = resource != null && !resource.isBlank() ? resource : DEFAULT_RESOURCE;
    }

    @Override
    public List<JurisdictionProfile> load() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : ClasspathJurisdictionLoader.class.getClassLoader();

        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new JurisdictionLoadException("Jurisdiction resource not found: " + resource);
            }
            JsonNode root = objectMapper.readTree(in);
            JsonNode array = root.isArray() ? root : root.path("jurisdictions");
            if (!array.isArray()) {
                throw new JurisdictionLoadException(
                        "Jurisdiction resource " + resource + " has no 'jurisdictions' array");
            }

            List<JurisdictionProfile> profiles = new ArrayList<>();
            for (JsonNode node : (ArrayNode) array) {
                profiles.add(objectMapper.treeToValue(node, JurisdictionProfile.class));
            }
            log.info("Loaded {} jurisdiction profiles from {}", profiles.size(), resource);
            return profiles;

        } catch (IOException e) {
            throw new JurisdictionLoadException("Failed to read jurisdiction resource " + resource, e);
        }
    }
}
