package com.eainde.compliance.strategy;

import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.JurisdictionProfile;

import java.util.List;

/**
 * A procedure that produces one verdict per feature for a single jurisdiction.
 * Implementations report service problems through {@link StrategyOutcome}, not exceptions.
 */
public interface ComplianceClassifier {

    StrategyOutcome classify(List<Feature> features, JurisdictionProfile jurisdiction);
}
