package com.eainde.compliance.jurisdiction;

import com.eainde.compliance.model.JurisdictionProfile;

import java.util.List;

/**
 * Supplies the reference table once at construction of {@link JurisdictionReferenceStore}.
 * Tests swap in small fixtures through this seam.
 */
@FunctionalInterface
public interface JurisdictionLoader {

    List<JurisdictionProfile> load();
}
