package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A product feature produced by the upstream extraction step. Immutable for a run.
 *
 * @param id                       unique feature id
 * @param name                     short feature name
 * @param description              feature description
 * @param content                  free-text body of the feature
 * @param dataTypes                declared data-type tags (e.g. "biometric_data", "location")
 * @param technicalRequirements    free-text technical requirements
 * @param complianceConsiderations free-text compliance notes
 */
public record Feature(
        @JsonProperty("feature_id")                String id,
        @JsonProperty("feature_name")              String name,
        @JsonProperty("feature_description")       String description,
        @JsonProperty("feature_content")           String content,
        @JsonProperty("data_types")                List<String> dataTypes,
        @JsonProperty("technical_requirements")    List<String> technicalRequirements,
        @JsonProperty("compliance_considerations") String complianceConsiderations
) {

    public Feature {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Feature id must not be blank");
        }
        name = name != null ? name : id;
        description = description != null ? description : "";
        content = content != null ? content : "";
        dataTypes = dataTypes != null ? List.copyOf(dataTypes) : List.of();
        technicalRequirements = technicalRequirements != null ? List.copyOf(technicalRequirements) : List.of();
        complianceConsiderations = complianceConsiderations != null ? complianceConsiderations : "";
    }

    /**
     * Convenience for callers that only know name, description and tags.
     */
    public static Feature of(String id, String name, String description, List<String> dataTypes) {
        return new Feature(id, name, description, "", dataTypes, List.of(), "");
    }

    /** Name and description joined, the text keyword rules search in. */
    public String searchableText() {
        return name + " " + description;
    }
}
