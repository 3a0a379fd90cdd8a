package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the regulatory framework an audit is evaluated against.
 *
 * @param name          framework name (e.g. "DPDP Act")
 * @param version       framework version
 * @param effectiveDate ISO-8601 date the framework took effect
 * @param description   optional free text
 */
public record FrameworkMetadata(
        @JsonProperty("name")           String name,
        @JsonProperty("version")        String version,
        @JsonProperty("effective_date") String effectiveDate,
        @JsonProperty("description")    String description
) {}
