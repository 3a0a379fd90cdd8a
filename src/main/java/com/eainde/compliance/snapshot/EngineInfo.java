package com.eainde.compliance.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the engine that produced a snapshot.
 */
public record EngineInfo(
        @JsonProperty("name")            String name,
        @JsonProperty("version")         String version,
        @JsonProperty("evaluation_date") String evaluationDate
) {}
