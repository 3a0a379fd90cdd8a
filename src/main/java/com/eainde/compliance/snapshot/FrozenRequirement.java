package com.eainde.compliance.snapshot;

import com.eainde.compliance.model.ComplianceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final assessment of one requirement as frozen into a snapshot.
 *
 * @param evidenceHash SHA-256 hex of {@code evidenceQuote}, null when there is no quote
 */
public record FrozenRequirement(
        @JsonProperty("requirement_id") String requirementId,
        @JsonProperty("status")         ComplianceStatus status,
        @JsonProperty("confidence")     double confidence,
        @JsonProperty("reasoning")      String reasoning,
        @JsonProperty("evidence_quote") String evidenceQuote,
        @JsonProperty("evidence_hash")  String evidenceHash,
        @JsonProperty("page_numbers")   List<Integer> pageNumbers
) {

    public FrozenRequirement {
        pageNumbers = pageNumbers != null ? List.copyOf(pageNumbers) : List.of();
    }
}
