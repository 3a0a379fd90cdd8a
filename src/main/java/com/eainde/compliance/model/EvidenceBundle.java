package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ranked evidence retrieved for one requirement. An empty bundle is a valid
 * result meaning the document does not address the requirement.
 */
public record EvidenceBundle(
        @JsonProperty("requirement_id") String requirementId,
        @JsonProperty("segments")       List<EvidenceSegment> segments
) {

    public EvidenceBundle {
        segments = segments != null ? List.copyOf(segments) : List.of();
    }

    public static EvidenceBundle empty(String requirementId) {
        return new EvidenceBundle(requirementId, List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }
}
