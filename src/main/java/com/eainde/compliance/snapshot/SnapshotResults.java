package com.eainde.compliance.snapshot;

import com.eainde.compliance.model.Verdict;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SnapshotResults(
        @JsonProperty("overall_verdict") Verdict overallVerdict,
        @JsonProperty("requirements")    List<FrozenRequirement> requirements
) {

    public SnapshotResults {
        requirements = requirements != null ? List.copyOf(requirements) : List.of();
    }
}
