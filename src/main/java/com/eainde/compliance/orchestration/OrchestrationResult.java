package com.eainde.compliance.orchestration;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.Verdict;
import com.eainde.compliance.snapshot.Snapshot;
import com.eainde.compliance.verdict.VerdictAggregator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Final, immutable output of one audit run.
 *
 * @param assessments final assessments in plan order
 */
public record OrchestrationResult(
        @JsonProperty("audit_id")        String auditId,
        @JsonProperty("assessments")     List<Assessment> assessments,
        @JsonProperty("overall_verdict") Verdict overallVerdict,
        @JsonProperty("metadata")        ExecutionMetadata metadata,
        @JsonProperty("snapshot")        Snapshot snapshot
) {

    public OrchestrationResult {
        assessments = assessments != null ? List.copyOf(assessments) : List.of();
    }

    /** Re-derives the verdict from the stored statuses. */
    public Verdict recomputeVerdict() {
        return VerdictAggregator.aggregateAssessments(assessments);
    }

    public Optional<Assessment> assessment(String requirementId) {
        return assessments.stream()
                .filter(a -> a.requirementId().equals(requirementId))
                .findFirst();
    }
}
