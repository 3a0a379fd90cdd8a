package com.eainde.compliance.explain;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.Verdict;
import com.eainde.compliance.trace.ExecutionTrace;
import com.eainde.compliance.trace.RequirementEvaluationTrace;
import com.eainde.compliance.verdict.VerdictAggregator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only helpers explaining how a verdict came about. Never changes a result.
 */
public class VerdictExplainer {

    public VerdictExplanation explainVerdict(List<Assessment> assessments) {
        Map<ComplianceStatus, Integer> counts = new EnumMap<>(ComplianceStatus.class);
        for (Assessment assessment : assessments) {
            counts.merge(assessment.status(), 1, Integer::sum);
        }

        Verdict verdict = VerdictAggregator.aggregateAssessments(assessments);
        String reason = switch (verdict) {
            case RED -> "At least one requirement is non-compliant";
            case YELLOW -> assessments.isEmpty()
                    ? "No requirements were evaluated"
                    : "Some requirements are partially compliant or unknown";
            case GREEN -> "All requirements are compliant";
        };

        return new VerdictExplanation(verdict, reason, Collections.unmodifiableMap(counts), assessments.size());
    }

    /** NON_COMPLIANT and PARTIAL assessments, in input order. */
    public List<Assessment> failedRequirements(List<Assessment> assessments) {
        return assessments.stream()
                .filter(a -> a.status() == ComplianceStatus.NON_COMPLIANT || a.status() == ComplianceStatus.PARTIAL)
                .toList();
    }

    public Optional<RequirementEvaluationTrace> evidenceChain(String requirementId, ExecutionTrace trace) {
        if (trace == null) {
            return Optional.empty();
        }
        return trace.requirementEvaluations().stream()
                .filter(t -> t.requirementId().equals(requirementId))
                .findFirst();
    }
}
