package com.eainde.compliance.verdict;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.Verdict;

import java.util.Collection;

/**
 * Deterministic reduction of per-requirement statuses into an overall verdict.
 *
 * <pre>
 * any NON_COMPLIANT              → RED
 * else any PARTIAL or UNKNOWN    → YELLOW
 * else all COMPLIANT (non-empty) → GREEN
 * empty                          → YELLOW
 * </pre>
 */
public final class VerdictAggregator {

    private VerdictAggregator() {
    }

    public static Verdict aggregate(Collection<ComplianceStatus> statuses) {
        if (statuses.isEmpty()) {
            return Verdict.YELLOW;
        }
        if (statuses.contains(ComplianceStatus.NON_COMPLIANT)) {
            return Verdict.RED;
        }
        if (statuses.contains(ComplianceStatus.PARTIAL) || statuses.contains(ComplianceStatus.UNKNOWN)) {
            return Verdict.YELLOW;
        }
        return Verdict.GREEN;
    }

    public static Verdict aggregateAssessments(Collection<Assessment> assessments) {
        return aggregate(assessments.stream().map(Assessment::status).toList());
    }
}
