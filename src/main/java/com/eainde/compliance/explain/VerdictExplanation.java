package com.eainde.compliance.explain;

import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.Verdict;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Why an audit received its verdict.
 *
 * @param statusBreakdown number of requirements per status, in status declaration order
 */
public record VerdictExplanation(
        @JsonProperty("final_verdict")      Verdict finalVerdict,
        @JsonProperty("reason")             String reason,
        @JsonProperty("status_breakdown")   Map<ComplianceStatus, Integer> statusBreakdown,
        @JsonProperty("total_requirements") int totalRequirements
) {}
