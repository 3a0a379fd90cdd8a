package com.eainde.compliance.trace;

import com.eainde.compliance.model.ComplianceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one requirement's retrieve, assess and verify chain.
 */
public record RequirementEvaluationTrace(
        @JsonProperty("requirement_id")        String requirementId,
        @JsonProperty("evidence_chunks")       int evidenceChunks,
        @JsonProperty("assessment_status")     ComplianceStatus assessmentStatus,
        @JsonProperty("assessment_confidence") double assessmentConfidence,
        @JsonProperty("verified_status")       ComplianceStatus verifiedStatus,
        @JsonProperty("verified_confidence")   double verifiedConfidence,
        @JsonProperty("was_downgraded")        boolean wasDowngraded
) {}
