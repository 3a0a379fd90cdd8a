package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured compliance judgment for one requirement.
 *
 * <p>By convention an UNKNOWN assessment carries no quote and a low confidence.
 * That convention is not enforced here; the assessor enforces the stronger rule
 * that every non-UNKNOWN status carries a verbatim quote.</p>
 *
 * @param requirementId evaluated requirement
 * @param status        compliance status
 * @param confidence    confidence in [0.0, 1.0]
 * @param evidenceQuote verbatim quote from the document, may be null
 * @param reasoning     justification, never null
 * @param pageNumbers   pages the quote was found on
 */
public record Assessment(
        @JsonProperty("requirement_id") String requirementId,
        @JsonProperty("status")         ComplianceStatus status,
        @JsonProperty("confidence")     double confidence,
        @JsonProperty("evidence_quote") String evidenceQuote,
        @JsonProperty("reasoning")      String reasoning,
        @JsonProperty("page_numbers")   List<Integer> pageNumbers
) {

    public Assessment {
        if (status == null) status = ComplianceStatus.UNKNOWN;
        if (Double.isNaN(confidence) || confidence < 0.0) confidence = 0.0;
        if (confidence > 1.0) confidence = 1.0;
        if (reasoning == null) reasoning = "";
        pageNumbers = pageNumbers != null ? List.copyOf(pageNumbers) : List.of();
    }

    /**
     * UNKNOWN with zero confidence: the fail-safe result of a failed evaluation.
     */
    public static Assessment unknown(String requirementId, String reasoning) {
        return new Assessment(requirementId, ComplianceStatus.UNKNOWN, 0.0, null, reasoning, List.of());
    }

    public boolean hasQuote() {
        return evidenceQuote != null && !evidenceQuote.isBlank();
    }

    /**
     * Copy carrying the verifier's status and confidence as the assessment of record.
     */
    public Assessment withVerification(ComplianceStatus verifiedStatus, double verifiedConfidence) {
        return new Assessment(requirementId, verifiedStatus, verifiedConfidence,
                evidenceQuote, reasoning, pageNumbers);
    }
}
