package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verifier output. The verified values never exceed the original ones.
 */
public record VerifiedAssessment(
        @JsonProperty("requirement_id")      String requirementId,
        @JsonProperty("original_status")     ComplianceStatus originalStatus,
        @JsonProperty("verified_status")     ComplianceStatus verifiedStatus,
        @JsonProperty("original_confidence") double originalConfidence,
        @JsonProperty("verified_confidence") double verifiedConfidence,
        @JsonProperty("verification_notes")  String verificationNotes,
        @JsonProperty("approved")            boolean approved
) {

    /**
     * Approves the assessment unchanged. Used when verification is skipped or fails.
     */
    public static VerifiedAssessment approvedAsIs(Assessment assessment, String notes) {
        return new VerifiedAssessment(
                assessment.requirementId(),
                assessment.status(),
                assessment.status(),
                assessment.confidence(),
                assessment.confidence(),
                notes,
                true);
    }

    public boolean wasDowngraded() {
        return verifiedStatus != originalStatus || verifiedConfidence < originalConfidence;
    }

    /**
     * @return true if the verified values must replace the original assessment's values
     */
    public boolean overridesOriginal() {
        return !approved || wasDowngraded();
    }

    /** Applies this verification to the assessment it was produced for. */
    public Assessment applyTo(Assessment assessment) {
        if (!overridesOriginal()) {
            return assessment;
        }
        return assessment.withVerification(verifiedStatus, verifiedConfidence);
    }
}
