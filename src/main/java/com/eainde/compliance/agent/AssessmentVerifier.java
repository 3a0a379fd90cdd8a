package com.eainde.compliance.agent;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.VerifiedAssessment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Independent second look at an assessment. Can hold or downgrade, never upgrade.
 *
 * <p>Original status and confidence always come from the assessment, never from the
 * model. A verified confidence above the original is clamped; a verified status
 * stronger than the original is reset. Either correction sets {@code approved=false}.
 * A failed call approves the assessment unchanged.</p>
 */
@Slf4j
public class AssessmentVerifier {

    public static final String AGENT_NAME = "verifier_agent";

    private final VerifierAgent agent;
    private final ObjectMapper objectMapper;

    public AssessmentVerifier(VerifierAgent agent, ObjectMapper objectMapper) {
        this.agent = agent;
        this.objectMapper = objectMapper;
    }

    public VerifiedAssessment verify(Assessment assessment, EvidenceBundle evidence) {
        try {
            String response = agent.verify(
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(assessment),
                    assessment.hasQuote() ? assessment.evidenceQuote() : "null",
                    AgentResponses.formatEvidence(evidence));
            JsonNode node = AgentResponses.readObject(objectMapper, response);

            String statusText = AgentResponses.text(node, "verified_status");
            ComplianceStatus proposedStatus = statusText != null
                    ? ComplianceStatus.parse(statusText)
                    : assessment.status();
            JsonNode confidenceNode = node.get("verified_confidence");
            double proposedConfidence = confidenceNode != null && confidenceNode.isNumber()
                    ? confidenceNode.asDouble()
                    : assessment.confidence();
            JsonNode approvedNode = node.get("approved");
            boolean approved = approvedNode == null || approvedNode.asBoolean(true);
            String notes = AgentResponses.text(node, "verification_notes");

            return enforceMonotonic(assessment, proposedStatus, proposedConfidence, approved, notes);

        } catch (Exception e) {
            log.warn("Verifier agent failed for {}, approving as-is: {}",
                    assessment.requirementId(), AgentResponses.describe(e));
            return VerifiedAssessment.approvedAsIs(assessment,
                    "Verification skipped due to error: " + AgentResponses.describe(e));
        }
    }

    static VerifiedAssessment enforceMonotonic(Assessment assessment,
                                               ComplianceStatus proposedStatus,
                                               double proposedConfidence,
                                               boolean approved,
                                               String notes) {
        List<String> corrections = new ArrayList<>();

        ComplianceStatus verifiedStatus = proposedStatus;
        if (proposedStatus.isUpgradeFrom(assessment.status())) {
            corrections.add("upgrade from " + assessment.status() + " to " + proposedStatus + " rejected");
            verifiedStatus = assessment.status();
        }

        double verifiedConfidence = Double.isNaN(proposedConfidence) ? 0.0 : Math.max(0.0, proposedConfidence);
        if (verifiedConfidence > assessment.confidence()) {
            corrections.add("confidence " + proposedConfidence + " clamped to " + assessment.confidence());
            verifiedConfidence = assessment.confidence();
        }

        String verificationNotes = notes != null ? notes : "";
        if (!corrections.isEmpty()) {
            log.warn("{}: verifier output corrected ({})", assessment.requirementId(), String.join("; ", corrections));
            verificationNotes = (verificationNotes.isBlank() ? "" : verificationNotes + " ")
                    + "[Corrected: " + String.join("; ", corrections) + "]";
            approved = false;
        }

        return new VerifiedAssessment(
                assessment.requirementId(),
                assessment.status(),
                verifiedStatus,
                assessment.confidence(),
                verifiedConfidence,
                verificationNotes,
                approved);
    }
}
