package com.eainde.compliance.agent;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.EvidenceSegment;
import com.eainde.compliance.model.Requirement;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Judges one requirement against its evidence.
 *
 * <h3>Post-conditions, enforced after the model call:</h3>
 * <ul>
 *   <li>empty evidence → UNKNOWN, confidence 0.0, model not consulted</li>
 *   <li>non-UNKNOWN without a quote → UNKNOWN</li>
 *   <li>quote not found in the evidence (whitespace and case ignored) → UNKNOWN</li>
 *   <li>a result forced to UNKNOWN keeps confidence ≤ {@value #MAX_DOWNGRADED_CONFIDENCE}</li>
 *   <li>call or parse failure → UNKNOWN, confidence 0.0</li>
 * </ul>
 */
@Slf4j
public class ComplianceAssessor {

    public static final String AGENT_NAME = "reasoner_agent";
    static final double MAX_DOWNGRADED_CONFIDENCE = 0.3;

    private final AssessorAgent agent;
    private final ObjectMapper objectMapper;

    public ComplianceAssessor(AssessorAgent agent, ObjectMapper objectMapper) {
        this.agent = agent;
        this.objectMapper = objectMapper;
    }

    public Assessment assess(Requirement requirement, EvidenceBundle evidence) {
        String requirementId = requirement.requirementId();
        if (evidence.isEmpty()) {
            return Assessment.unknown(requirementId, "No evidence found in the document for this requirement.");
        }

        try {
            String response = agent.assess(requirementId, requirement.text(), AgentResponses.formatEvidence(evidence));
            JsonNode node = AgentResponses.readObject(objectMapper, response);

            ComplianceStatus status = ComplianceStatus.parse(AgentResponses.text(node, "status"));
            JsonNode confidenceNode = node.get("confidence");
            double confidence = confidenceNode != null && confidenceNode.isNumber() ? confidenceNode.asDouble() : 0.0;
            String quote = AgentResponses.text(node, "evidence_quote");
            String reasoning = Optional.ofNullable(AgentResponses.text(node, "reasoning")).orElse("");
            List<Integer> pages = AgentResponses.integers(node, "page_numbers");

            return enforceCitation(new Assessment(requirementId, status, confidence, quote, reasoning, pages), evidence);

        } catch (Exception e) {
            log.warn("Reasoner agent failed for {}: {}", requirementId, AgentResponses.describe(e));
            return Assessment.unknown(requirementId, "Assessment failed due to error: " + AgentResponses.describe(e));
        }
    }

    /**
     * Downgrades a claim that is not backed by a verbatim quote from the evidence.
     */
    Assessment enforceCitation(Assessment assessment, EvidenceBundle evidence) {
        if (assessment.status() == ComplianceStatus.UNKNOWN) {
            return assessment;
        }
        if (!assessment.hasQuote()) {
            log.warn("{}: {} claimed without a quote, downgrading to UNKNOWN",
                    assessment.requirementId(), assessment.status());
            return downgrade(assessment, "No verbatim quote was provided for status " + assessment.status() + ".");
        }

        Optional<EvidenceSegment> source = findQuoteSource(assessment.evidenceQuote(), evidence);
        if (source.isEmpty()) {
            log.warn("{}: quote not found in evidence, downgrading to UNKNOWN", assessment.requirementId());
            return downgrade(assessment, "The quoted text does not appear in the retrieved evidence.");
        }

        List<Integer> pages = assessment.pageNumbers().isEmpty() ? source.get().pages() : assessment.pageNumbers();
        return new Assessment(assessment.requirementId(), assessment.status(), assessment.confidence(),
                assessment.evidenceQuote(), assessment.reasoning(), pages);
    }

    static Optional<EvidenceSegment> findQuoteSource(String quote, EvidenceBundle evidence) {
        String needle = AgentResponses.normalize(quote);
        if (needle.isEmpty()) return Optional.empty();
        return evidence.segments().stream()
                .filter(s -> AgentResponses.normalize(s.text()).contains(needle))
                .findFirst();
    }

    private static Assessment downgrade(Assessment assessment, String why) {
        String reasoning = assessment.reasoning().isBlank()
                ? "Downgraded to UNKNOWN: " + why
                : assessment.reasoning() + " [Downgraded to UNKNOWN: " + why + "]";
        return new Assessment(
                assessment.requirementId(),
                ComplianceStatus.UNKNOWN,
                Math.min(assessment.confidence(), MAX_DOWNGRADED_CONFIDENCE),
                assessment.evidenceQuote(),
                reasoning,
                assessment.pageNumbers());
    }
}
