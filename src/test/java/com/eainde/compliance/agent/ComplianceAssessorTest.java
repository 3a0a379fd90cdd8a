package com.eainde.compliance.agent;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.EvidenceSegment;
import com.eainde.compliance.model.Requirement;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComplianceAssessorTest {

    private static final Requirement CONSENT = new Requirement("REQ-001", "Explicit consent",
            "Personal data shall be processed only with consent.", "Section 6", null);

    private static final EvidenceBundle EVIDENCE = new EvidenceBundle("REQ-001", List.of(
            new EvidenceSegment("We collect your   data without consent\nfor marketing.", List.of(3), null, 1.2, "lexical"),
            new EvidenceSegment("You may contact our grievance officer.", List.of(5), null, 0.4, "lexical")));

    @Mock private AssessorAgent agent;

    private ComplianceAssessor assessor;

    @BeforeEach
    void setUp() {
        assessor = new ComplianceAssessor(agent, new ObjectMapper());
    }

    private void respond(String json) {
        when(agent.assess(anyString(), anyString(), anyString())).thenReturn(json);
    }

    @Nested
    @DisplayName("Empty evidence")
    class EmptyEvidence {

        @Test
        @DisplayName("should return UNKNOWN with zero confidence without calling the model")
        void shortCircuits() {
            Assessment result = assessor.assess(CONSENT, EvidenceBundle.empty("REQ-001"));

            assertThat(result.status()).isEqualTo(ComplianceStatus.UNKNOWN);
            assertThat(result.confidence()).isLessThan(0.5);
            verifyNoInteractions(agent);
        }
    }

    @Nested
    @DisplayName("Citation enforcement")
    class Citation {

        @Test
        @DisplayName("should accept a verbatim quote, ignoring whitespace and case")
        void acceptsVerbatimQuote() {
            respond("""
                    {"requirement_id": "REQ-001", "status": "NON_COMPLIANT", "confidence": 0.85,
                     "evidence_quote": "we collect your data without consent",
                     "reasoning": "Data is collected without consent.", "page_numbers": []}
                    """);

            Assessment result = assessor.assess(CONSENT, EVIDENCE);

            assertThat(result.status()).isEqualTo(ComplianceStatus.NON_COMPLIANT);
            assertThat(result.confidence()).isEqualTo(0.85);
            assertThat(result.pageNumbers()).containsExactly(3);
        }

        @Test
        @DisplayName("should downgrade a claim without a quote to UNKNOWN")
        void missingQuote() {
            respond("""
                    {"status": "COMPLIANT", "confidence": 0.9, "evidence_quote": null, "reasoning": "Looks fine"}
                    """);

            Assessment result = assessor.assess(CONSENT, EVIDENCE);

            assertThat(result.status()).isEqualTo(ComplianceStatus.UNKNOWN);
            assertThat(result.confidence()).isLessThanOrEqualTo(0.3);
            assertThat(result.reasoning()).contains("Downgraded to UNKNOWN");
        }

        @Test
        @DisplayName("should downgrade a quote that is not in the evidence")
        void fabricatedQuote() {
            respond("""
                    {"status": "COMPLIANT", "confidence": 0.95,
                     "evidence_quote": "We always obtain explicit consent", "reasoning": "Stated"}
                    """);

            Assessment result = assessor.assess(CONSENT, EVIDENCE);

            assertThat(result.status()).isEqualTo(ComplianceStatus.UNKNOWN);
            assertThat(result.confidence()).isLessThanOrEqualTo(0.3);
        }

        @Test
        @DisplayName("should force the evaluated requirement id and clamp confidence")
        void forcesIdAndClamps() {
            respond("""
                    {"requirement_id": "REQ-999", "status": "PARTIAL", "confidence": 4.2,
                     "evidence_quote": "contact our grievance officer", "reasoning": "vague", "page_numbers": [5]}
                    """);

            Assessment result = assessor.assess(CONSENT, EVIDENCE);

            assertThat(result.requirementId()).isEqualTo("REQ-001");
            assertThat(result.confidence()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Failure policy")
    class Failures {

        @Test
        @DisplayName("should return UNKNOWN 0.0 naming the error when the call fails")
        void callFailure() {
            when(agent.assess(anyString(), anyString(), anyString())).thenThrow(new RuntimeException("rate limited"));

            Assessment result = assessor.assess(CONSENT, EVIDENCE);

            assertThat(result.status()).isEqualTo(ComplianceStatus.UNKNOWN);
            assertThat(result.confidence()).isZero();
            assertThat(result.reasoning()).contains("rate limited");
        }

        @Test
        @DisplayName("should return UNKNOWN 0.0 on an unknown status")
        void badStatus() {
            respond("{\"status\": \"MOSTLY_FINE\", \"confidence\": 0.7}");

            Assessment result = assessor.assess(CONSENT, EVIDENCE);

            assertThat(result.status()).isEqualTo(ComplianceStatus.UNKNOWN);
            assertThat(result.confidence()).isZero();
        }
    }
}
