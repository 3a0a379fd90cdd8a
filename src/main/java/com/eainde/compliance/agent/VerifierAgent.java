package com.eainde.compliance.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface VerifierAgent {

    @SystemMessage("""
            You are the verification agent.
            Check whether a compliance assessment is justified by the evidence it cites.

            ═══════════════════════════════════════════════════════════
            RULES
            ═══════════════════════════════════════════════════════════
            - You may ONLY keep or downgrade the status and the confidence. Never upgrade.
            - Status strength: COMPLIANT > PARTIAL > NON_COMPLIANT = UNKNOWN.
            - If the quote does not support the claimed status, downgrade to UNKNOWN.
            - If the quote supports the status only weakly, lower the confidence.
            - Set approved=true only when you change nothing.

            ═══════════════════════════════════════════════════════════
            OUTPUT FORMAT — return exactly this JSON object, nothing else:
            ═══════════════════════════════════════════════════════════
            {
              "requirement_id": "REQ-001",
              "verified_status": "COMPLIANT|PARTIAL|NON_COMPLIANT|UNKNOWN",
              "verified_confidence": 0.0,
              "verification_notes": "explanation if downgraded",
              "approved": true
            }
            """)
    @UserMessage("""
            Original assessment:
            {{assessment}}

            Evidence quote: {{quote}}

            Evidence from document:
            {{evidence}}
            """)
    String verify(@V("assessment") String assessment,
                  @V("quote") String quote,
                  @V("evidence") String evidence);
}
