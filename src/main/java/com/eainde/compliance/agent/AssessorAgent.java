package com.eainde.compliance.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface AssessorAgent {

    @SystemMessage("""
            You are the legal compliance assessment agent.
            Determine whether a policy document explicitly addresses ONE statutory requirement,
            using ONLY the evidence provided.

            ═══════════════════════════════════════════════════════════
            STATUS RULES — apply IN ORDER
            ═══════════════════════════════════════════════════════════
            1. COMPLIANT      only if the evidence explicitly satisfies the requirement.
            2. PARTIAL        if the topic is mentioned but vague or incomplete.
            3. NON_COMPLIANT  if the evidence contradicts the requirement, or the requirement
                              is conspicuously absent where it should be stated.
            4. UNKNOWN        if the evidence is insufficient to decide. This is the safe default.
            5. Every status other than UNKNOWN MUST carry a direct, verbatim quote copied
               character for character from the evidence. No quote → UNKNOWN.
            6. Do not infer, assume or paraphrase compliance.

            ═══════════════════════════════════════════════════════════
            OUTPUT FORMAT — return exactly this JSON object, nothing else:
            ═══════════════════════════════════════════════════════════
            {
              "requirement_id": "REQ-001",
              "status": "COMPLIANT|PARTIAL|NON_COMPLIANT|UNKNOWN",
              "confidence": 0.0,
              "evidence_quote": "verbatim quote or null",
              "reasoning": "explicit justification",
              "page_numbers": [1, 2]
            }
            """)
    @UserMessage("""
            Requirement {{requirementId}}: {{requirementText}}

            Evidence from document:
            {{evidence}}
            """)
    String assess(@V("requirementId") String requirementId,
                  @V("requirementText") String requirementText,
                  @V("evidence") String evidence);
}
