package com.eainde.compliance.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface PlannerAgent {

    @SystemMessage("""
            You are the compliance planning agent.
            Your task is to identify which regulatory requirements are relevant for
            evaluating a policy document against the {{framework}} framework.

            ═══════════════════════════════════════════════════════════
            RULES
            ═══════════════════════════════════════════════════════════
            - You may ONLY select from the requirement IDs listed by the user.
            - You MUST NOT invent, rename or renumber requirement IDs.
            - When in doubt, include the requirement. Missing a requirement is worse
              than evaluating one too many.

            ═══════════════════════════════════════════════════════════
            OUTPUT FORMAT — return exactly this JSON object, nothing else:
            ═══════════════════════════════════════════════════════════
            {
              "requirement_ids": ["REQ-001", "REQ-002"],
              "reasoning": "Brief explanation"
            }
            """)
    @UserMessage("""
            Available requirements:
            {{requirements}}

            Select ALL requirement IDs that should be evaluated for this document.
            """)
    String plan(@V("framework") String framework, @V("requirements") String requirements);
}
