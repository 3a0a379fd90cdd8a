package com.eainde.compliance.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the pipeline agents on one chat model.
 *
 * Centralizes agent construction in one place:
 *   - binds each prompt interface to the chat model through {@link AiServices}
 *   - wraps it in the component that parses its output and applies its failure policy
 *
 * Usage in config:
 *   RequirementPlanner planner   = agentFactory.planner();
 *   ComplianceAssessor assessor  = agentFactory.assessor();
 *   AssessmentVerifier verifier  = agentFactory.verifier();
 */
public class ComplianceAgentFactory {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAgentFactory.class);

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public ComplianceAgentFactory(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    public RequirementPlanner planner() {
        return new RequirementPlanner(create(PlannerAgent.class), objectMapper);
    }

    public ComplianceAssessor assessor() {
        return new ComplianceAssessor(create(AssessorAgent.class), objectMapper);
    }

    public AssessmentVerifier verifier() {
        return new AssessmentVerifier(create(VerifierAgent.class), objectMapper);
    }

    private <T> T create(Class<T> agentType) {
        log.debug("Building agent: {}", agentType.getSimpleName());
        return AiServices.builder(agentType)
                .chatModel(chatModel)
                .build();
    }
}
