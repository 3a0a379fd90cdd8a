package com.eainde.compliance.agent;

import com.eainde.compliance.model.FrameworkMetadata;
import com.eainde.compliance.model.Requirement;
import com.eainde.compliance.model.RequirementPlan;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the catalog requirements to evaluate.
 *
 * <p>Fails open: a failed call, an unparseable response or an empty selection
 * yields a plan covering the whole catalog. The returned plan is NOT filtered
 * against the catalog; the orchestrator owns that step.</p>
 */
@Slf4j
public class RequirementPlanner {

    public static final String AGENT_NAME = "planner_agent";

    private final PlannerAgent agent;
    private final ObjectMapper objectMapper;

    public RequirementPlanner(PlannerAgent agent, ObjectMapper objectMapper) {
        this.agent = agent;
        this.objectMapper = objectMapper;
    }

    public RequirementPlan plan(FrameworkMetadata framework, List<Requirement> catalog) {
        String listing = catalog.stream()
                .map(r -> "- " + r.requirementId() + ": " + r.title())
                .collect(Collectors.joining("\n"));
        String frameworkName = framework != null
                ? framework.name() + " " + framework.version()
                : "regulatory";

        try {
            String response = agent.plan(frameworkName, listing);
            JsonNode node = AgentResponses.readObject(objectMapper, response);

            List<String> ids = new ArrayList<>();
            JsonNode array = node.get("requirement_ids");
            if (array != null && array.isArray()) {
                array.forEach(id -> {
                    if (id.isTextual() && !id.asText().isBlank()) ids.add(id.asText().strip());
                });
            }
            if (ids.isEmpty()) {
                log.warn("Planner selected no requirements, evaluating the whole catalog");
                return RequirementPlan.entireCatalog(catalog,
                        "Fallback: planner selected no requirements");
            }

            RequirementPlan plan = new RequirementPlan(ids, AgentResponses.text(node, "reasoning"), false);
            log.info("Planner selected {} of {} requirements", plan.requirementIds().size(), catalog.size());
            return plan;

        } catch (Exception e) {
            log.warn("Planner agent failed, evaluating the whole catalog: {}", AgentResponses.describe(e));
            return RequirementPlan.entireCatalog(catalog,
                    "Fallback: evaluating all requirements due to planner error");
        }
    }
}
