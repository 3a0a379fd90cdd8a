package com.eainde.compliance.trace;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Immutable view of everything the tracer recorded for one pipeline run.
 *
 * @param agentExecutions        agent invocations grouped by agent name
 * @param requirementEvaluations one entry per evaluated requirement, in plan order
 * @param latencies              stage name to duration in milliseconds
 * @param capturedAt             ISO-8601 instant the view was taken
 */
public record ExecutionTrace(
        @JsonProperty("agent_executions")        Map<String, List<AgentExecutionTrace>> agentExecutions,
        @JsonProperty("requirement_evaluations") List<RequirementEvaluationTrace> requirementEvaluations,
        @JsonProperty("latencies")               Map<String, Double> latencies,
        @JsonProperty("captured_at")             String capturedAt
) {

    public ExecutionTrace {
        agentExecutions = agentExecutions != null ? Map.copyOf(agentExecutions) : Map.of();
        requirementEvaluations = requirementEvaluations != null ? List.copyOf(requirementEvaluations) : List.of();
        latencies = latencies != null ? Map.copyOf(latencies) : Map.of();
    }

    public static ExecutionTrace empty(String capturedAt) {
        return new ExecutionTrace(Map.of(), List.of(), Map.of(), capturedAt);
    }
}
