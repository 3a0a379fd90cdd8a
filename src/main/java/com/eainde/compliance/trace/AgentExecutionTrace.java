package com.eainde.compliance.trace;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * A single agent invocation as recorded in the execution trace.
 *
 * <p>Inputs and outputs are summaries, not payloads: lists are reduced to their size
 * and long strings to their length.</p>
 */
public record AgentExecutionTrace(
        @JsonProperty("agent_name")     String agentName,
        @JsonProperty("requirement_id") String requirementId,
        @JsonProperty("started_at")     String startedAt,
        @JsonProperty("completed_at")   String completedAt,
        @JsonProperty("duration_ms")    double durationMs,
        @JsonProperty("input_summary")  Map<String, Object> inputSummary,
        @JsonProperty("output_summary") Map<String, Object> outputSummary,
        @JsonProperty("success")        boolean success,
        @JsonProperty("error")          String error
) {

    static AgentExecutionTrace completed(String agentName,
                                         String requirementId,
                                         Instant startedAt,
                                         Instant completedAt,
                                         Map<String, Object> inputSummary,
                                         Map<String, Object> outputSummary,
                                         boolean success,
                                         String error) {
        double durationMs = (completedAt.toEpochMilli() - startedAt.toEpochMilli());
        return new AgentExecutionTrace(
                agentName,
                requirementId,
                startedAt.toString(),
                completedAt.toString(),
                durationMs,
                inputSummary,
                outputSummary,
                success,
                error);
    }
}
