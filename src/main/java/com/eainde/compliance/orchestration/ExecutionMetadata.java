package com.eainde.compliance.orchestration;

import com.eainde.compliance.model.EvaluationMode;
import com.eainde.compliance.trace.ExecutionTrace;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * How an orchestration result was produced.
 */
public record ExecutionMetadata(
        @JsonProperty("evaluated_at")           String evaluatedAt,
        @JsonProperty("total_requirements")     int totalRequirements,
        @JsonProperty("evaluated_requirements") int evaluatedRequirements,
        @JsonProperty("engine_version")         String engineVersion,
        @JsonProperty("evaluation_mode")        EvaluationMode evaluationMode,
        @JsonProperty("retrieval_strategy")     String retrievalStrategy,
        @JsonProperty("plan_reasoning")         String planReasoning,
        @JsonProperty("plan_fallback")          boolean planFallback,
        @JsonProperty("filtered_requirement_ids") List<String> filteredRequirementIds,
        @JsonProperty("total_latency_ms")       double totalLatencyMs,
        @JsonProperty("latencies")              Map<String, Double> latencies,
        @JsonProperty("execution_trace")        ExecutionTrace executionTrace
) {

    public ExecutionMetadata {
        filteredRequirementIds = filteredRequirementIds != null ? List.copyOf(filteredRequirementIds) : List.of();
        latencies = latencies != null ? Map.copyOf(latencies) : Map.of();
    }
}
