package com.eainde.compliance.trace;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.VerifiedAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures structured execution traces for one audit run.
 *
 * <p>One instance per run. Requirement chains may record concurrently: agent
 * executions are appended to thread-safe lists and requirement evaluations are
 * keyed by requirement id, so recording order never affects the final trace.</p>
 */
public class ExecutionTracer {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracer.class);

    private static final int MAX_INLINE_STRING = 100;

    private final Clock clock;
    private final LatencyTracker latencyTracker;
    private final Map<String, List<AgentExecutionTrace>> agentExecutions = new ConcurrentHashMap<>();
    private final Map<String, RequirementEvaluationTrace> requirementEvaluations = new ConcurrentHashMap<>();

    public ExecutionTracer(Clock clock, LatencyTracker latencyTracker) {
        this.clock = clock;
        this.latencyTracker = latencyTracker;
    }

    public ExecutionTracer() {
        this(Clock.systemUTC(), new LatencyTracker());
    }

    public LatencyTracker latencyTracker() {
        return latencyTracker;
    }

    public Instant now() {
        return clock.instant();
    }

    public void recordAgentExecution(String agentName,
                                     String requirementId,
                                     Instant startedAt,
                                     Map<String, ?> input,
                                     Map<String, ?> output,
                                     boolean success,
                                     String error) {
        AgentExecutionTrace trace = AgentExecutionTrace.completed(
                agentName,
                requirementId,
                startedAt,
                clock.instant(),
                summarize(input),
                summarize(output),
                success,
                error);
        agentExecutions.computeIfAbsent(agentName, k -> new CopyOnWriteArrayList<>()).add(trace);
        log.debug("Recorded trace for {}: {}", agentName, trace);
    }

    public void recordRequirementEvaluation(String requirementId,
                                            EvidenceBundle evidence,
                                            Assessment assessment,
                                            VerifiedAssessment verification) {
        RequirementEvaluationTrace trace = new RequirementEvaluationTrace(
                requirementId,
                evidence.size(),
                assessment.status(),
                assessment.confidence(),
                verification.verifiedStatus(),
                verification.verifiedConfidence(),
                verification.wasDowngraded());
        requirementEvaluations.put(requirementId, trace);
    }

    /**
     * Immutable trace with requirement evaluations in the given order. Ids without a
     * recorded evaluation are skipped; agent executions are sorted by requirement id
     * so that the trace does not depend on completion order.
     */
    public ExecutionTrace snapshot(Collection<String> requirementOrder) {
        List<RequirementEvaluationTrace> ordered = new ArrayList<>();
        for (String id : requirementOrder) {
            RequirementEvaluationTrace trace = requirementEvaluations.get(id);
            if (trace != null) ordered.add(trace);
        }

        Map<String, List<AgentExecutionTrace>> agents = new TreeMap<>();
        agentExecutions.forEach((name, traces) -> {
            List<AgentExecutionTrace> sorted = new ArrayList<>(traces);
            sorted.sort((a, b) -> compareNullable(a.requirementId(), b.requirementId()));
            agents.put(name, List.copyOf(sorted));
        });

        return new ExecutionTrace(agents, ordered, latencyTracker.all(), clock.instant().toString());
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    static Map<String, Object> summarize(Map<String, ?> data) {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (data == null) return summary;
        data.forEach((key, value) -> {
            if (value instanceof Collection<?> c) {
                summary.put(key, "<list of " + c.size() + " items>");
            } else if (value instanceof String s && s.length() > MAX_INLINE_STRING) {
                summary.put(key, "<string of " + s.length() + " chars>");
            } else if (value instanceof Enum<?> e) {
                summary.put(key, e.name());
            } else {
                summary.put(key, value);
            }
        });
        return summary;
    }

    private static int compareNullable(String a, String b) {
        if (a == null) return b == null ? 0 : -1;
        if (b == null) return 1;
        return a.compareTo(b);
    }
}
