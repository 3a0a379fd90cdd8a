package com.eainde.compliance.trace;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.VerifiedAssessment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionTracerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("should summarize lists and long strings")
    void summarizes() {
        Map<String, Object> summary = ExecutionTracer.summarize(Map.of(
                "chunks", List.of("a", "b", "c"),
                "text", "x".repeat(150),
                "short", "ok",
                "status", ComplianceStatus.PARTIAL));

        assertThat(summary)
                .containsEntry("chunks", "<list of 3 items>")
                .containsEntry("text", "<string of 150 chars>")
                .containsEntry("short", "ok")
                .containsEntry("status", "PARTIAL");
    }

    @Test
    @DisplayName("should record requirement evaluations in the requested order regardless of recording order")
    void planOrder() throws Exception {
        ExecutionTracer tracer = new ExecutionTracer(CLOCK, new LatencyTracker());
        List<String> order = new ArrayList<>();
        for (int i = 0; i < 20; i++) order.add(String.format("REQ-%03d", i));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (String id : order) {
                futures.add(CompletableFuture.runAsync(() -> {
                    Assessment assessment = new Assessment(id, ComplianceStatus.PARTIAL, 0.5, "q", "r", List.of());
                    tracer.recordAgentExecution("reasoner_agent", id, CLOCK.instant(),
                            Map.of("requirement_id", id), Map.of("status", assessment.status()), true, null);
                    tracer.recordRequirementEvaluation(id, EvidenceBundle.empty(id), assessment,
                            VerifiedAssessment.approvedAsIs(assessment, "ok"));
                }, pool));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } finally {
            pool.shutdown();
        }

        List<String> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        ExecutionTrace trace = tracer.snapshot(reversed);

        assertThat(trace.requirementEvaluations())
                .extracting(RequirementEvaluationTrace::requirementId)
                .containsExactlyElementsOf(reversed);
        assertThat(trace.agentExecutions().get("reasoner_agent"))
                .extracting(AgentExecutionTrace::requirementId)
                .containsExactlyElementsOf(order);
        assertThat(trace.capturedAt()).isEqualTo("2026-01-15T10:00:00Z");
    }

    @Test
    @DisplayName("should flag a verifier downgrade")
    void downgradeFlag() {
        ExecutionTracer tracer = new ExecutionTracer(CLOCK, new LatencyTracker());
        Assessment assessment = new Assessment("REQ-001", ComplianceStatus.COMPLIANT, 0.9, "q", "r", List.of());
        VerifiedAssessment verification = new VerifiedAssessment("REQ-001",
                ComplianceStatus.COMPLIANT, ComplianceStatus.PARTIAL, 0.9, 0.5, "weak", false);

        tracer.recordRequirementEvaluation("REQ-001", EvidenceBundle.empty("REQ-001"), assessment, verification);

        RequirementEvaluationTrace trace = tracer.snapshot(List.of("REQ-001")).requirementEvaluations().get(0);
        assertThat(trace.wasDowngraded()).isTrue();
        assertThat(trace.verifiedStatus()).isEqualTo(ComplianceStatus.PARTIAL);
        assertThat(trace.evidenceChunks()).isZero();
    }

    @Test
    @DisplayName("should flag a confidence-only downgrade")
    void confidenceOnlyDowngrade() {
        ExecutionTracer tracer = new ExecutionTracer(CLOCK, new LatencyTracker());
        Assessment assessment = new Assessment("REQ-002", ComplianceStatus.COMPLIANT, 0.9, "q", "r", List.of());
        VerifiedAssessment verification = new VerifiedAssessment("REQ-002",
                ComplianceStatus.COMPLIANT, ComplianceStatus.COMPLIANT, 0.9, 0.6, "less certain", true);

        tracer.recordRequirementEvaluation("REQ-002", EvidenceBundle.empty("REQ-002"), assessment, verification);

        RequirementEvaluationTrace trace = tracer.snapshot(List.of("REQ-002")).requirementEvaluations().get(0);
        assertThat(trace.wasDowngraded()).isEqualTo(verification.wasDowngraded()).isTrue();
        assertThat(trace.verifiedConfidence()).isEqualTo(0.6);
    }
}
