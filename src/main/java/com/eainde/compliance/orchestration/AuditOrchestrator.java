package com.eainde.compliance.orchestration;

import com.eainde.compliance.agent.AssessmentVerifier;
import com.eainde.compliance.agent.ComplianceAssessor;
import com.eainde.compliance.agent.RequirementPlanner;
import com.eainde.compliance.audit.AuditRecord;
import com.eainde.compliance.audit.AuditRepository;
import com.eainde.compliance.audit.AuditStatus;
import com.eainde.compliance.catalog.RequirementCatalog;
import com.eainde.compliance.document.DocumentExtractor;
import com.eainde.compliance.document.DocumentSource;
import com.eainde.compliance.error.AuditFrozenException;
import com.eainde.compliance.error.CatalogUnavailableException;
import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.DocumentSegment;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.FrameworkMetadata;
import com.eainde.compliance.model.Requirement;
import com.eainde.compliance.model.RequirementPlan;
import com.eainde.compliance.model.Verdict;
import com.eainde.compliance.model.VerifiedAssessment;
import com.eainde.compliance.retrieval.EvidenceRetriever;
import com.eainde.compliance.snapshot.AuditSnapshotter;
import com.eainde.compliance.snapshot.Snapshot;
import com.eainde.compliance.trace.ExecutionTrace;
import com.eainde.compliance.trace.ExecutionTracer;
import com.eainde.compliance.trace.LatencyTracker;
import com.eainde.compliance.verdict.VerdictAggregator;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * End-to-end compliance evaluation of one audit.
 *
 * <h3>Lifecycle (progress):</h3>
 * <pre>
 * PENDING (0.0) → EXTRACTING (0.1) → ANALYZING (0.4) → evaluation done (0.8) → COMPLETED (1.0)
 *                                  any fatal error → FAILED
 * </pre>
 *
 * <h3>Evaluation (AGENT mode):</h3>
 * <pre>
 * catalog → planner → filter against catalog ids → per requirement, in parallel:
 *     retriever → assessor → verifier → apply verification
 * → verdict aggregation → frozen snapshot
 * </pre>
 *
 * LEGACY mode skips the planner and the verifier and evaluates the whole catalog.
 *
 * <p>A failure inside one requirement's chain turns that requirement into UNKNOWN
 * with confidence 0.0; it never fails the audit. Results are returned in plan order
 * regardless of completion order.</p>
 */
@Log4j2
public class AuditOrchestrator {

    static final String MDC_AUDIT_ID = "auditId";
    static final String MDC_REQUIREMENT_ID = "requirementId";

    static final double PROGRESS_EXTRACTING = 0.1;
    static final double PROGRESS_ANALYZING = 0.4;
    static final double PROGRESS_EVALUATED = 0.8;

    private final RequirementCatalog catalog;
    private final DocumentExtractor extractor;
    private final EvidenceRetriever retriever;
    private final RequirementPlanner planner;
    private final ComplianceAssessor assessor;
    private final AssessmentVerifier verifier;
    private final AuditSnapshotter snapshotter;
    private final AuditRepository repository;
    private final Executor executor;
    private final PipelineSettings settings;
    private final Clock clock;

    public AuditOrchestrator(RequirementCatalog catalog,
                             DocumentExtractor extractor,
                             EvidenceRetriever retriever,
                             RequirementPlanner planner,
                             ComplianceAssessor assessor,
                             AssessmentVerifier verifier,
                             AuditSnapshotter snapshotter,
                             AuditRepository repository,
                             Executor executor,
                             PipelineSettings settings,
                             Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.assessor = Objects.requireNonNull(assessor, "assessor");
        this.snapshotter = Objects.requireNonNull(snapshotter, "snapshotter");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (settings.isAgentMode()) {
            this.planner = Objects.requireNonNull(planner, "planner is required in AGENT mode");
            this.verifier = Objects.requireNonNull(verifier, "verifier is required in AGENT mode");
        } else {
            this.planner = planner;
            this.verifier = verifier;
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Runs the full lifecycle for a submitted audit.
     *
     * @return the audit record in its terminal state (COMPLETED or FAILED)
     * @throws IllegalArgumentException if the audit does not exist
     * @throws AuditFrozenException     if the audit already holds a report
     * @throws IllegalStateException    if the audit is not PENDING; the audit is left untouched
     */
    public AuditRecord run(String auditId, DocumentSource source) {
        AuditRecord audit = repository.findById(auditId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown audit: " + auditId));
        snapshotter.ensureImmutability(audit);
        audit.begin(PROGRESS_EXTRACTING);

        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_AUDIT_ID, auditId)) {
            log.info("Audit {} started for {}", auditId, source.filename());
            try {
                repository.save(audit);

                List<DocumentSegment> segments = extractor.extract(source);
                retriever.index(auditId, segments);

                audit.transitionTo(AuditStatus.ANALYZING, PROGRESS_ANALYZING);
                repository.save(audit);

                OrchestrationResult result = evaluate(auditId);

                audit.updateProgress(PROGRESS_EVALUATED);
                repository.save(audit);

                snapshotter.ensureImmutability(audit);
                audit.complete(result, repository::save);
                log.info("Audit {} completed - verdict {}", auditId, result.overallVerdict());

            } catch (AuditFrozenException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Audit {} failed", auditId, e);
                // a failed commit has already moved the audit to FAILED
                if (!audit.getStatus().isTerminal()) {
                    audit.fail(describe(e));
                }
                repository.save(audit);
            } finally {
                retriever.evict(auditId);
            }
        }
        return audit;
    }

    /**
     * Evaluates an audit whose document is already indexed in the retriever.
     *
     * @throws CatalogUnavailableException if the catalog holds no requirements
     */
    public OrchestrationResult evaluate(String auditId) {
        ExecutionTracer tracer = new ExecutionTracer(clock, new LatencyTracker());
        LatencyTracker latency = tracer.latencyTracker();
        Instant evaluatedAt = clock.instant();

        try (LatencyTracker.Measurement total = latency.measure("total_pipeline")) {

            // ── STEP 1: Load catalog ────────────────────────────────────────
            List<Requirement> requirements = catalog.requirements();
            if (requirements.isEmpty()) {
                throw new CatalogUnavailableException("Requirement catalog is empty");
            }
            Map<String, Requirement> byId = new LinkedHashMap<>();
            requirements.forEach(r -> byId.put(r.requirementId(), r));
            FrameworkMetadata framework = catalog.framework();

            // ── STEP 2: Plan ────────────────────────────────────────────────
            List<String> filteredOut = new ArrayList<>();
            RequirementPlan plan = settings.isAgentMode()
                    ? planRequirements(framework, requirements, byId.keySet(), filteredOut, tracer)
                    : new RequirementPlan(List.copyOf(byId.keySet()), "Legacy evaluation of the whole catalog", false);
            log.info("Evaluating {} of {} requirements ({} mode)",
                    plan.requirementIds().size(), requirements.size(), settings.evaluationMode());

            // ── STEP 3: Per-requirement chains, bounded parallelism ─────────
            List<CompletableFuture<Assessment>> futures = new ArrayList<>();
            for (String requirementId : plan.requirementIds()) {
                Requirement requirement = byId.get(requirementId);
                futures.add(CompletableFuture
                        .supplyAsync(() -> evaluateRequirement(auditId, requirement, tracer), executor)
                        .exceptionally(e -> Assessment.unknown(requirementId,
                                "Evaluation failed due to error: " + describe(e))));
            }
            List<Assessment> assessments = futures.stream().map(CompletableFuture::join).toList();

            // ── STEP 4: Aggregate + freeze ──────────────────────────────────
            Verdict verdict = VerdictAggregator.aggregateAssessments(assessments);
            total.close();

            ExecutionTrace trace = tracer.snapshot(plan.requirementIds());
            Snapshot snapshot = snapshotter.createFrozenSnapshot(auditId, framework, assessments, verdict, trace);

            ExecutionMetadata metadata = new ExecutionMetadata(
                    evaluatedAt.toString(),
                    requirements.size(),
                    assessments.size(),
                    settings.engineVersion(),
                    settings.evaluationMode(),
                    retriever.strategy(),
                    plan.reasoning(),
                    plan.fallback(),
                    filteredOut,
                    latency.get("total_pipeline").orElse(0.0),
                    latency.all(),
                    trace);

            return new OrchestrationResult(auditId, assessments, verdict, metadata, snapshot);
        }
    }

    // =========================================================================
    //  Planning
    // =========================================================================

    private RequirementPlan planRequirements(FrameworkMetadata framework,
                                             List<Requirement> requirements,
                                             Set<String> catalogIds,
                                             List<String> filteredOut,
                                             ExecutionTracer tracer) {
        Instant started = tracer.now();
        RequirementPlan proposed;
        try (LatencyTracker.Measurement ignored = tracer.latencyTracker().measure(RequirementPlanner.AGENT_NAME)) {
            proposed = planner.plan(framework, requirements);
        }

        filteredOut.addAll(proposed.unknownIds(catalogIds));
        if (!filteredOut.isEmpty()) {
            log.warn("Planner proposed {} requirement ids not in the catalog, dropped: {}",
                    filteredOut.size(), filteredOut);
        }

        RequirementPlan plan = proposed.retainCatalogIds(catalogIds);
        if (plan.isEmpty()) {
            log.warn("No planned requirement exists in the catalog, evaluating the whole catalog");
            plan = RequirementPlan.entireCatalog(requirements, "Fallback: planner selected no catalog requirements");
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("requirement_ids", plan.requirementIds());
        output.put("filtered_out", List.copyOf(filteredOut));
        output.put("fallback", plan.fallback());
        tracer.recordAgentExecution(RequirementPlanner.AGENT_NAME, null, started,
                Map.of("available_requirements", requirements), output, true, null);
        return plan;
    }

    // =========================================================================
    //  Per-requirement chain: retrieve → assess → verify
    // =========================================================================

    private Assessment evaluateRequirement(String auditId, Requirement requirement, ExecutionTracer tracer) {
        String requirementId = requirement.requirementId();
        LatencyTracker latency = tracer.latencyTracker();

        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_REQUIREMENT_ID, requirementId)) {
            EvidenceBundle evidence = EvidenceBundle.empty(requirementId);
            try {
                try (LatencyTracker.Measurement m = latency.measure("retrieval_" + requirementId)) {
                    evidence = retriever.retrieve(auditId, requirement);
                }

                Instant assessStart = tracer.now();
                Assessment assessment;
                try (LatencyTracker.Measurement m = latency.measure("reasoner_" + requirementId)) {
                    assessment = assessor.assess(requirement, evidence);
                }
                tracer.recordAgentExecution(ComplianceAssessor.AGENT_NAME, requirementId, assessStart,
                        Map.of("requirement_id", requirementId, "evidence_chunks", evidence.segments()),
                        Map.of("status", assessment.status(), "confidence", assessment.confidence()),
                        true, null);

                VerifiedAssessment verification;
                if (settings.isAgentMode()) {
                    Instant verifyStart = tracer.now();
                    try (LatencyTracker.Measurement m = latency.measure("verifier_" + requirementId)) {
                        verification = verifier.verify(assessment, evidence);
                    }
                    tracer.recordAgentExecution(AssessmentVerifier.AGENT_NAME, requirementId, verifyStart,
                            Map.of("original_status", assessment.status()),
                            Map.of("verified_status", verification.verifiedStatus(),
                                    "approved", verification.approved()),
                            true, null);
                } else {
                    verification = VerifiedAssessment.approvedAsIs(assessment, "Not verified in legacy mode");
                }

                tracer.recordRequirementEvaluation(requirementId, evidence, assessment, verification);
                Assessment result = verification.applyTo(assessment);
                log.debug("{} evaluated: {} ({})", requirementId, result.status(), result.confidence());
                return result;

            } catch (RuntimeException e) {
                log.warn("Evaluation of {} failed, recording UNKNOWN: {}", requirementId, describe(e));
                Assessment failed = Assessment.unknown(requirementId, "Evaluation failed due to error: " + describe(e));
                tracer.recordAgentExecution("requirement_chain", requirementId, tracer.now(),
                        Map.of("requirement_id", requirementId), Map.of(), false, describe(e));
                tracer.recordRequirementEvaluation(requirementId, evidence, failed,
                        VerifiedAssessment.approvedAsIs(failed, "Not verified: evaluation failed"));
                return failed;
            }
        }
    }

    private static String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
