package com.eainde.compliance.audit;

import com.eainde.compliance.document.DocumentSource;
import com.eainde.compliance.orchestration.AuditOrchestrator;
import com.eainde.compliance.orchestration.OrchestrationResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for callers: submit an audit, run it in the background, poll it.
 *
 * <pre>
 * AuditRecord audit = auditService.submit("privacy-policy.txt");
 * auditService.start(audit.getId(), source);
 * AuditStatusView status = auditService.status(audit.getId());
 * </pre>
 */
@Slf4j
public class AuditService {

    private final AuditOrchestrator orchestrator;
    private final AuditRepository repository;
    private final Executor auditExecutor;
    private final Clock clock;

    public AuditService(AuditOrchestrator orchestrator,
                        AuditRepository repository,
                        Executor auditExecutor,
                        Clock clock) {
        this.orchestrator = orchestrator;
        this.repository = repository;
        this.auditExecutor = auditExecutor;
        this.clock = clock;
    }

    /** Creates a PENDING audit. */
    public AuditRecord submit(String filename) {
        AuditRecord audit = new AuditRecord(UUID.randomUUID().toString(), filename, clock.instant());
        repository.save(audit);
        log.info("Audit {} submitted for {}", audit.getId(), filename);
        return audit;
    }

    /**
     * Runs the audit asynchronously. The future completes with the audit in its
     * terminal state; it completes exceptionally only if the audit cannot be started.
     *
     * @throws IllegalArgumentException if the audit does not exist
     */
    public CompletableFuture<AuditRecord> start(String auditId, DocumentSource source) {
        require(auditId);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("auditId", auditId)) {
            return CompletableFuture.supplyAsync(() -> orchestrator.run(auditId, source), auditExecutor);
        }
    }

    /**
     * @throws IllegalArgumentException if the audit does not exist
     */
    public AuditStatusView status(String auditId) {
        return AuditStatusView.of(require(auditId));
    }

    /**
     * @return the frozen result, empty until the audit is COMPLETED
     * @throws IllegalArgumentException if the audit does not exist
     */
    public Optional<OrchestrationResult> report(String auditId) {
        return Optional.ofNullable(require(auditId).getReport());
    }

    private AuditRecord require(String auditId) {
        return repository.findById(auditId)
                .orElseThrow(() -> new IllegalArgumentException("Audit not found: " + auditId));
    }
}
