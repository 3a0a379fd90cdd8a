package com.eainde.compliance.audit;

import com.eainde.compliance.error.AuditFrozenException;
import com.eainde.compliance.orchestration.OrchestrationResult;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Mutable lifecycle state of one audit.
 *
 * <p>Status only moves along {@link AuditStatus#canTransitionTo}. Progress never
 * decreases, except when a completion whose commit failed is rolled back. The
 * report is written exactly once, on a committed completion.</p>
 */
@Getter
public class AuditRecord {

    private final String id;
    private final String filename;
    private final Instant createdAt;
    private volatile AuditStatus status;
    private volatile double progress;
    private volatile OrchestrationResult report;
    private volatile String error;

    public AuditRecord(String id, String filename, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.filename = filename;
        this.createdAt = createdAt;
        this.status = AuditStatus.PENDING;
        this.progress = 0.0;
    }

    /**
     * Claims a PENDING audit for processing by moving it to EXTRACTING.
     * Only one caller can win; every other caller gets an exception and the audit is untouched.
     *
     * @throws IllegalStateException if the audit is not PENDING
     */
    public synchronized void begin(double newProgress) {
        if (status != AuditStatus.PENDING) {
            throw new IllegalStateException("Audit " + id + " cannot be started, it is already " + status);
        }
        transitionTo(AuditStatus.EXTRACTING, newProgress);
    }

    /**
     * @throws IllegalStateException on an illegal transition or a progress decrease
     */
    public synchronized void transitionTo(AuditStatus next, double newProgress) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Audit " + id + " cannot move from " + status + " to " + next);
        }
        advanceProgress(newProgress);
        this.status = next;
    }

    /** Raises progress without a status change. */
    public synchronized void updateProgress(double newProgress) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Audit " + id + " is " + status);
        }
        advanceProgress(newProgress);
    }

    /**
     * @throws AuditFrozenException if a report was already stored
     */
    public synchronized void complete(OrchestrationResult result) {
        complete(result, audit -> {});
    }

    /**
     * Stores the report, moves to COMPLETED and runs {@code commit} while holding the lock.
     * If the commit fails the completion is undone: the report is dropped, progress goes
     * back to its pre-completion value and the audit is FAILED with the commit error.
     *
     * @throws AuditFrozenException if a report was already stored
     * @throws RuntimeException     the commit failure, after the rollback
     */
    public synchronized void complete(OrchestrationResult result, Consumer<AuditRecord> commit) {
        if (report != null) {
            throw new AuditFrozenException(id);
        }
        Objects.requireNonNull(result, "result");
        AuditStatus previousStatus = status;
        double previousProgress = progress;

        transitionTo(AuditStatus.COMPLETED, 1.0);
        this.report = result;
        try {
            commit.accept(this);
        } catch (RuntimeException e) {
            this.report = null;
            this.progress = previousProgress;
            this.status = previousStatus;
            fail("Failed to store audit report: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            throw e;
        }
    }

    public synchronized void fail(String message) {
        transitionTo(AuditStatus.FAILED, progress);
        this.error = message;
    }

    private void advanceProgress(double newProgress) {
        if (newProgress < progress) {
            throw new IllegalStateException(
                    "Audit " + id + " progress cannot decrease from " + progress + " to " + newProgress);
        }
        this.progress = Math.min(1.0, newProgress);
    }
}
