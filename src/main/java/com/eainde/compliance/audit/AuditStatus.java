package com.eainde.compliance.audit;

import java.util.EnumSet;
import java.util.Set;

/**
 * Audit lifecycle:
 * <pre>
 * PENDING → EXTRACTING → ANALYZING → COMPLETED
 *    └──────────┴────────────┴──────→ FAILED
 * </pre>
 */
public enum AuditStatus {
    PENDING,
    EXTRACTING,
    ANALYZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(AuditStatus next) {
        return allowedNext().contains(next);
    }

    private Set<AuditStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(EXTRACTING, FAILED);
            case EXTRACTING -> EnumSet.of(ANALYZING, FAILED);
            case ANALYZING -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(AuditStatus.class);
        };
    }
}
