package com.eainde.compliance.error;

/** Raised when a snapshot is requested for an audit that already holds a report. */
public class AuditFrozenException extends ComplianceEngineException {

    public AuditFrozenException(String auditId) {
        super("Audit " + auditId + " is frozen and cannot be modified.");
    }
}
