package com.eainde.compliance.audit;

import java.util.Optional;

/**
 * Storage of audit records. Durable implementations live outside this module.
 */
public interface AuditRepository {

    AuditRecord save(AuditRecord audit);

    Optional<AuditRecord> findById(String auditId);
}
