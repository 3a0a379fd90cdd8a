package com.eainde.compliance.audit;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAuditRepository implements AuditRepository {

    private final Map<String, AuditRecord> audits = new ConcurrentHashMap<>();

    @Override
    public AuditRecord save(AuditRecord audit) {
        audits.put(audit.getId(), audit);
        return audit;
    }

    @Override
    public Optional<AuditRecord> findById(String auditId) {
        return Optional.ofNullable(audits.get(auditId));
    }
}
