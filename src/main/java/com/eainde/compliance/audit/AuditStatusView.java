package com.eainde.compliance.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only status of an audit as exposed to callers.
 */
public record AuditStatusView(
        @JsonProperty("audit_id")   String auditId,
        @JsonProperty("filename")   String filename,
        @JsonProperty("status")     AuditStatus status,
        @JsonProperty("progress")   double progress,
        @JsonProperty("error")      String error,
        @JsonProperty("created_at") String createdAt
) {

    static AuditStatusView of(AuditRecord audit) {
        return new AuditStatusView(
                audit.getId(),
                audit.getFilename(),
                audit.getStatus(),
                audit.getProgress(),
                audit.getError(),
                audit.getCreatedAt() != null ? audit.getCreatedAt().toString() : null);
    }
}
