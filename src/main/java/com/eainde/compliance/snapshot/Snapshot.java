package com.eainde.compliance.snapshot;

import com.eainde.compliance.model.FrameworkMetadata;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable, fingerprinted record of a completed audit.
 *
 * <p>{@code fingerprint} is the SHA-256 hex of the canonical JSON of every other
 * field (object keys sorted at every level). Evidence hashes inside
 * {@link #results()} are checked separately by
 * {@link AuditSnapshotter#verifyIntegrity(Snapshot)}.</p>
 */
public record Snapshot(
        @JsonProperty("snapshot_version") String snapshotVersion,
        @JsonProperty("audit_id")         String auditId,
        @JsonProperty("engine")           EngineInfo engine,
        @JsonProperty("framework")        FrameworkMetadata framework,
        @JsonProperty("results")          SnapshotResults results,
        @JsonProperty("metadata")         SnapshotMetadata metadata,
        @JsonProperty("fingerprint")      String fingerprint
) {

    public static final String CURRENT_VERSION = "1.0";

    Snapshot withFingerprint(String fingerprint) {
        return new Snapshot(snapshotVersion, auditId, engine, framework, results, metadata, fingerprint);
    }
}
