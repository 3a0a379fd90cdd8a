package com.eainde.compliance.snapshot;

import com.eainde.compliance.audit.AuditRecord;
import com.eainde.compliance.error.AuditFrozenException;
import com.eainde.compliance.error.ComplianceEngineException;
import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.FrameworkMetadata;
import com.eainde.compliance.model.Verdict;
import com.eainde.compliance.trace.ExecutionTrace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Freezes audit results into a tamper-evident {@link Snapshot}.
 *
 * <ul>
 *   <li>every evidence quote is hashed with SHA-256;</li>
 *   <li>the whole body is fingerprinted over canonical, key-sorted JSON;</li>
 *   <li>an audit that already holds a report can never be frozen again.</li>
 * </ul>
 *
 * Engine identity and clock are injected so that fingerprints are reproducible.
 */
@Slf4j
public class AuditSnapshotter {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String engineName;
    private final String engineVersion;
    private final Clock clock;
    private final ObjectMapper canonicalMapper;

    public AuditSnapshotter(String engineName, String engineVersion, Clock clock) {
        this.engineName = engineName;
        this.engineVersion = engineVersion;
        this.clock = clock;
        this.canonicalMapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    /**
     * SHA-256 hex digest of the UTF-8 bytes of {@code text}; empty string for null or empty input.
     */
    public static String calculateHash(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return DigestUtils.sha256Hex(text);
    }

    public Snapshot createFrozenSnapshot(String auditId,
                                         FrameworkMetadata framework,
                                         List<Assessment> assessments,
                                         Verdict overallVerdict,
                                         ExecutionTrace executionTrace) {
        List<FrozenRequirement> frozen = assessments.stream()
                .map(a -> new FrozenRequirement(
                        a.requirementId(),
                        a.status(),
                        a.confidence(),
                        a.reasoning(),
                        a.evidenceQuote(),
                        a.hasQuote() ? calculateHash(a.evidenceQuote()) : null,
                        a.pageNumbers()))
                .toList();

        Snapshot body = new Snapshot(
                Snapshot.CURRENT_VERSION,
                auditId,
                new EngineInfo(engineName, engineVersion, clock.instant().toString()),
                framework,
                new SnapshotResults(overallVerdict, frozen),
                new SnapshotMetadata(executionTrace, true),
                null);

        Snapshot snapshot = body.withFingerprint(fingerprint(body));
        log.info("Froze snapshot for audit {} ({} requirements, verdict {}, fingerprint {})",
                auditId, frozen.size(), overallVerdict, snapshot.fingerprint());
        return snapshot;
    }

    /**
     * Recomputes every stored evidence hash. Does not check the fingerprint.
     *
     * @return false for a malformed snapshot or any hash mismatch
     */
    public boolean verifyIntegrity(Snapshot snapshot) {
        if (snapshot == null || snapshot.results() == null) {
            return false;
        }
        for (FrozenRequirement requirement : snapshot.results().requirements()) {
            if (requirement == null) {
                return false;
            }
            String quote = requirement.evidenceQuote();
            String storedHash = requirement.evidenceHash();
            if (quote != null && !quote.isEmpty() && storedHash != null
                    && !calculateHash(quote).equals(storedHash)) {
                log.warn("Evidence hash mismatch for {} in audit {}",
                        requirement.requirementId(), snapshot.auditId());
                return false;
            }
        }
        return true;
    }

    /**
     * Recomputes the top-level fingerprint over the snapshot body.
     */
    public boolean verifyFingerprint(Snapshot snapshot) {
        if (snapshot == null || snapshot.fingerprint() == null) {
            return false;
        }
        return snapshot.fingerprint().equals(fingerprint(snapshot));
    }

    /**
     * @throws AuditFrozenException if the audit already holds a report
     */
    public void ensureImmutability(AuditRecord audit) {
        if (audit.getReport() != null) {
            throw new AuditFrozenException(audit.getId());
        }
    }

    /** Canonical JSON of the snapshot body, fingerprint excluded. */
    public String canonicalJson(Snapshot snapshot) {
        try {
            Map<String, Object> body = canonicalMapper.convertValue(snapshot, MAP_TYPE);
            body.remove("fingerprint");
            return canonicalMapper.writeValueAsString(body);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ComplianceEngineException("Failed to canonicalize snapshot " + snapshot.auditId(), e);
        }
    }

    private String fingerprint(Snapshot snapshot) {
        return calculateHash(canonicalJson(Objects.requireNonNull(snapshot)));
    }
}
