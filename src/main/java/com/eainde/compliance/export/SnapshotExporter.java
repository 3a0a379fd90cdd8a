package com.eainde.compliance.export;

import com.eainde.compliance.model.FrameworkMetadata;
import com.eainde.compliance.snapshot.EngineInfo;
import com.eainde.compliance.snapshot.FrozenRequirement;
import com.eainde.compliance.snapshot.Snapshot;
import com.eainde.compliance.snapshot.SnapshotResults;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes frozen snapshots as machine-readable JSON or a plain-text report.
 */
@Slf4j
public class SnapshotExporter {

    private static final String RULE = "=".repeat(72);
    private static final String THIN_RULE = "-".repeat(72);

    private final ObjectMapper objectMapper;

    public SnapshotExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void writeJson(Snapshot snapshot, Path output) {
        try {
            objectMapper.writeValue(output.toFile(), snapshot);
            log.info("Exported snapshot of audit {} to {}", snapshot.auditId(), output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot to " + output, e);
        }
    }

    public void writeText(Snapshot snapshot, Path output) {
        try {
            Files.writeString(output, renderText(snapshot), StandardCharsets.UTF_8);
            log.info("Exported text report of audit {} to {}", snapshot.auditId(), output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + output, e);
        }
    }

    public String renderText(Snapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n')
                .append("COMPLIANCE AUDIT REPORT\n")
                .append(RULE).append("\n\n");

        EngineInfo engine = snapshot.engine();
        sb.append("1. Engine Metadata\n");
        if (engine != null) {
            line(sb, "Engine Name", engine.name());
            line(sb, "Engine Version", engine.version());
            line(sb, "Evaluation Date", engine.evaluationDate());
        }
        line(sb, "Audit ID", snapshot.auditId());
        line(sb, "Snapshot Version", snapshot.snapshotVersion());
        sb.append('\n');

        FrameworkMetadata framework = snapshot.framework();
        sb.append("2. Regulatory Framework\n");
        if (framework != null) {
            line(sb, "Framework", framework.name());
            line(sb, "Version", framework.version());
            line(sb, "Effective Date", framework.effectiveDate());
        }
        sb.append('\n');

        SnapshotResults results = snapshot.results();
        sb.append("OVERALL VERDICT: ")
                .append(results != null && results.overallVerdict() != null ? results.overallVerdict() : "UNKNOWN")
                .append("\n\n");

        sb.append("3. Detailed Requirement Assessment\n");
        if (results != null) {
            for (FrozenRequirement requirement : results.requirements()) {
                sb.append(THIN_RULE).append('\n')
                        .append("Requirement ID: ").append(requirement.requirementId())
                        .append(" [").append(requirement.status()).append("]")
                        .append(String.format(Locale.ROOT, " confidence %.2f", requirement.confidence()))
                        .append('\n');
                sb.append("Reasoning: ").append(requirement.reasoning()).append('\n');
                if (requirement.evidenceQuote() != null && !requirement.evidenceQuote().isBlank()) {
                    sb.append("Evidence: \"").append(requirement.evidenceQuote()).append("\"\n");
                    sb.append("Page(s): ").append(requirement.pageNumbers().stream()
                            .map(String::valueOf)
                            .collect(Collectors.joining(", "))).append('\n');
                    sb.append("Evidence Hash: ").append(requirement.evidenceHash()).append('\n');
                }
            }
        }
        sb.append(RULE).append('\n')
                .append("Fingerprint: ").append(snapshot.fingerprint()).append('\n');
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, Object value) {
        sb.append("  ").append(label).append(": ").append(value != null ? value : "-").append('\n');
    }
}
