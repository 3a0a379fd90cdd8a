package com.eainde.compliance.snapshot;

import com.eainde.compliance.trace.ExecutionTrace;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SnapshotMetadata(
        @JsonProperty("execution_trace")        ExecutionTrace executionTrace,
        @JsonProperty("integrity_check_passed") boolean integrityCheckPassed
) {}
