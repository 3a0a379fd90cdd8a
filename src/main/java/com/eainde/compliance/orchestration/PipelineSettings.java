package com.eainde.compliance.orchestration;

import com.eainde.compliance.model.EvaluationMode;

import java.util.Objects;

/**
 * Run-time knobs of the evaluation pipeline, fixed at construction.
 *
 * @param evaluationMode AGENT (planner + verifier) or LEGACY (whole catalog, assessor only)
 * @param engineVersion  engine version recorded in execution metadata
 */
public record PipelineSettings(EvaluationMode evaluationMode, String engineVersion) {

    public PipelineSettings {
        Objects.requireNonNull(evaluationMode, "evaluationMode");
        Objects.requireNonNull(engineVersion, "engineVersion");
    }

    public boolean isAgentMode() {
        return evaluationMode == EvaluationMode.AGENT;
    }
}
