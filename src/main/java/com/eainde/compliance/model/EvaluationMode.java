package com.eainde.compliance.model;

/**
 * Evaluation path of the pipeline.
 */
public enum EvaluationMode {
    /** Planner, retriever, assessor and verifier. */
    AGENT,
    /** Whole catalog, retriever and assessor only; no planning or verification. */
    LEGACY
}
