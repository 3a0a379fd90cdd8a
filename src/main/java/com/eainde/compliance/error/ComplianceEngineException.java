package com.eainde.compliance.error;

/**
 * Base class for failures that abort an audit or signal an integrity violation.
 * Per-requirement agent failures never surface as this type; each agent recovers
 * them with its own fail-safe result.
 */
public class ComplianceEngineException extends RuntimeException {

    public ComplianceEngineException(String message) {
        super(message);
    }

    public ComplianceEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
