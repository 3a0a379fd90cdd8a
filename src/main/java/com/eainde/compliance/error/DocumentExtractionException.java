package com.eainde.compliance.error;

/** The submitted document could not be read or segmented. Fatal to the audit. */
public class DocumentExtractionException extends ComplianceEngineException {

    public DocumentExtractionException(String message) {
        super(message);
    }

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
