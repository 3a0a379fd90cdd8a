package com.eainde.compliance.error;

/** The requirement catalog is empty or could not be loaded. Fatal to the audit. */
public class CatalogUnavailableException extends ComplianceEngineException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
