package com.eainde.verify.error;

/**
 * No claims could be derived from an artifact. Run-fatal.
 */
public class ExtractionFailureException extends VerificationException {

    private final String domainId;

    public ExtractionFailureException(String domainId, String message) {
        super(message);
        this.domainId = domainId;
    }

    public ExtractionFailureException(String domainId, String message, Throwable cause) {
        super(message, cause);
        this.domainId = domainId;
    }

    public String getDomainId() {
        return domainId;
    }
}
