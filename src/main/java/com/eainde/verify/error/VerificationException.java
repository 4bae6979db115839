package com.eainde.verify.error;

/**
 * Root of the engine's structural errors. Adapter-level failures never surface as one of
 * these; the router maps them to an {@code UNVERIFIABLE} verdict instead.
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
