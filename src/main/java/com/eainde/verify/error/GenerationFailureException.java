package com.eainde.verify.error;

/**
 * The artifact generator could not produce a new artifact version. Run-fatal.
 */
public class GenerationFailureException extends VerificationException {

    public GenerationFailureException(String message) {
        super(message);
    }

    public GenerationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
