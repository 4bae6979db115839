package com.eainde.verify.error;

/**
 * Malformed registry entry or adapter configuration. Raised at startup, before any run begins.
 */
public class ConfigurationException extends VerificationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
