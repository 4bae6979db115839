package com.eainde.verify.model;

/**
 * Impact if the claim turns out to be false.
 */
public enum ClaimSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
