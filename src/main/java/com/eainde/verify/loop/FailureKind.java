package com.eainde.verify.loop;

/**
 * Why a run ended in {@code FAILED}.
 */
public enum FailureKind {
    EXTRACTION_FAILURE,
    DOMAIN_NOT_FOUND,
    REGRESSION_DETECTED,
    GENERATION_FAILURE,
    CANCELLED,
    /** Anything else escaping the loop, e.g. the ledger rejecting a snapshot. */
    UNEXPECTED_ERROR
}
