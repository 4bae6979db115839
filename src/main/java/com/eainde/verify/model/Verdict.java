package com.eainde.verify.model;

/**
 * Outcome of checking one claim against its domain oracle.
 */
public enum Verdict {
    VERIFIED,
    FALSIFIED,
    PARTIAL,
    UNVERIFIABLE; // adapter/infra failure only, never a domain judgment

    /**
     * FALSIFIED and PARTIAL are domain failures that a verifier can remediate.
     */
    public boolean isRemediable() {
        return this == FALSIFIED || this == PARTIAL;
    }
}
