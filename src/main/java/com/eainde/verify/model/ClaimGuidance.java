package com.eainde.verify.model;

import java.util.Objects;

/**
 * Fix guidance for one failed claim. {@code domainId} records which domain produced it.
 */
public record ClaimGuidance(
        String claimId,
        String domainId,
        Verdict verdict,
        RemediationAction action,
        String guidance
) {

    public ClaimGuidance {
        Objects.requireNonNull(claimId, "claimId");
        Objects.requireNonNull(domainId, "domainId");
        if (action == null) {
            action = RemediationAction.MODIFY;
        }
    }
}
