package com.eainde.verify.model;

import java.util.Objects;

/**
 * A single testable assertion extracted from an artifact.
 * <p>
 * {@code id} is derived from the claim content (see {@code ClaimIds}), so the same claim keeps
 * the same id across iterations of a run. {@code evidenceRef} points at the location in the
 * artifact the statement was taken from, e.g. {@code "Security#3"}.
 * </p>
 */
public record Claim(
        String id,
        String domain,
        String statement,
        String evidenceRef,
        int extractedAtIteration,
        String section,
        ClaimSeverity severity
) {

    public Claim {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(statement, "statement");
        if (severity == null) {
            severity = ClaimSeverity.MEDIUM;
        }
    }

    public static Claim of(String id, String domain, String statement, String evidenceRef, int iteration) {
        return new Claim(id, domain, statement, evidenceRef, iteration, null, ClaimSeverity.MEDIUM);
    }

    public Claim atIteration(int iteration) {
        return new Claim(id, domain, statement, evidenceRef, iteration, section, severity);
    }
}
