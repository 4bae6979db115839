package com.eainde.verify.loop;

import com.eainde.verify.ledger.IterationSnapshot;

import java.util.List;
import java.util.Objects;

/**
 * Structured reason for a failed run.
 *
 * @param domainId     domain involved, if any
 * @param claimIds     claims involved, e.g. the ones that regressed
 * @param lastSnapshot latest ledger snapshot of the run at the time of failure, may be {@code null}
 */
public record RunFailure(
        FailureKind kind,
        String message,
        String domainId,
        List<String> claimIds,
        IterationSnapshot lastSnapshot
) {

    public RunFailure {
        Objects.requireNonNull(kind, "kind");
        claimIds = claimIds == null ? List.of() : List.copyOf(claimIds);
    }
}
