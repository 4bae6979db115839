package com.eainde.verify.ledger;

import com.eainde.verify.model.Claim;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.RunStatus;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record of one completed verification phase of a run.
 *
 * @param artifactVersion     version number of the artifact that was verified
 * @param artifactVersionHash SHA-256 of that artifact's content
 * @param remediationPlan     plan composed after verification, {@code null} when none was needed
 * @param status              run status right after the iteration was evaluated
 */
public record IterationSnapshot(
        String runId,
        int iteration,
        int artifactVersion,
        String artifactVersionHash,
        List<Claim> claims,
        List<VerificationResult> results,
        RemediationPlan remediationPlan,
        RunStatus status,
        Instant timestamp
) {

    public IterationSnapshot {
        Objects.requireNonNull(runId, "runId");
        claims = claims == null ? List.of() : List.copyOf(claims);
        results = results == null ? List.of() : List.copyOf(results);
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public long count(Verdict verdict) {
        return results.stream().filter(r -> r.verdict() == verdict).count();
    }
}
