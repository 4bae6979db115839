package com.eainde.verify.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Verdict for one claim, as produced by a domain oracle or by the router on adapter failure.
 */
public record VerificationResult(
        String claimId,
        Verdict verdict,
        String evidence,
        String oracleId,
        Instant timestamp,
        int attempts
) {

    public VerificationResult {
        Objects.requireNonNull(claimId, "claimId");
        Objects.requireNonNull(verdict, "verdict");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static VerificationResult verified(String claimId, String oracleId, String evidence) {
        return new VerificationResult(claimId, Verdict.VERIFIED, evidence, oracleId, Instant.now(), 1);
    }

    public static VerificationResult falsified(String claimId, String oracleId, String evidence) {
        return new VerificationResult(claimId, Verdict.FALSIFIED, evidence, oracleId, Instant.now(), 1);
    }

    public static VerificationResult partial(String claimId, String oracleId, String evidence) {
        return new VerificationResult(claimId, Verdict.PARTIAL, evidence, oracleId, Instant.now(), 1);
    }

    public VerificationResult withAttempts(int attempts) {
        return new VerificationResult(claimId, verdict, evidence, oracleId, timestamp, attempts);
    }
}
