package com.eainde.verify.router;

import java.time.Duration;

/**
 * Timeout and retry budget for a single adapter {@code verify} call.
 *
 * @param timeout           per-attempt timeout; the running call is cancelled when it elapses
 * @param maxAttempts       total attempts including the first one
 * @param initialBackoff    wait before the second attempt
 * @param backoffMultiplier growth factor of the wait between attempts
 */
public record VerifierCallPolicy(Duration timeout, int maxAttempts, Duration initialBackoff, double backoffMultiplier) {

    public VerifierCallPolicy {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static VerifierCallPolicy defaults() {
        return new VerifierCallPolicy(Duration.ofSeconds(30), 3, Duration.ofMillis(200), 2.0);
    }
}
