package com.eainde.verify.loop;

import java.time.Duration;

/**
 * @param maxIterations            default iteration budget of a run
 * @param partialCountsAsVerified  whether PARTIAL counts as verified for convergence
 * @param cancellationPollInterval how often a waiting verification phase checks for cancellation
 */
public record LoopSettings(int maxIterations, boolean partialCountsAsVerified, Duration cancellationPollInterval) {

    public LoopSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        if (cancellationPollInterval == null || cancellationPollInterval.isNegative() || cancellationPollInterval.isZero()) {
            cancellationPollInterval = Duration.ofMillis(100);
        }
    }

    public static LoopSettings defaults() {
        return new LoopSettings(5, false, Duration.ofMillis(100));
    }
}
