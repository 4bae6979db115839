package com.eainde.verify.error;

import java.util.List;

/**
 * The number of verified claims dropped between two consecutive iterations. Requires manual
 * review and is never retried.
 */
public class RegressionDetectedException extends VerificationException {

    private final int iteration;
    private final int previousVerifiedCount;
    private final int currentVerifiedCount;
    private final List<String> regressedClaimIds;

    public RegressionDetectedException(int iteration,
                                       int previousVerifiedCount,
                                       int currentVerifiedCount,
                                       List<String> regressedClaimIds) {
        super("Verified claim count dropped from %d to %d at iteration %d (regressed: %s)"
                .formatted(previousVerifiedCount, currentVerifiedCount, iteration, regressedClaimIds));
        this.iteration = iteration;
        this.previousVerifiedCount = previousVerifiedCount;
        this.currentVerifiedCount = currentVerifiedCount;
        this.regressedClaimIds = List.copyOf(regressedClaimIds);
    }

    public int getIteration() {
        return iteration;
    }

    public int getPreviousVerifiedCount() {
        return previousVerifiedCount;
    }

    public int getCurrentVerifiedCount() {
        return currentVerifiedCount;
    }

    public List<String> getRegressedClaimIds() {
        return regressedClaimIds;
    }
}
