package com.eainde.verify.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phase of a verification run.
 *
 * <pre>
 * INIT -> EXTRACTING -> VERIFYING -> CONVERGED
 *                                 -> REMEDIATING -> REGENERATING -> EXTRACTING
 *                                 -> EXHAUSTED
 * any non-terminal phase          -> FAILED
 * </pre>
 * VERIFYING may also loop straight back to EXTRACTING when the remediation plan is empty.
 */
public enum RunStatus {
    INIT,
    EXTRACTING,
    VERIFYING,
    REMEDIATING,
    REGENERATING,
    CONVERGED,
    EXHAUSTED,
    FAILED;

    public boolean isTerminal() {
        return this == CONVERGED || this == EXHAUSTED || this == FAILED;
    }

    public boolean canTransitionTo(RunStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<RunStatus> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(EXTRACTING);
            case EXTRACTING -> EnumSet.of(VERIFYING);
            case VERIFYING -> EnumSet.of(CONVERGED, REMEDIATING, EXHAUSTED, EXTRACTING);
            case REMEDIATING -> EnumSet.of(REGENERATING, EXTRACTING);
            case REGENERATING -> EnumSet.of(EXTRACTING);
            case CONVERGED, EXHAUSTED, FAILED -> EnumSet.noneOf(RunStatus.class);
        };
    }
}
