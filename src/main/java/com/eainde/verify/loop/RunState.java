package com.eainde.verify.loop;

import com.eainde.verify.ledger.IterationSnapshot;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.RunStatus;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * State of one verification run.
 * <p>
 * Only the {@link LoopController} driving the run mutates it (all mutators are package-private).
 * Every field holds an immutable value behind a volatile reference, so other threads, e.g. a
 * caller polling a {@link RunHandle}, always read a consistent value per field.
 * </p>
 * <p>
 * Iteration, artifact, claims and results always describe the last committed iteration. The
 * controller builds an iteration locally and commits it in one step once its verification phase
 * completes, so a run cancelled or failed mid-iteration still reads as its last snapshot.
 * </p>
 */
public final class RunState {

    private final String runId;
    private final List<String> domainIds;
    private final int maxIterations;

    private volatile Committed committed;
    private volatile RunStatus status = RunStatus.INIT;
    private volatile RemediationPlan lastPlan;
    private volatile List<IterationSnapshot> history = List.of();
    private volatile RunFailure failure;
    private volatile boolean cancelRequested;

    // Claims counted as verified for regression checks, carried through UNVERIFIABLE verdicts.
    private volatile Set<String> effectiveVerifiedIds = Set.of();

    private RunState(String runId, Artifact artifact, List<String> domainIds, int maxIterations) {
        this.runId = runId;
        this.committed = new Committed(1, artifact, List.of(), Map.of());
        this.domainIds = domainIds;
        this.maxIterations = maxIterations;
    }

    public static RunState start(String runId, Artifact artifact, List<String> domainIds, int maxIterations) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(artifact, "artifact");
        if (domainIds == null || domainIds.isEmpty()) {
            throw new IllegalArgumentException("A run needs at least one domain");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        }
        return new RunState(runId, artifact, List.copyOf(domainIds), maxIterations);
    }

    // =========================================================================
    //  Read access
    // =========================================================================

    public String runId() {
        return runId;
    }

    public List<String> domainIds() {
        return domainIds;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public Artifact artifact() {
        return committed.artifact();
    }

    public int artifactVersion() {
        return committed.artifact().version();
    }

    public int iteration() {
        return committed.iteration();
    }

    public RunStatus status() {
        return status;
    }

    public List<Claim> claims() {
        return committed.claims();
    }

    /**
     * Latest result of every claim, in claim order.
     */
    public List<VerificationResult> results() {
        return List.copyOf(committed.results().values());
    }

    public Optional<VerificationResult> result(String claimId) {
        return Optional.ofNullable(committed.results().get(claimId));
    }

    public Optional<RemediationPlan> lastPlan() {
        return Optional.ofNullable(lastPlan);
    }

    public List<IterationSnapshot> history() {
        return history;
    }

    public Optional<IterationSnapshot> lastSnapshot() {
        List<IterationSnapshot> h = history;
        return h.isEmpty() ? Optional.empty() : Optional.of(h.get(h.size() - 1));
    }

    public Optional<RunFailure> failure() {
        return Optional.ofNullable(failure);
    }

    public long verifiedCount() {
        return count(Verdict.VERIFIED);
    }

    public long count(Verdict verdict) {
        return committed.results().values().stream().filter(r -> r.verdict() == verdict).count();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    // =========================================================================
    //  Mutation (loop package only)
    // =========================================================================

    /**
     * @throws IllegalStateException if the transition is not allowed from the current status
     */
    void transitionTo(RunStatus next) {
        RunStatus current = status;
        if (current == next && !current.isTerminal()) {
            return;
        }
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Run %s: illegal transition %s -> %s".formatted(runId, current, next));
        }
        status = next;
    }

    /**
     * Publishes a completed iteration: its number, the artifact it verified, its claims and results.
     *
     * @throws IllegalStateException if the run is terminal, the iteration goes backwards or exceeds the budget
     */
    void commit(int iteration, Artifact artifact, List<Claim> claims, Map<String, VerificationResult> results) {
        requireNotTerminal();
        Objects.requireNonNull(artifact, "artifact");
        if (iteration > maxIterations) {
            throw new IllegalStateException("Run %s: iteration budget of %d exhausted".formatted(runId, maxIterations));
        }
        if (iteration < committed.iteration()) {
            throw new IllegalStateException("Run %s: iteration %d already committed, got %d"
                    .formatted(runId, committed.iteration(), iteration));
        }
        this.committed = new Committed(iteration, artifact, List.copyOf(claims),
                Collections.unmodifiableMap(new LinkedHashMap<>(results)));
    }

    void lastPlan(RemediationPlan plan) {
        requireNotTerminal();
        this.lastPlan = plan;
    }

    void record(IterationSnapshot snapshot) {
        List<IterationSnapshot> next = new ArrayList<>(history);
        next.add(snapshot);
        this.history = List.copyOf(next);
    }

    void fail(RunFailure runFailure) {
        transitionTo(RunStatus.FAILED);
        this.failure = runFailure;
    }

    void requestCancel() {
        this.cancelRequested = true;
    }

    Set<String> effectiveVerifiedIds() {
        return effectiveVerifiedIds;
    }

    void effectiveVerifiedIds(Set<String> ids) {
        this.effectiveVerifiedIds = Set.copyOf(ids);
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run %s is already %s".formatted(runId, status));
        }
    }

    @Override
    public String toString() {
        Committed c = committed;
        return "RunState{runId=%s, status=%s, iteration=%d/%d, artifactVersion=%d, claims=%d, verified=%d}"
                .formatted(runId, status, c.iteration(), maxIterations, c.artifact().version(), c.claims().size(),
                        verifiedCount());
    }

    private record Committed(int iteration, Artifact artifact, List<Claim> claims,
                             Map<String, VerificationResult> results) {
    }
}
