package com.eainde.verify.loop;

import com.eainde.verify.error.DomainNotFoundException;
import com.eainde.verify.error.ExtractionFailureException;
import com.eainde.verify.error.GenerationFailureException;
import com.eainde.verify.error.RegressionDetectedException;
import com.eainde.verify.error.RunCancelledException;
import com.eainde.verify.extract.ClaimExtractionService;
import com.eainde.verify.ledger.IterationSnapshot;
import com.eainde.verify.ledger.RunLedger;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.RunStatus;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;
import com.eainde.verify.remediation.Remediator;
import com.eainde.verify.router.VerifierRouter;
import com.eainde.verify.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Drives a {@link RunState} through the verification state machine until it is terminal.
 *
 * <h3>One iteration:</h3>
 * <ol>
 * <li><b>EXTRACTING</b>: claims of every domain from the current artifact.</li>
 * <li><b>VERIFYING</b>: every claim dispatched in parallel through the {@link VerifierRouter}.</li>
 * <li>Evaluation: regression check, then CONVERGED, EXHAUSTED or REMEDIATING.</li>
 * <li><b>REMEDIATING</b>: the {@link Remediator} composes the plan.</li>
 * <li><b>REGENERATING</b>: the {@link ArtifactGenerator} produces the next artifact version.</li>
 * </ol>
 * Every completed verification phase is appended to the {@link RunLedger}. Fatal conditions end
 * the run in FAILED with a {@link RunFailure}; the method always returns a terminal state.
 */
@Log4j2
public class LoopController {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_ITERATION = "iteration";

    private final ClaimExtractionService extraction;
    private final VerifierRouter router;
    private final Remediator remediator;
    private final ArtifactGenerator generator;
    private final RunLedger ledger;
    private final MdcAwareExecutor claimExecutor;
    private final LoopSettings settings;

    public LoopController(ClaimExtractionService extraction,
                          VerifierRouter router,
                          Remediator remediator,
                          ArtifactGenerator generator,
                          RunLedger ledger,
                          MdcAwareExecutor claimExecutor,
                          LoopSettings settings) {
        this.extraction = extraction;
        this.router = router;
        this.remediator = remediator;
        this.generator = generator;
        this.ledger = ledger;
        this.claimExecutor = claimExecutor;
        this.settings = settings;
    }

    public LoopSettings settings() {
        return settings;
    }

    /**
     * Runs the loop to a terminal status. A state that is already terminal is returned as is.
     */
    public RunState run(RunState state) {
        if (state.isTerminal()) {
            log.debug("Run {} is already {}, nothing to do", state.runId(), state.status());
            return state;
        }

        MDC.put(MDC_RUN_ID, state.runId());
        try {
            log.info("Run {} started: artifact={} v{}, domains={}, maxIterations={}",
                    state.runId(), state.artifact().artifactId(), state.artifactVersion(),
                    state.domainIds(), state.maxIterations());
            loop(state);
        } catch (ExtractionFailureException e) {
            fail(state, FailureKind.EXTRACTION_FAILURE, e.getMessage(), e.getDomainId(), List.of());
        } catch (DomainNotFoundException e) {
            fail(state, FailureKind.DOMAIN_NOT_FOUND, e.getMessage(), e.getDomainId(), List.of());
        } catch (RegressionDetectedException e) {
            fail(state, FailureKind.REGRESSION_DETECTED, e.getMessage(), null, e.getRegressedClaimIds());
        } catch (GenerationFailureException e) {
            fail(state, FailureKind.GENERATION_FAILURE, e.getMessage(), null, List.of());
        } catch (RunCancelledException e) {
            fail(state, FailureKind.CANCELLED, e.getMessage(), null, List.of());
        } catch (RuntimeException e) {
            log.error("Run {} aborted by an unexpected error", state.runId(), e);
            fail(state, FailureKind.UNEXPECTED_ERROR, describe(e), null, List.of());
        } finally {
            log.info("Run {} finished: {}", state.runId(), state);
            MDC.remove(MDC_ITERATION);
            MDC.remove(MDC_RUN_ID);
        }
        return state;
    }

    private void loop(RunState state) {
        int iteration = state.iteration();
        Artifact artifact = state.artifact();
        while (true) {
            MDC.put(MDC_ITERATION, String.valueOf(iteration));
            checkCancelled(state);

            // EXTRACTING
            state.transitionTo(RunStatus.EXTRACTING);
            List<Claim> claims = extraction.extract(artifact, state.domainIds(), iteration);
            checkCancelled(state);

            // VERIFYING
            state.transitionTo(RunStatus.VERIFYING);
            Verification verification = verifyAll(state, artifact, claims);
            state.commit(iteration, artifact, claims, verification.results());
            if (verification.domainFailure() != null) {
                snapshot(state, null, RunStatus.FAILED);
                throw verification.domainFailure();
            }
            log.info("Iteration {}: {} verified, {} falsified, {} partial, {} unverifiable",
                    iteration, state.count(Verdict.VERIFIED), state.count(Verdict.FALSIFIED),
                    state.count(Verdict.PARTIAL), state.count(Verdict.UNVERIFIABLE));

            Set<String> effectiveVerified = checkRegression(state);
            state.effectiveVerifiedIds(effectiveVerified);

            if (isConverged(state)) {
                snapshot(state, null, RunStatus.CONVERGED);
                state.transitionTo(RunStatus.CONVERGED);
                log.info("Run {} converged at iteration {} ({} claim(s) verified)",
                        state.runId(), iteration, state.verifiedCount());
                return;
            }
            if (iteration >= state.maxIterations()) {
                snapshot(state, null, RunStatus.EXHAUSTED);
                state.transitionTo(RunStatus.EXHAUSTED);
                log.info("Run {} exhausted its budget of {} iteration(s) with {}/{} claim(s) verified",
                        state.runId(), state.maxIterations(), state.verifiedCount(), claims.size());
                return;
            }

            // REMEDIATING
            state.transitionTo(RunStatus.REMEDIATING);
            RemediationPlan plan = remediator.composePlan(resultsByDomain(state), claims, iteration);
            state.lastPlan(plan);
            snapshot(state, plan, RunStatus.REMEDIATING);

            if (plan.isEmpty()) {
                // Only infrastructure failures remain: verify the same artifact again.
                log.info("Run {}: nothing to remediate at iteration {}, re-verifying artifact v{}",
                        state.runId(), iteration, artifact.version());
                state.transitionTo(RunStatus.EXTRACTING);
                iteration++;
                continue;
            }

            checkCancelled(state);

            // REGENERATING
            state.transitionTo(RunStatus.REGENERATING);
            artifact = regenerate(artifact, plan);
            state.transitionTo(RunStatus.EXTRACTING);
            iteration++;
        }
    }

    // =========================================================================
    //  Verification
    // =========================================================================

    private record Verification(Map<String, VerificationResult> results, DomainNotFoundException domainFailure) {
    }

    /**
     * Dispatches every claim and collects the results in claim order. A claim whose domain has no
     * resolvable verifier has no result; the remaining claims still finish.
     */
    private Verification verifyAll(RunState state, Artifact artifact, List<Claim> claims) {
        Map<String, Future<VerificationResult>> pending = new LinkedHashMap<>();
        for (Claim claim : claims) {
            pending.put(claim.id(), claimExecutor.submit(() -> router.dispatch(claim, artifact)));
        }

        Map<String, VerificationResult> results = new LinkedHashMap<>();
        DomainNotFoundException domainFailure = null;
        try {
            for (Map.Entry<String, Future<VerificationResult>> entry : pending.entrySet()) {
                try {
                    results.put(entry.getKey(), await(state, entry.getValue()));
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof DomainNotFoundException dnf) {
                        if (domainFailure == null) {
                            domainFailure = dnf;
                        }
                    } else {
                        throw new IllegalStateException("Verification of claim %s failed unexpectedly"
                                .formatted(entry.getKey()), e.getCause());
                    }
                }
            }
        } catch (RuntimeException e) {
            pending.values().forEach(f -> f.cancel(true));
            throw e;
        }
        return new Verification(results, domainFailure);
    }

    private VerificationResult await(RunState state, Future<VerificationResult> future) throws ExecutionException {
        long pollMillis = settings.cancellationPollInterval().toMillis();
        while (true) {
            checkCancelled(state);
            try {
                return future.get(pollMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.trace("Still waiting for claim results of run {}", state.runId());
            } catch (CancellationException e) {
                throw new RunCancelledException(state.runId());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException(state.runId());
            }
        }
    }

    // =========================================================================
    //  Evaluation
    // =========================================================================

    /**
     * Returns the ids counted as verified for this iteration. A claim that was verified before and
     * is UNVERIFIABLE now keeps counting, since an unreachable oracle is not a regression.
     *
     * @throws RegressionDetectedException if fewer claims count as verified than in the previous iteration
     */
    private Set<String> checkRegression(RunState state) {
        Set<String> previous = state.effectiveVerifiedIds();
        Set<String> current = new HashSet<>();
        for (VerificationResult result : state.results()) {
            if (result.verdict() == Verdict.VERIFIED
                    || (result.verdict() == Verdict.UNVERIFIABLE && previous.contains(result.claimId()))) {
                current.add(result.claimId());
            }
        }

        if (state.iteration() > 1 && current.size() < previous.size()) {
            List<String> regressed = previous.stream()
                    .filter(id -> !current.contains(id))
                    .sorted()
                    .toList();
            RegressionDetectedException regression =
                    new RegressionDetectedException(state.iteration(), previous.size(), current.size(), regressed);
            log.error("Run {}: {}", state.runId(), regression.getMessage());
            snapshot(state, null, RunStatus.FAILED);
            throw regression;
        }
        return current;
    }

    private boolean isConverged(RunState state) {
        List<VerificationResult> results = state.results();
        if (results.isEmpty() || results.size() < state.claims().size()) {
            return false;
        }
        return results.stream().allMatch(r -> r.verdict() == Verdict.VERIFIED
                || (settings.partialCountsAsVerified() && r.verdict() == Verdict.PARTIAL));
    }

    private static Map<String, List<VerificationResult>> resultsByDomain(RunState state) {
        Map<String, String> domainOf = state.claims().stream()
                .collect(Collectors.toMap(Claim::id, Claim::domain, (a, b) -> a));
        Map<String, List<VerificationResult>> grouped = new LinkedHashMap<>();
        for (VerificationResult result : state.results()) {
            grouped.computeIfAbsent(domainOf.get(result.claimId()), d -> new ArrayList<>()).add(result);
        }
        return grouped;
    }

    // =========================================================================
    //  Regeneration, ledger, failure
    // =========================================================================

    private Artifact regenerate(Artifact previous, RemediationPlan plan) {
        Artifact generated;
        try {
            generated = generator.regenerate(previous, plan);
        } catch (GenerationFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationFailureException("Generator failed for artifact %s v%d"
                    .formatted(previous.artifactId(), previous.version()), e);
        }
        if (generated == null) {
            throw new GenerationFailureException("Generator returned no artifact for %s v%d"
                    .formatted(previous.artifactId(), previous.version()));
        }
        Artifact next = previous.nextVersion(generated.content());
        log.info("Artifact {} regenerated: v{} -> v{} ({} target claim(s))",
                previous.artifactId(), previous.version(), next.version(), plan.targetClaimIds().size());
        return next;
    }

    private void snapshot(RunState state, RemediationPlan plan, RunStatus status) {
        IterationSnapshot snapshot = new IterationSnapshot(
                state.runId(),
                state.iteration(),
                state.artifactVersion(),
                state.artifact().contentHash(),
                state.claims(),
                state.results(),
                plan,
                status,
                Instant.now());
        ledger.append(snapshot);
        state.record(snapshot);
    }

    private void checkCancelled(RunState state) {
        if (state.isCancelRequested() || Thread.currentThread().isInterrupted()) {
            throw new RunCancelledException(state.runId());
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private void fail(RunState state, FailureKind kind, String message, String domainId, List<String> claimIds) {
        if (state.isTerminal()) {
            log.error("Run {} is already {}, dropping {} - {}", state.runId(), state.status(), kind, message);
            return;
        }
        RunFailure failure = new RunFailure(kind, message, domainId, claimIds, state.lastSnapshot().orElse(null));
        state.fail(failure);
        if (kind == FailureKind.CANCELLED) {
            log.warn("Run {} cancelled at iteration {}", state.runId(), state.iteration());
        } else {
            log.error("Run {} failed at iteration {}: {} - {}", state.runId(), state.iteration(), kind, message);
        }
    }
}
