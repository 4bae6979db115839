package com.eainde.verify.router;

import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;
import com.eainde.verify.registry.DomainRegistry;
import com.eainde.verify.thread.MdcAwareExecutor;
import com.eainde.verify.verifier.DomainVerifier;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.log4j.Log4j2;

import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches a claim to the verifier bound to its domain.
 *
 * <h3>Steps:</h3>
 * <ol>
 * <li>Resolve the domain through the {@link DomainRegistry}. An unknown or inactive domain throws
 * {@link com.eainde.verify.error.DomainNotFoundException}; that is run-fatal and not converted.</li>
 * <li>Call {@code verify} on the adapter executor under a {@link TimeLimiter}; a call that
 * outlives the timeout is cancelled.</li>
 * <li>Retry timeouts and crashes with exponential backoff.</li>
 * <li>When the retry budget is spent, return an {@code UNVERIFIABLE} result describing the
 * failure. Adapter exceptions never leave this class.</li>
 * </ol>
 * A call that returns a result (whatever its verdict) is final and is not retried.
 */
@Log4j2
public class VerifierRouter {

    private final DomainRegistry registry;
    private final MdcAwareExecutor adapterExecutor;
    private final VerifierCallPolicy policy;
    private final Retry retry;
    private final TimeLimiter timeLimiter;

    public VerifierRouter(DomainRegistry registry, MdcAwareExecutor adapterExecutor, VerifierCallPolicy policy) {
        this.registry = registry;
        this.adapterExecutor = adapterExecutor;
        this.policy = policy;
        this.retry = Retry.of("verifier-router", RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(policy.initialBackoff(), policy.backoffMultiplier()))
                .retryOnException(e -> !(e instanceof InterruptedException))
                .build());
        this.timeLimiter = TimeLimiter.of("verifier-router", TimeLimiterConfig.custom()
                .timeoutDuration(policy.timeout())
                .cancelRunningFuture(true)
                .build());
    }

    /**
     * @throws com.eainde.verify.error.DomainNotFoundException if the claim's domain cannot be resolved
     */
    public VerificationResult dispatch(Claim claim, Artifact artifact) {
        DomainVerifier verifier = registry.resolveVerifier(claim.domain());
        AtomicInteger attempts = new AtomicInteger();

        Callable<VerificationResult> guarded = Retry.decorateCallable(retry, () -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                log.debug("Retrying claim {} on {} (attempt {}/{})",
                        claim.id(), verifier.oracleId(), attempt, policy.maxAttempts());
            }
            return timeLimiter.executeFutureSupplier(
                    () -> adapterExecutor.submit(() -> callAdapter(verifier, claim, artifact)));
        });

        try {
            VerificationResult result = guarded.call();
            return result.withAttempts(attempts.get());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            AdapterFailure failure = e instanceof TimeoutException ? AdapterFailure.TIMEOUT : AdapterFailure.CRASH;
            log.warn("Claim {} downgraded to UNVERIFIABLE after {} attempt(s) on {}: {} ({})",
                    claim.id(), attempts.get(), verifier.oracleId(), failure, describe(e));
            return unverifiable(claim, verifier.oracleId(), failure, e, attempts.get());
        }
    }

    private static VerificationResult callAdapter(DomainVerifier verifier, Claim claim, Artifact artifact) {
        VerificationResult result;
        try {
            result = verifier.verify(claim, artifact);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            throw new InvalidAdapterResultException("Adapter raised " + e, e);
        }
        if (result == null) {
            throw new InvalidAdapterResultException("Adapter returned no result for claim " + claim.id());
        }
        if (!claim.id().equals(result.claimId())) {
            throw new InvalidAdapterResultException("Adapter answered claim %s when asked for %s"
                    .formatted(result.claimId(), claim.id()));
        }
        return result;
    }

    private static VerificationResult unverifiable(Claim claim, String oracleId, AdapterFailure failure,
                                                   Exception cause, int attempts) {
        String evidence = "%s after %d attempt(s): %s".formatted(
                failure == AdapterFailure.TIMEOUT ? "AdapterTimeout" : "AdapterCrash", attempts, describe(cause));
        return new VerificationResult(claim.id(), Verdict.UNVERIFIABLE, evidence, oracleId, Instant.now(), attempts);
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    static final class InvalidAdapterResultException extends RuntimeException {

        InvalidAdapterResultException(String message) {
            super(message);
        }

        InvalidAdapterResultException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
