package com.eainde.verify.verifier;

import com.eainde.verify.extract.DomainContext;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.VerificationResult;

import java.util.List;

/**
 * Pluggable oracle bound to one domain.
 * <p>
 * The engine owns the protocol (claim, verdict, remediation, re-iteration); every judgment of
 * what counts as correct lives behind this interface. Implementations are created by a
 * {@link VerifierAdapterFactory} when their domain is registered.
 * </p>
 *
 * <h3>Contract:</h3>
 * <ul>
 *   <li>{@link #verify} judges a single claim and must be safe to call repeatedly. The
 *   router may call it again after a timeout or crash.</li>
 *   <li>{@link #remediate} only ever receives FALSIFIED/PARTIAL results of claims this
 *   verifier judged, and must not produce guidance for any other claim.</li>
 *   <li>Returning {@code UNVERIFIABLE} is reserved for "my backend could not answer".</li>
 * </ul>
 */
public interface DomainVerifier {

    /**
     * Identifier recorded on every result this oracle produces.
     */
    String oracleId();

    /**
     * Optional hook to augment or replace the template-extracted claims for this domain.
     * Returned claims must keep this verifier's domain id.
     */
    default List<Claim> extractClaims(Artifact artifact, DomainContext context, List<Claim> baseline) {
        return baseline;
    }

    VerificationResult verify(Claim claim, Artifact artifact);

    RemediationPlan remediate(List<VerificationResult> failures, List<Claim> claims, int iteration);
}
