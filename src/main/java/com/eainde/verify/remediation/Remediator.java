package com.eainde.verify.remediation;

import com.eainde.verify.model.Claim;
import com.eainde.verify.model.ClaimGuidance;
import com.eainde.verify.model.RemediationAction;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;
import com.eainde.verify.registry.DomainRegistry;
import com.eainde.verify.verifier.DomainVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Composes one {@link RemediationPlan} from the failures of every domain in an iteration.
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>Only FALSIFIED and PARTIAL results are remediated. UNVERIFIABLE is an infrastructure
 *   outcome and is re-verified next iteration instead.</li>
 *   <li>Each domain verifier sees only its own failures, in batches of {@code batchSize}.</li>
 *   <li>Guidance a domain returns for a claim it was not given is dropped.</li>
 *   <li>FALSIFIED targets come before PARTIAL ones, then claim order.</li>
 *   <li>A domain whose {@code remediate} throws gets fallback guidance built from the evidence.</li>
 * </ul>
 */
public class Remediator {

    private static final Logger log = LoggerFactory.getLogger(Remediator.class);

    private final DomainRegistry registry;
    private final int batchSize;

    public Remediator(DomainRegistry registry, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.registry = registry;
        this.batchSize = batchSize;
    }

    /**
     * @param resultsByDomain latest result of every claim, grouped by the claim's domain
     * @param claims          all claims of the iteration
     */
    public RemediationPlan composePlan(Map<String, List<VerificationResult>> resultsByDomain,
                                       List<Claim> claims,
                                       int iteration) {
        Map<String, Claim> claimsById = claims.stream()
                .collect(Collectors.toMap(Claim::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        Map<String, Integer> claimOrder = new HashMap<>();
        claims.forEach(c -> claimOrder.putIfAbsent(c.id(), claimOrder.size()));

        List<ClaimGuidance> merged = new ArrayList<>();
        for (Map.Entry<String, List<VerificationResult>> entry : resultsByDomain.entrySet()) {
            String domainId = entry.getKey();
            List<VerificationResult> failures = entry.getValue().stream()
                    .filter(r -> r.verdict().isRemediable())
                    .toList();
            if (failures.isEmpty()) {
                continue;
            }
            merged.addAll(remediateDomain(domainId, failures, claimsById, iteration));
        }

        merged.sort(Comparator
                .comparing((ClaimGuidance g) -> g.verdict() == Verdict.FALSIFIED ? 0 : 1)
                .thenComparing(g -> claimOrder.getOrDefault(g.claimId(), Integer.MAX_VALUE)));

        RemediationPlan plan = RemediationPlan.of(merged, iteration);
        log.info("Remediation plan for iteration {}: {} target claim(s) across {} domain(s)",
                iteration, plan.targetClaimIds().size(), resultsByDomain.size());
        return plan;
    }

    private List<ClaimGuidance> remediateDomain(String domainId,
                                                List<VerificationResult> failures,
                                                Map<String, Claim> claimsById,
                                                int iteration) {
        DomainVerifier verifier = registry.resolveVerifier(domainId);
        Map<String, VerificationResult> failureById = failures.stream()
                .collect(Collectors.toMap(VerificationResult::claimId, Function.identity(), (a, b) -> b, LinkedHashMap::new));

        List<ClaimGuidance> out = new ArrayList<>();
        int totalBatches = (failures.size() + batchSize - 1) / batchSize;
        for (int i = 0; i < failures.size(); i += batchSize) {
            List<VerificationResult> batch = failures.subList(i, Math.min(i + batchSize, failures.size()));
            List<Claim> batchClaims = batch.stream()
                    .map(r -> claimsById.get(r.claimId()))
                    .filter(c -> c != null)
                    .toList();
            Set<String> allowed = batch.stream().map(VerificationResult::claimId).collect(Collectors.toSet());

            log.debug("Domain {}: remediation batch {}/{} ({} failure(s))",
                    domainId, i / batchSize + 1, totalBatches, batch.size());

            RemediationPlan domainPlan;
            try {
                domainPlan = verifier.remediate(List.copyOf(batch), batchClaims, iteration);
            } catch (RuntimeException e) {
                log.warn("Domain {} failed to remediate {} claim(s), using evidence-based guidance: {}",
                        domainId, batch.size(), e.getMessage());
                domainPlan = null;
            }

            if (domainPlan == null) {
                batch.forEach(r -> out.add(fallbackGuidance(domainId, r)));
                continue;
            }

            for (ClaimGuidance guidance : domainPlan.guidanceInOrder()) {
                if (guidance == null || !allowed.contains(guidance.claimId())) {
                    log.warn("Domain {} returned guidance for claim {} outside its batch, dropped",
                            domainId, guidance == null ? null : guidance.claimId());
                    continue;
                }
                VerificationResult failure = failureById.get(guidance.claimId());
                // Domain and verdict always come from the engine, never from the adapter.
                out.add(new ClaimGuidance(guidance.claimId(), domainId, failure.verdict(),
                        guidance.action(), guidance.guidance()));
                allowed.remove(guidance.claimId());
            }
            // Failures the adapter left without guidance still need to reach the generator.
            for (String missing : allowed) {
                out.add(fallbackGuidance(domainId, failureById.get(missing)));
            }
        }
        return out;
    }

    private static ClaimGuidance fallbackGuidance(String domainId, VerificationResult failure) {
        String text = failure.verdict() == Verdict.FALSIFIED
                ? "Claim does not hold. Evidence: " + failure.evidence()
                : "Claim only partially holds, complete what is missing. Evidence: " + failure.evidence();
        return new ClaimGuidance(failure.claimId(), domainId, failure.verdict(), RemediationAction.MODIFY, text);
    }
}
