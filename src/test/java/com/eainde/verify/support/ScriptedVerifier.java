package com.eainde.verify.support;

import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.ClaimGuidance;
import com.eainde.verify.model.RemediationAction;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;
import com.eainde.verify.verifier.DomainVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test oracle whose verdicts come from a script. Records every call it receives.
 */
public class ScriptedVerifier implements DomainVerifier {

    @FunctionalInterface
    public interface Judge {
        Verdict judge(Claim claim, Artifact artifact) throws Exception;
    }

    private final String domainId;
    private final Judge judge;
    private final AtomicInteger verifyCalls = new AtomicInteger();
    private final List<List<VerificationResult>> remediateCalls = new CopyOnWriteArrayList<>();

    public ScriptedVerifier(String domainId, Judge judge) {
        this.domainId = domainId;
        this.judge = judge;
    }

    public static ScriptedVerifier always(String domainId, Verdict verdict) {
        return new ScriptedVerifier(domainId, (claim, artifact) -> verdict);
    }

    @Override
    public String oracleId() {
        return "scripted:" + domainId;
    }

    @Override
    public VerificationResult verify(Claim claim, Artifact artifact) {
        verifyCalls.incrementAndGet();
        Verdict verdict;
        try {
            verdict = judge.judge(claim, artifact);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
        return new VerificationResult(claim.id(), verdict, "scripted " + verdict, oracleId(), Instant.now(), 1);
    }

    @Override
    public RemediationPlan remediate(List<VerificationResult> failures, List<Claim> claims, int iteration) {
        remediateCalls.add(List.copyOf(failures));
        List<ClaimGuidance> guidance = failures.stream()
                .map(f -> new ClaimGuidance(f.claimId(), domainId, f.verdict(), RemediationAction.MODIFY, "fix " + f.claimId()))
                .toList();
        return RemediationPlan.of(guidance, iteration);
    }

    public int verifyCalls() {
        return verifyCalls.get();
    }

    public List<List<VerificationResult>> remediateCalls() {
        return remediateCalls;
    }
}
