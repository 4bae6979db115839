package com.eainde.verify.verifier;

import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.ClaimGuidance;
import com.eainde.verify.model.RemediationAction;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.VerificationResult;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static rule oracle: a claim holds when every rule that applies to its statement finds its
 * required pattern in the artifact.
 * <ul>
 *   <li>no applicable rule, or all satisfied: VERIFIED</li>
 *   <li>some satisfied: PARTIAL</li>
 *   <li>none satisfied: FALSIFIED</li>
 * </ul>
 */
@Log4j2
public class PatternRuleVerifier implements DomainVerifier {

    static final String MISSING_MARKER = "Rules missing: ";

    private final String domainId;
    private final List<PatternRule> rules;

    PatternRuleVerifier(String domainId, List<PatternRule> rules) {
        this.domainId = domainId;
        this.rules = List.copyOf(rules);
    }

    @Override
    public String oracleId() {
        return "pattern-rule:" + domainId;
    }

    @Override
    public VerificationResult verify(Claim claim, Artifact artifact) {
        List<PatternRule> applicable = rules.stream()
                .filter(r -> r.appliesTo(claim.statement()))
                .toList();
        if (applicable.isEmpty()) {
            return VerificationResult.verified(claim.id(), oracleId(), "No rule applies to this claim");
        }

        List<String> satisfied = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (PatternRule rule : applicable) {
            (rule.isSatisfiedBy(artifact.content()) ? satisfied : missing).add(rule.id());
        }

        if (missing.isEmpty()) {
            return VerificationResult.verified(claim.id(), oracleId(), "Rules satisfied: " + String.join(", ", satisfied));
        }
        String evidence = (satisfied.isEmpty() ? "" : "Rules satisfied: " + String.join(", ", satisfied) + ". ")
                + MISSING_MARKER + String.join(", ", missing);
        return satisfied.isEmpty()
                ? VerificationResult.falsified(claim.id(), oracleId(), evidence)
                : VerificationResult.partial(claim.id(), oracleId(), evidence);
    }

    @Override
    public RemediationPlan remediate(List<VerificationResult> failures, List<Claim> claims, int iteration) {
        Map<String, PatternRule> byId = rules.stream()
                .collect(Collectors.toMap(PatternRule::id, Function.identity(), (a, b) -> a));
        List<ClaimGuidance> guidance = new ArrayList<>();
        for (VerificationResult failure : failures) {
            String text = missingRules(failure.evidence()).stream()
                    .map(byId::get)
                    .filter(r -> r != null && r.guidance() != null)
                    .map(PatternRule::guidance)
                    .collect(Collectors.joining(" "));
            if (text.isEmpty()) {
                text = "Make the artifact satisfy: " + failure.evidence();
            }
            guidance.add(new ClaimGuidance(failure.claimId(), domainId, failure.verdict(), RemediationAction.ADD, text));
        }
        log.debug("Domain {}: guidance for {} claim(s)", domainId, guidance.size());
        return RemediationPlan.of(guidance, iteration);
    }

    static Set<String> missingRules(String evidence) {
        if (evidence == null) {
            return Set.of();
        }
        int idx = evidence.indexOf(MISSING_MARKER);
        if (idx < 0) {
            return Set.of();
        }
        return Arrays.stream(evidence.substring(idx + MISSING_MARKER.length()).split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
