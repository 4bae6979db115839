package com.eainde.verify.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured guidance for fixing failed claims, handed to the artifact generator.
 * <p>
 * {@code targetClaimIds} keeps the order in which guidance should be applied;
 * {@code perClaimGuidance} is keyed by claim id.
 * </p>
 */
public record RemediationPlan(
        List<String> targetClaimIds,
        Map<String, ClaimGuidance> perClaimGuidance,
        int producedAtIteration
) {

    public RemediationPlan {
        targetClaimIds = targetClaimIds == null ? List.of() : List.copyOf(targetClaimIds);
        perClaimGuidance = perClaimGuidance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(perClaimGuidance));
    }

    public static RemediationPlan empty(int iteration) {
        return new RemediationPlan(List.of(), Map.of(), iteration);
    }

    public static RemediationPlan of(List<ClaimGuidance> guidance, int iteration) {
        Map<String, ClaimGuidance> byClaim = new LinkedHashMap<>();
        for (ClaimGuidance g : guidance) {
            byClaim.putIfAbsent(g.claimId(), g);
        }
        return new RemediationPlan(new ArrayList<>(byClaim.keySet()), byClaim, iteration);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return targetClaimIds.isEmpty();
    }

    @JsonIgnore
    public List<ClaimGuidance> guidanceInOrder() {
        return targetClaimIds.stream()
                .map(perClaimGuidance::get)
                .toList();
    }
}
