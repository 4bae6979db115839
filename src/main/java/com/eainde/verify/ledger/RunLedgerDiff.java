package com.eainde.verify.ledger;

import com.eainde.verify.model.Claim;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Claim-level comparison of two snapshots of the same run.
 */
public record RunLedgerDiff(
        int fromIteration,
        int toIteration,
        List<VerdictFlip> flips,
        List<String> addedClaimIds,
        List<String> removedClaimIds
) {

    public record VerdictFlip(String claimId, Verdict before, Verdict after) {

        public boolean isImprovement() {
            return before != Verdict.VERIFIED && after == Verdict.VERIFIED;
        }

        public boolean isRegression() {
            return before == Verdict.VERIFIED && after != Verdict.VERIFIED;
        }
    }

    public static RunLedgerDiff between(IterationSnapshot from, IterationSnapshot to) {
        if (!from.runId().equals(to.runId())) {
            throw new IllegalArgumentException("Snapshots belong to different runs: %s, %s"
                    .formatted(from.runId(), to.runId()));
        }
        Map<String, Verdict> before = verdicts(from);
        Map<String, Verdict> after = verdicts(to);

        List<VerdictFlip> flips = new ArrayList<>();
        List<String> added = new ArrayList<>();
        for (Map.Entry<String, Verdict> entry : after.entrySet()) {
            Verdict previous = before.get(entry.getKey());
            if (!before.containsKey(entry.getKey())) {
                added.add(entry.getKey());
            } else if (previous != entry.getValue()) {
                flips.add(new VerdictFlip(entry.getKey(), previous, entry.getValue()));
            }
        }
        List<String> removed = before.keySet().stream()
                .filter(id -> !after.containsKey(id))
                .toList();
        return new RunLedgerDiff(from.iteration(), to.iteration(), List.copyOf(flips), List.copyOf(added), removed);
    }

    public List<VerdictFlip> regressions() {
        return flips.stream().filter(VerdictFlip::isRegression).toList();
    }

    public List<VerdictFlip> improvements() {
        return flips.stream().filter(VerdictFlip::isImprovement).toList();
    }

    // Claims without a result map to null so they still take part in added/removed.
    private static Map<String, Verdict> verdicts(IterationSnapshot snapshot) {
        Map<String, Verdict> out = new LinkedHashMap<>();
        for (Claim claim : snapshot.claims()) {
            out.put(claim.id(), null);
        }
        for (VerificationResult result : snapshot.results()) {
            out.put(result.claimId(), result.verdict());
        }
        return out;
    }
}
