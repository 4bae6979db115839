package com.eainde.verify.report;

import com.eainde.verify.loop.RunFailure;
import com.eainde.verify.loop.RunState;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.ClaimSeverity;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a markdown report of a run: summary, compliance score, severity breakdown and the
 * latest verdict of every claim.
 */
public class RunReportGenerator {

    private static final List<Verdict> VERDICT_ORDER =
            List.of(Verdict.FALSIFIED, Verdict.PARTIAL, Verdict.UNVERIFIABLE, Verdict.VERIFIED);

    public String render(RunState state) {
        List<VerificationResult> results = state.results();
        Map<String, Claim> claims = state.claims().stream()
                .collect(Collectors.toMap(Claim::id, Function.identity(), (a, b) -> a));
        Map<Verdict, Long> counts = new EnumMap<>(Verdict.class);
        for (Verdict v : Verdict.values()) {
            counts.put(v, results.stream().filter(r -> r.verdict() == v).count());
        }

        StringBuilder md = new StringBuilder();
        md.append("# Verification Report: ").append(state.artifact().artifactId()).append("\n\n");
        md.append("| Metric | Value |\n|--------|-------|\n");
        md.append("| Run | ").append(state.runId()).append(" |\n");
        md.append("| Status | ").append(state.status()).append(" |\n");
        md.append("| Iterations | ").append(state.iteration()).append(" of ").append(state.maxIterations()).append(" |\n");
        md.append("| Artifact version | ").append(state.artifactVersion()).append(" |\n");
        md.append("| Total claims | ").append(results.size()).append(" |\n");
        for (Verdict v : VERDICT_ORDER) {
            md.append("| ").append(v).append(" | ").append(counts.get(v)).append(" |\n");
        }
        md.append("| **Compliance score** | **")
                .append(String.format(Locale.ROOT, "%.1f", complianceScore(results)))
                .append("%** |\n\n");

        state.failure().ifPresent(f -> appendFailure(md, f));
        appendSeverityTable(md, results, claims);
        appendFindings(md, results, claims);
        return md.toString();
    }

    /**
     * {@code (verified + 0.5 * partial) / (total - unverifiable) * 100}; 0 when nothing was assessed.
     */
    public static double complianceScore(List<VerificationResult> results) {
        long verified = results.stream().filter(r -> r.verdict() == Verdict.VERIFIED).count();
        long partial = results.stream().filter(r -> r.verdict() == Verdict.PARTIAL).count();
        long assessed = results.stream().filter(r -> r.verdict() != Verdict.UNVERIFIABLE).count();
        return assessed == 0 ? 0.0 : (verified + partial * 0.5) / assessed * 100.0;
    }

    private static void appendFailure(StringBuilder md, RunFailure failure) {
        md.append("## Failure\n\n");
        md.append("- Kind: ").append(failure.kind()).append('\n');
        md.append("- Message: ").append(failure.message()).append('\n');
        if (failure.domainId() != null) {
            md.append("- Domain: ").append(failure.domainId()).append('\n');
        }
        if (!failure.claimIds().isEmpty()) {
            md.append("- Claims: ").append(String.join(", ", failure.claimIds())).append('\n');
        }
        md.append('\n');
    }

    private static void appendSeverityTable(StringBuilder md, List<VerificationResult> results, Map<String, Claim> claims) {
        md.append("## By Severity\n\n");
        md.append("| Severity | FALSIFIED | PARTIAL | UNVERIFIABLE | VERIFIED |\n");
        md.append("|----------|-----------|---------|--------------|----------|\n");
        for (ClaimSeverity severity : ClaimSeverity.values()) {
            md.append("| ").append(severity);
            for (Verdict v : VERDICT_ORDER) {
                long n = results.stream()
                        .filter(r -> r.verdict() == v)
                        .filter(r -> severityOf(claims.get(r.claimId())) == severity)
                        .count();
                md.append(" | ").append(n);
            }
            md.append(" |\n");
        }
        md.append('\n');
    }

    private static void appendFindings(StringBuilder md, List<VerificationResult> results, Map<String, Claim> claims) {
        md.append("## Findings\n\n");
        results.stream()
                .sorted(Comparator.comparingInt((VerificationResult r) -> VERDICT_ORDER.indexOf(r.verdict()))
                        .thenComparing(r -> severityOf(claims.get(r.claimId()))))
                .forEach(r -> {
                    Claim claim = claims.get(r.claimId());
                    md.append("- **").append(r.verdict()).append("** `").append(r.claimId()).append("` [")
                            .append(severityOf(claim)).append("] ")
                            .append(claim == null ? "" : claim.statement()).append('\n');
                    if (r.evidence() != null && !r.evidence().isBlank()) {
                        md.append("  > ").append(r.evidence()).append('\n');
                    }
                });
    }

    private static ClaimSeverity severityOf(Claim claim) {
        return claim == null ? ClaimSeverity.MEDIUM : claim.severity();
    }
}
