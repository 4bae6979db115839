package com.eainde.verify.verifier;

import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.ClaimGuidance;
import com.eainde.verify.model.RemediationAction;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import lombok.extern.log4j.Log4j2;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Uses a chat model as the oracle of a domain.
 * <p>
 * The model answers {@code {"verdict": "PASS|PARTIAL|FAIL|N/A", "reasoning": "..."}}. A reply that
 * cannot be parsed is thrown as an exception, which the router retries and finally reports as
 * UNVERIFIABLE. {@code N/A} (the artifact gives no basis to judge the claim) is a domain judgment
 * and maps to FALSIFIED, so remediation makes the artifact address the claim.
 * </p>
 */
@Log4j2
public class LlmJudgeVerifier implements DomainVerifier {

    static final String JUDGE_SYSTEM = """
            You are a strict auditor checking whether an artifact fulfils a claim made about it.
            Assign one verdict:
            - PASS: the artifact fully supports the claim
            - PARTIAL: the artifact supports some aspects of the claim, others are missing or incomplete
            - FAIL: the artifact does not support the claim, or contradicts it
            - N/A: the claim cannot be judged from the artifact at all
            Be strict: if the claim says "AES-256" and the artifact shows "AES-128", that is FAIL.
            %s
            Return ONLY a JSON object: {"verdict": "PASS", "reasoning": "one or two sentences"}
            """;

    static final String REMEDIATION_SYSTEM = """
            You are a senior engineer writing fix guidance for claims an artifact does not fulfil.
            For each claim return a task with:
            - claimId: the claim id, exactly as given
            - action: one of "add", "modify", "remove", "configure"
            - guidance: 2-4 sentences of specific, actionable instructions
            For PARTIAL claims focus on what is missing. For FALSIFIED claims describe the full approach.
            Return ONLY a JSON array: [{"claimId": "...", "action": "add", "guidance": "..."}]
            """;

    private final String domainId;
    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String instructions;
    private final int maxArtifactChars;

    LlmJudgeVerifier(String domainId, ChatModel chatModel, ObjectMapper objectMapper,
                     String instructions, int maxArtifactChars) {
        this.domainId = domainId;
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.instructions = instructions == null ? "" : instructions;
        this.maxArtifactChars = maxArtifactChars;
    }

    @Override
    public String oracleId() {
        return "llm-judge:" + domainId;
    }

    @Override
    public VerificationResult verify(Claim claim, Artifact artifact) {
        String user = """
                CLAIM %s:
                %s

                ARTIFACT %s v%d:
                %s
                """.formatted(claim.id(), claim.statement(), artifact.artifactId(), artifact.version(),
                truncate(artifact.content()));

        JsonNode reply = ask(JUDGE_SYSTEM.formatted(instructions), user);
        String verdict = reply.path("verdict").asText("").strip().toUpperCase(Locale.ROOT);
        String reasoning = reply.path("reasoning").asText("");

        Verdict mapped = switch (verdict) {
            case "PASS" -> Verdict.VERIFIED;
            case "PARTIAL" -> Verdict.PARTIAL;
            case "FAIL", "N/A" -> Verdict.FALSIFIED;
            default -> throw new IllegalStateException("Judge returned unknown verdict '%s' for claim %s"
                    .formatted(verdict, claim.id()));
        };
        String evidence = "N/A".equals(verdict) ? "Artifact does not address the claim: " + reasoning : reasoning;
        return new VerificationResult(claim.id(), mapped, evidence, oracleId(), Instant.now(), 1);
    }

    @Override
    public RemediationPlan remediate(List<VerificationResult> failures, List<Claim> claims, int iteration) {
        Map<String, Claim> claimsById = claims.stream()
                .collect(Collectors.toMap(Claim::id, Function.identity(), (a, b) -> a));

        StringBuilder user = new StringBuilder("FAILED CLAIMS:\n");
        for (VerificationResult failure : failures) {
            Claim claim = claimsById.get(failure.claimId());
            user.append("- ").append(failure.claimId())
                    .append(" [").append(failure.verdict()).append("] ")
                    .append(claim == null ? "" : claim.statement())
                    .append("\n  Evidence: ").append(failure.evidence())
                    .append('\n');
        }

        JsonNode reply = ask(REMEDIATION_SYSTEM, user.toString());
        if (!reply.isArray()) {
            throw new IllegalStateException("Remediation reply for domain " + domainId + " is not a JSON array");
        }

        Map<String, VerificationResult> failureById = failures.stream()
                .collect(Collectors.toMap(VerificationResult::claimId, Function.identity(), (a, b) -> a));
        List<ClaimGuidance> guidance = new ArrayList<>();
        for (JsonNode task : reply) {
            String claimId = task.path("claimId").asText("");
            VerificationResult failure = failureById.get(claimId);
            if (failure == null) {
                log.debug("Domain {}: ignoring task for unknown claim '{}'", domainId, claimId);
                continue;
            }
            guidance.add(new ClaimGuidance(claimId, domainId, failure.verdict(),
                    parseAction(task.path("action").asText("")), task.path("guidance").asText("")));
        }
        return RemediationPlan.of(guidance, iteration);
    }

    private JsonNode ask(String system, String user) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(system), UserMessage.from(user)))
                .build();
        String text = chatModel.chat(request).aiMessage().text();
        try {
            return objectMapper.readTree(LlmReplies.stripFences(text));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unparseable reply from judge model for domain " + domainId, e);
        }
    }

    private String truncate(String content) {
        return content.length() <= maxArtifactChars ? content : content.substring(0, maxArtifactChars) + "\n[truncated]";
    }

    static RemediationAction parseAction(String action) {
        try {
            return RemediationAction.valueOf(action.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return RemediationAction.MODIFY;
        }
    }
}
