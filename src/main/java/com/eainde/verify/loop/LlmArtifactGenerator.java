package com.eainde.verify.loop;

import com.eainde.verify.error.GenerationFailureException;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.ClaimGuidance;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.verifier.LlmReplies;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Rewrites the artifact with a chat model, applying the remediation guidance in plan order.
 */
@Log4j2
public class LlmArtifactGenerator implements ArtifactGenerator {

    static final String SYSTEM = """
            You revise an existing artifact so that it fulfils the claims listed as failing.
            Apply every task in the given order. FALSIFIED claims must be fixed completely,
            PARTIAL claims need only what is missing. Keep everything else unchanged.
            Return ONLY the full revised artifact, without commentary.
            """;

    private final ChatModel chatModel;

    public LlmArtifactGenerator(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public Artifact regenerate(Artifact previous, RemediationPlan plan) {
        StringBuilder user = new StringBuilder("TASKS:\n");
        int n = 1;
        for (ClaimGuidance g : plan.guidanceInOrder()) {
            user.append(n++).append(". [").append(g.verdict()).append(", ").append(g.action()).append("] ")
                    .append(g.claimId()).append(" (").append(g.domainId()).append("): ")
                    .append(g.guidance()).append('\n');
        }
        user.append("\nARTIFACT ").append(previous.artifactId()).append(" v").append(previous.version()).append(":\n")
                .append(previous.content());

        String content;
        try {
            ChatRequest request = ChatRequest.builder()
                    .messages(List.of(SystemMessage.from(SYSTEM), UserMessage.from(user.toString())))
                    .build();
            content = LlmReplies.stripFences(chatModel.chat(request).aiMessage().text());
        } catch (RuntimeException e) {
            throw new GenerationFailureException("Model call failed while regenerating " + previous.artifactId(), e);
        }

        if (content.isBlank()) {
            throw new GenerationFailureException("Model returned empty content for " + previous.artifactId());
        }
        log.info("Regenerated {} from v{} applying {} task(s)",
                previous.artifactId(), previous.version(), plan.targetClaimIds().size());
        return previous.nextVersion(content);
    }
}
