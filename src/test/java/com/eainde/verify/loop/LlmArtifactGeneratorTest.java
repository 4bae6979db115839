package com.eainde.verify.loop;

import com.eainde.verify.error.GenerationFailureException;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.ClaimGuidance;
import com.eainde.verify.model.RemediationAction;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.Verdict;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmArtifactGeneratorTest {

    private static final Artifact ARTIFACT = Artifact.initial("guide", "# Guide\n- old text");
    private static final RemediationPlan PLAN = RemediationPlan.of(List.of(
            new ClaimGuidance("c-1", "docs", Verdict.FALSIFIED, RemediationAction.MODIFY, "Say TLS 1.3"),
            new ClaimGuidance("c-2", "docs", Verdict.PARTIAL, RemediationAction.ADD, "Mention retention")), 1);

    @Mock
    private ChatModel chatModel;

    private LlmArtifactGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new LlmArtifactGenerator(chatModel);
    }

    private void reply(String text) {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
    }

    @Test
    @DisplayName("returns the next version with the model's content, fences removed")
    void regenerates() {
        reply("```markdown\n# Guide\n- new text\n```");

        Artifact next = generator.regenerate(ARTIFACT, PLAN);

        assertThat(next.artifactId()).isEqualTo("guide");
        assertThat(next.version()).isEqualTo(2);
        assertThat(next.content()).isEqualTo("# Guide\n- new text");
    }

    @Test
    @DisplayName("sends the tasks in plan order along with the previous artifact")
    void prompt() {
        reply("# Guide\n- new text");

        generator.regenerate(ARTIFACT, PLAN);

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        String user = ((UserMessage) captor.getValue().messages().get(1)).singleText();
        assertThat(user).contains("1. [FALSIFIED, MODIFY] c-1 (docs): Say TLS 1.3")
                .contains("2. [PARTIAL, ADD] c-2 (docs): Mention retention")
                .contains("ARTIFACT guide v1:")
                .endsWith("- old text");
    }

    @Test
    @DisplayName("a blank reply is a generation failure")
    void blankReply() {
        reply("   ");

        assertThatThrownBy(() -> generator.regenerate(ARTIFACT, PLAN))
                .isInstanceOf(GenerationFailureException.class);
    }

    @Test
    @DisplayName("a failing model call is a generation failure")
    void modelFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("quota"));

        assertThatThrownBy(() -> generator.regenerate(ARTIFACT, PLAN))
                .isInstanceOf(GenerationFailureException.class)
                .hasRootCauseMessage("quota");
    }
}
