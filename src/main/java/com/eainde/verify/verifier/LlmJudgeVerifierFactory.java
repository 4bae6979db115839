package com.eainde.verify.verifier;

import com.eainde.verify.error.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Builds {@link LlmJudgeVerifier}s. Config: {@code {"instructions": "...", "maxArtifactChars": 20000}},
 * both optional. Needs a {@link ChatModel} bean in the context.
 */
public class LlmJudgeVerifierFactory implements VerifierAdapterFactory {

    public static final String TYPE = "llm-judge";
    static final int DEFAULT_MAX_ARTIFACT_CHARS = 20_000;

    private final ObjectProvider<ChatModel> chatModel;
    private final ObjectMapper objectMapper;

    public LlmJudgeVerifierFactory(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public String adapterType() {
        return TYPE;
    }

    @Override
    public DomainVerifier create(String domainId, JsonNode config) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new ConfigurationException("Domain '%s' uses the llm-judge adapter but no ChatModel bean is configured"
                    .formatted(domainId));
        }
        int maxChars = config.path("maxArtifactChars").asInt(DEFAULT_MAX_ARTIFACT_CHARS);
        if (maxChars < 1) {
            throw new ConfigurationException("Domain '%s': maxArtifactChars must be positive".formatted(domainId));
        }
        return new LlmJudgeVerifier(domainId, model, objectMapper, config.path("instructions").asText(""), maxChars);
    }
}
