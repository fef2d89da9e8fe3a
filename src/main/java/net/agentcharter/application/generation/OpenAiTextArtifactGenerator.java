package net.agentcharter.application.generation;

import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.domain.artifact.GenerationResult;
import net.agentcharter.support.ai.ArtifactGenerationException;
import net.agentcharter.support.ai.OpenAiChatCompletionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for text artifacts produced by one chat completion over the charter.
 */
public abstract class OpenAiTextArtifactGenerator implements ArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextArtifactGenerator.class);

    private final OpenAiChatCompletionClient chatClient;
    private final ArtifactKind kind;

    protected OpenAiTextArtifactGenerator(OpenAiChatCompletionClient chatClient, ArtifactKind kind) {
        this.chatClient = chatClient;
        this.kind = kind;
    }

    @Override
    public ArtifactKind kind() {
        return kind;
    }

    @Override
    public boolean isAvailable() {
        return chatClient.isAvailable();
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String raw;
        try {
            raw = chatClient.complete(kind.label() + " generation", systemPrompt(), userPrompt(request), maxTokens());
        } catch (ArtifactGenerationException ex) {
            log.warn("{} generation failed for agent {}: {}", kind.label(), request.agentId(), ex.getMessage());
            return GenerationResult.failure(ex.getMessage());
        }
        ArtifactValue value = toValue(raw, request);
        if (value == null || !value.isPresent()) {
            return GenerationResult.failure(kind.label() + " generation produced no usable output");
        }
        return GenerationResult.success(value);
    }

    protected abstract String systemPrompt();

    protected String userPrompt(GenerationRequest request) {
        return request.charter().trim();
    }

    protected long maxTokens() {
        return 200L;
    }

    /**
     * Converts the raw completion into the stored value; an absent value marks the attempt failed.
     */
    protected abstract ArtifactValue toValue(String raw, GenerationRequest request);
}
