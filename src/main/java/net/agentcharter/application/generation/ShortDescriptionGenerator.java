package net.agentcharter.application.generation;

import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.support.ai.OpenAiChatCompletionClient;
import org.springframework.stereotype.Component;

/**
 * One-line summary shown in agent listings.
 */
@Component
public class ShortDescriptionGenerator extends OpenAiTextArtifactGenerator {

    private static final String SYSTEM_PROMPT = """
        You summarize what an AI agent does for people browsing a list of agents.
        Given the agent's charter, reply with a single plain sentence of at most 160 characters.
        No quotes, no markdown, no preamble.
        """;

    public ShortDescriptionGenerator(OpenAiChatCompletionClient chatClient) {
        super(chatClient, ArtifactKind.SHORT_DESCRIPTION);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected ArtifactValue toValue(String raw, GenerationRequest request) {
        return new ArtifactValue.Text(ArtifactTextNormalizer.shortDescription(raw));
    }
}
