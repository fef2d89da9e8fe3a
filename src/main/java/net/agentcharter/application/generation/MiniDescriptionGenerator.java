package net.agentcharter.application.generation;

import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.support.ai.OpenAiChatCompletionClient;
import org.springframework.stereotype.Component;

/**
 * Ultra-short role label, e.g. "Sales Pipeline Assistant".
 */
@Component
public class MiniDescriptionGenerator extends OpenAiTextArtifactGenerator {

    private static final String SYSTEM_PROMPT = """
        You name the role of an AI agent in a few words.
        Given the agent's charter, reply with a label of at most five words, such as "Sales Pipeline Assistant".
        No punctuation at the end, no quotes, no explanation.
        """;

    public MiniDescriptionGenerator(OpenAiChatCompletionClient chatClient) {
        super(chatClient, ArtifactKind.MINI_DESCRIPTION);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected long maxTokens() {
        return 40L;
    }

    @Override
    protected ArtifactValue toValue(String raw, GenerationRequest request) {
        return new ArtifactValue.Text(ArtifactTextNormalizer.miniDescription(raw));
    }
}
