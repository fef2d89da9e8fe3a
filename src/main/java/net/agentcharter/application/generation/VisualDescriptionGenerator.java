package net.agentcharter.application.generation;

import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.support.ai.OpenAiChatCompletionClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Stable physical identity paragraph that avatar prompts are built from.
 *
 * <p>When the model returns nothing usable the charter itself becomes the description, so an
 * avatar can still be rendered.</p>
 */
@Component
public class VisualDescriptionGenerator extends OpenAiTextArtifactGenerator {

    private static final String SYSTEM_PROMPT = """
        You design authentic, warm visual identities for AI agents. Given the agent's name and charter,
        write one flowing prose paragraph describing who this person is: their stable physical identity
        that will remain consistent across different photos and contexts.

        Naturally weave in physical traits (skin tone, eye color, facial features, hair, approximate age,
        build), their natural expression and energy, and their personal style sensibility.

        Do not describe lighting, camera angles, settings or how they are photographed.
        Avoid fantasy elements, celebrities, copyrighted characters, bullet lists or disclaimers.
        """;

    public VisualDescriptionGenerator(OpenAiChatCompletionClient chatClient) {
        super(chatClient, ArtifactKind.VISUAL_DESCRIPTION);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String userPrompt(GenerationRequest request) {
        String name = StringUtils.hasText(request.agentName()) ? request.agentName() : "this agent";
        return "Agent name: " + name + "\n\nCharter:\n" + request.charter().trim();
    }

    @Override
    protected long maxTokens() {
        return 600L;
    }

    @Override
    protected ArtifactValue toValue(String raw, GenerationRequest request) {
        String prepared = ArtifactTextNormalizer.visualDescription(raw);
        if (prepared.isEmpty()) {
            prepared = ArtifactTextNormalizer.visualDescription(request.charter());
        }
        return new ArtifactValue.Text(prepared);
    }
}
