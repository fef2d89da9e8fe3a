package net.agentcharter.application.generation;

import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.domain.artifact.GenerationResult;
import net.agentcharter.support.ai.ArtifactGenerationException;
import net.agentcharter.support.ai.OpenAiImageGenerationClient;
import net.agentcharter.util.ImageContentTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Renders a square portrait of the agent from its visual description.
 */
@Component
public class OpenAiAvatarImageGenerator implements ArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAvatarImageGenerator.class);

    static final String AVATAR_SIZE = "1024x1024";
    private static final int CHARTER_CONTEXT_MAX_CHARS = 600;

    private final OpenAiImageGenerationClient imageClient;

    public OpenAiAvatarImageGenerator(OpenAiImageGenerationClient imageClient) {
        this.imageClient = imageClient;
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.AVATAR;
    }

    @Override
    public boolean isAvailable() {
        return imageClient.isAvailable();
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String visualDescription = request.prerequisiteText();
        if (!StringUtils.hasText(visualDescription)) {
            return GenerationResult.failure("Avatar generation requires a visual description");
        }
        byte[] bytes;
        try {
            bytes = imageClient.generate(buildPrompt(request, visualDescription), AVATAR_SIZE);
        } catch (ArtifactGenerationException ex) {
            log.warn("Avatar generation failed for agent {}: {}", request.agentId(), ex.getMessage());
            return GenerationResult.failure(ex.getMessage());
        }
        if (bytes == null || bytes.length == 0) {
            return GenerationResult.failure("Image endpoint returned no bytes");
        }
        return GenerationResult.success(new ArtifactValue.ImagePayload(bytes, ImageContentTypes.sniff(bytes, ImageContentTypes.PNG)));
    }

    static String buildPrompt(GenerationRequest request, String visualDescription) {
        String name = StringUtils.hasText(request.agentName()) ? request.agentName() : "this agent";
        String role = ArtifactTextNormalizer.truncateAtWord(
            ArtifactTextNormalizer.collapseWhitespace(request.charter()), CHARTER_CONTEXT_MAX_CHARS);
        return """
            Square head-and-shoulders portrait photograph of %s, a real person.
            %s
            They work as: %s
            Natural light, friendly approachable expression, softly blurred neutral background.
            No text, logos or watermarks.
            """.formatted(name, visualDescription.trim(), role);
    }
}
