package net.agentcharter.application.generation;

import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.support.ai.OpenAiChatCompletionClient;
import org.springframework.stereotype.Component;

/**
 * Three discovery tags describing capabilities or audiences.
 */
@Component
public class TagsGenerator extends OpenAiTextArtifactGenerator {

    private static final String SYSTEM_PROMPT = """
        You label AI agents so they are easy to discover.
        Given an agent charter, reply with a JSON array containing exactly three short tags.
        Each tag should be at most three words, written in title case, and focus on capabilities or audiences.
        Do not include explanations or additional text.
        """;

    private final TagListParser tagListParser;

    public TagsGenerator(OpenAiChatCompletionClient chatClient, TagListParser tagListParser) {
        super(chatClient, ArtifactKind.TAGS);
        this.tagListParser = tagListParser;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected ArtifactValue toValue(String raw, GenerationRequest request) {
        return new ArtifactValue.TagList(tagListParser.parse(raw));
    }
}
