package net.agentcharter.support.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.core.http.StreamResponse;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletionChunk;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Thin wrapper over the OpenAI chat completions API used by the text artifact generators.
 *
 * <p>Responses are streamed and collected into one string. The client is disabled when no API
 * key is configured.</p>
 */
@Component
public class OpenAiChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatCompletionClient.class);

    static final String DEFAULT_MODEL = "gpt-5-mini";
    static final String API_KEY_SENTINEL = "not-configured";

    private final OpenAIClient openAiClient;
    private final GenerationCallGuard callGuard;
    private final boolean available;
    private final String configuredModel;
    private final long requestTimeoutSeconds;
    private final long readTimeoutSeconds;

    public OpenAiChatCompletionClient(
        GenerationCallGuard callGuard,
        @Value("${AI_DEFAULT_OPENAI_API_KEY:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${AI_DEFAULT_OPENAI_BASE_URL:${OPENAI_BASE_URL:https://api.openai.com/v1}}") String baseUrl,
        @Value("${AI_DEFAULT_LLM_MODEL:${OPENAI_MODEL:" + DEFAULT_MODEL + "}}") String model,
        @Value("${AI_DEFAULT_OPENAI_REQUEST_TIMEOUT_SECONDS:120}") long requestTimeoutSeconds,
        @Value("${AI_DEFAULT_OPENAI_READ_TIMEOUT_SECONDS:75}") long readTimeoutSeconds
    ) {
        this.callGuard = callGuard;
        this.configuredModel = StringUtils.hasText(model) ? model.trim() : DEFAULT_MODEL;
        this.requestTimeoutSeconds = Math.max(1L, requestTimeoutSeconds);
        this.readTimeoutSeconds = Math.max(1L, readTimeoutSeconds);

        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            String resolvedBaseUrl = normalizeSdkBaseUrl(baseUrl);
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(resolvedBaseUrl)
                .maxRetries(0)
                .build();
            this.available = true;
            log.info("Artifact chat client configured (model={}, baseUrl={})", this.configuredModel, resolvedBaseUrl);
        } else {
            this.openAiClient = null;
            this.available = false;
            log.warn("Artifact chat client is disabled: no API key configured");
        }
    }

    public boolean isAvailable() {
        return available;
    }

    public String configuredModel() {
        return configuredModel;
    }

    /**
     * Sends one system and one user message and returns the concatenated response text.
     *
     * @throws ArtifactGenerationException when the client is disabled, the call fails or is rejected
     */
    public String complete(String operation, String systemPrompt, String userPrompt, long maxTokens) {
        if (!available || openAiClient == null) {
            throw new ArtifactGenerationException("Chat client is not configured");
        }
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(configuredModel))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(
                    ChatCompletionSystemMessageParam.builder().content(systemPrompt).build()
                ),
                ChatCompletionMessageParam.ofUser(
                    ChatCompletionUserMessageParam.builder().content(userPrompt).build()
                )
            ))
            .maxTokens(maxTokens) // some OpenAI-compatible servers only accept max_tokens
            .build();

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(Duration.ofSeconds(requestTimeoutSeconds))
                .read(Duration.ofSeconds(readTimeoutSeconds))
                .build())
            .build();

        return callGuard.call(operation, () -> streamAndCollect(operation, params, options));
    }

    private String streamAndCollect(String operation, ChatCompletionCreateParams params, RequestOptions options) {
        StringBuilder response = new StringBuilder();
        try (StreamResponse<ChatCompletionChunk> stream = openAiClient.chat().completions().createStreaming(params, options)) {
            stream.stream().forEach(chunk -> {
                if (chunk.choices().isEmpty()) {
                    return;
                }
                chunk.choices().get(0).delta().content().ifPresent(response::append);
            });
        } catch (Exception ex) {
            log.error("{} streaming failed (model={})", operation, configuredModel, ex);
            throw new ArtifactGenerationException(operation + " streaming failed", ex);
        }
        return response.toString();
    }

    /**
     * Normalizes an OpenAI-compatible base URL for the SDK: strips trailing slashes and ensures a
     * {@code /v1} suffix.
     */
    public static String normalizeSdkBaseUrl(String value) {
        if (!StringUtils.hasText(value)) {
            return "https://api.openai.com/v1";
        }
        String normalized = value.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (!normalized.endsWith("/v1")) {
            normalized = normalized + "/v1";
        }
        return normalized;
    }
}
