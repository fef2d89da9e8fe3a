package net.agentcharter.support.ai;

import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Calls the OpenAI images endpoint and returns decoded image bytes.
 */
@Component
public class OpenAiImageGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiImageGenerationClient.class);

    static final String DEFAULT_IMAGE_MODEL = "gpt-image-1";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final GenerationCallGuard callGuard;
    private final boolean available;
    private final String imageModel;
    private final Duration requestTimeout;

    public OpenAiImageGenerationClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        GenerationCallGuard callGuard,
        @Value("${AI_DEFAULT_OPENAI_API_KEY:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${AI_DEFAULT_OPENAI_BASE_URL:${OPENAI_BASE_URL:https://api.openai.com/v1}}") String baseUrl,
        @Value("${AI_IMAGE_MODEL:" + DEFAULT_IMAGE_MODEL + "}") String imageModel,
        @Value("${AI_IMAGE_REQUEST_TIMEOUT_SECONDS:180}") long requestTimeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.callGuard = callGuard;
        this.imageModel = StringUtils.hasText(imageModel) ? imageModel.trim() : DEFAULT_IMAGE_MODEL;
        this.requestTimeout = Duration.ofSeconds(Math.max(1L, requestTimeoutSeconds));
        this.available = StringUtils.hasText(apiKey) && !OpenAiChatCompletionClient.API_KEY_SENTINEL.equals(apiKey.trim());
        if (available) {
            this.webClient = webClientBuilder
                .baseUrl(OpenAiChatCompletionClient.normalizeSdkBaseUrl(baseUrl))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey.trim())
                .build();
            log.info("Avatar image client configured (model={})", this.imageModel);
        } else {
            this.webClient = null;
            log.warn("Avatar image client is disabled: no API key configured");
        }
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * Generates one square image for {@code prompt}.
     *
     * @param size image size such as {@code 1024x1024}
     * @return decoded image bytes
     * @throws ArtifactGenerationException when the call fails or the response carries no image
     */
    public byte[] generate(String prompt, String size) {
        if (!available || webClient == null) {
            throw new ArtifactGenerationException("Image client is not configured");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", imageModel);
        body.put("prompt", prompt);
        body.put("n", 1);
        body.put("size", size);
        if (imageModel.startsWith("dall-e")) {
            body.put("response_format", "b64_json");
        }
        String requestJson = serialize(body);

        String responseJson = callGuard.call("avatar image generation", () -> post(requestJson));
        return decodeImage(responseJson);
    }

    private String post(String requestJson) {
        try {
            String response = webClient.post()
                .uri("/images/generations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestJson)
                .retrieve()
                .bodyToMono(String.class)
                .block(requestTimeout);
            if (!StringUtils.hasText(response)) {
                throw new ArtifactGenerationException("Image endpoint returned an empty body");
            }
            return response;
        } catch (WebClientResponseException ex) {
            log.warn("Image endpoint returned {}: {}", ex.getStatusCode(), ex.getResponseBodyAsString());
            throw new ArtifactGenerationException("Image endpoint returned " + ex.getStatusCode(), ex);
        } catch (ArtifactGenerationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ArtifactGenerationException("Image request failed: " + ex.getMessage(), ex);
        }
    }

    byte[] decodeImage(String responseJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseJson);
        } catch (JacksonException ex) {
            throw new ArtifactGenerationException("Image response was not valid JSON", ex);
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            throw new ArtifactGenerationException("Image response contained no data");
        }
        JsonNode encoded = data.get(0).get("b64_json");
        if (encoded == null || encoded.isNull() || !StringUtils.hasText(encoded.asString())) {
            throw new ArtifactGenerationException("Image response contained no b64_json payload");
        }
        try {
            return Base64.getDecoder().decode(encoded.asString().trim());
        } catch (IllegalArgumentException ex) {
            throw new ArtifactGenerationException("Image payload was not valid base64", ex);
        }
    }

    private String serialize(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize image request", ex);
        }
    }
}
