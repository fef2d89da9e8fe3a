package net.agentcharter.support.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.Test;

class OpenAiChatCompletionClientTest {

    @Test
    void should_AppendV1AndTrimSlashes_When_NormalizingBaseUrl() {
        assertThat(OpenAiChatCompletionClient.normalizeSdkBaseUrl("https://llm.example.com/")).isEqualTo("https://llm.example.com/v1");
        assertThat(OpenAiChatCompletionClient.normalizeSdkBaseUrl("https://api.openai.com/v1//")).isEqualTo("https://api.openai.com/v1");
        assertThat(OpenAiChatCompletionClient.normalizeSdkBaseUrl(" ")).isEqualTo("https://api.openai.com/v1");
    }

    @Test
    void should_BeUnavailable_When_ApiKeyIsSentinel() {
        GenerationCallGuard guard = new GenerationCallGuard(RateLimiter.ofDefaults("test"), CircuitBreaker.ofDefaults("test"));
        OpenAiChatCompletionClient client = new OpenAiChatCompletionClient(guard, "not-configured", "", "", 30, 30);

        assertThat(client.isAvailable()).isFalse();
        assertThat(client.configuredModel()).isEqualTo("gpt-5-mini");
        assertThatThrownBy(() -> client.complete("tags generation", "system", "user", 10))
            .isInstanceOf(ArtifactGenerationException.class);
    }
}
