package net.agentcharter.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Rate limiter and circuit breaker shared by all generation provider calls.
 */
@Configuration
public class ResilienceConfig {
    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

    @Value("${app.artifacts.provider.requests-per-minute:60}")
    private int requestsPerMinute;

    @Value("${app.artifacts.provider.permit-wait:PT30S}")
    private Duration permitWait;

    @Value("${app.artifacts.provider.failure-rate-threshold:50}")
    private float failureRateThreshold;

    @Value("${app.artifacts.provider.open-state-wait:PT1M}")
    private Duration openStateWait;

    @Bean
    public RateLimiter generationRateLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, requestsPerMinute))
                .timeoutDuration(permitWait)
                .build();
        RateLimiter rateLimiter = RateLimiter.of("artifactGenerationRateLimiter", config);
        logger.info("Generation rate limiter initialized with limit of {} requests per minute", requestsPerMinute);
        return rateLimiter;
    }

    /**
     * Opens after half of the last twenty provider calls failed and probes again after the wait.
     */
    @Bean
    public CircuitBreaker generationCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(openStateWait)
                .permittedNumberOfCallsInHalfOpenState(2)
                .build();
        CircuitBreaker circuitBreaker = CircuitBreaker.of("artifactGenerationCircuitBreaker", config);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> logger.warn("Generation circuit breaker {}", event.getStateTransition()));
        return circuitBreaker;
    }
}
