package net.agentcharter.support.ai;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Runs provider calls through the shared rate limiter and circuit breaker.
 */
@Component
public class GenerationCallGuard {

    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;

    public GenerationCallGuard(RateLimiter generationRateLimiter, CircuitBreaker generationCircuitBreaker) {
        this.rateLimiter = generationRateLimiter;
        this.circuitBreaker = generationCircuitBreaker;
    }

    /**
     * Executes {@code call}; a refused permit surfaces as {@link ArtifactGenerationException}.
     */
    public <T> T call(String operation, Supplier<T> call) {
        Supplier<T> guarded = RateLimiter.decorateSupplier(rateLimiter,
            CircuitBreaker.decorateSupplier(circuitBreaker, call));
        try {
            return guarded.get();
        } catch (RequestNotPermitted ex) {
            throw new ArtifactGenerationException(operation + " rejected by rate limiter", ex);
        } catch (CallNotPermittedException ex) {
            throw new ArtifactGenerationException(operation + " rejected: provider circuit is open", ex);
        }
    }
}
