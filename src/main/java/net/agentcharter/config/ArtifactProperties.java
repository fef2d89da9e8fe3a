package net.agentcharter.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import net.agentcharter.domain.artifact.ArtifactKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for artifact generation jobs and backfill sweeps.
 */
@Component
@ConfigurationProperties(prefix = "app.artifacts")
public class ArtifactProperties {

    private final Queue queue = new Queue();
    private final Backfill backfill = new Backfill();

    @PostConstruct
    void validate() {
        Assert.isTrue(queue.maxParallel > 0, "app.artifacts.queue.max-parallel must be positive");
        Assert.isTrue(queue.maxPending > 0, "app.artifacts.queue.max-pending must be positive");
        Assert.isTrue(queue.maxAttempts > 0, "app.artifacts.queue.max-attempts must be positive");
        Assert.isTrue(!queue.retryBackoff.isNegative(), "app.artifacts.queue.retry-backoff must be non-negative");
        Assert.isTrue(backfill.batchSize > 0, "app.artifacts.backfill.batch-size must be positive");
        Assert.isTrue(backfill.scanLimit >= backfill.batchSize,
            "app.artifacts.backfill.scan-limit must be at least the batch size");
    }

    public Queue getQueue() {
        return queue;
    }

    public Backfill getBackfill() {
        return backfill;
    }

    public static class Queue {

        /**
         * Jobs executing at once.
         */
        private int maxParallel = 2;

        /**
         * Jobs waiting to start before enqueue is refused.
         */
        private int maxPending = 10_000;

        /**
         * Executions of a job that throws before it is dead-lettered.
         */
        private int maxAttempts = 3;

        /**
         * Base delay between attempts; the n-th retry waits n times this value.
         */
        private Duration retryBackoff = Duration.ofSeconds(2);

        public int getMaxParallel() {
            return maxParallel;
        }

        public void setMaxParallel(int maxParallel) {
            this.maxParallel = maxParallel;
        }

        public int getMaxPending() {
            return maxPending;
        }

        public void setMaxPending(int maxPending) {
            this.maxPending = maxPending;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }
    }

    public static class Backfill {

        private boolean enabled = true;

        /**
         * Jobs scheduled per kind per sweep.
         */
        private int batchSize = 10;

        /**
         * Candidate rows read per kind per sweep.
         */
        private int scanLimit = 100;

        private Set<ArtifactKind> disabledKinds = EnumSet.noneOf(ArtifactKind.class);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getScanLimit() {
            return scanLimit;
        }

        public void setScanLimit(int scanLimit) {
            this.scanLimit = scanLimit;
        }

        public Set<ArtifactKind> getDisabledKinds() {
            return disabledKinds;
        }

        public void setDisabledKinds(Set<ArtifactKind> disabledKinds) {
            EnumSet<ArtifactKind> copy = EnumSet.noneOf(ArtifactKind.class);
            if (disabledKinds != null) {
                copy.addAll(disabledKinds);
            }
            this.disabledKinds = copy;
        }

        public boolean isEnabledFor(ArtifactKind kind) {
            return enabled && !disabledKinds.contains(kind);
        }
    }
}
