package net.agentcharter.support.queue;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.agentcharter.config.ArtifactProperties;
import net.agentcharter.domain.artifact.ArtifactJob;
import net.agentcharter.domain.artifact.JobLane;
import net.agentcharter.domain.artifact.WorkerOutcome;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * In-process job queue with bounded parallel execution and a bounded pending backlog.
 *
 * <p>Interactive jobs always start before pending backfill jobs. A job whose handler throws is
 * retried after a linearly growing delay; after {@code maxAttempts} executions it is
 * dead-lettered.</p>
 *
 * <p>Shutting down dead-letters every job that will not run to completion here: pending jobs,
 * jobs waiting for a retry, and running jobs that outlive the shutdown grace period. Handlers use
 * that callback to release whatever the job was holding.</p>
 */
@Service
@Slf4j
public class InMemoryArtifactJobQueue implements ArtifactJobQueue {

    private static final int MAX_ALLOWED_PARALLEL = 20;
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final Supplier<ArtifactJobHandler> handlerSupplier;
    private final ExecutorService executorService;
    private final ScheduledExecutorService retryTimer;
    private final Map<JobLane, Deque<QueuedJob>> pendingByLane;
    private final int maxParallel;
    private final int maxPending;
    private final int maxAttempts;
    private final Duration retryBackoff;

    private final Set<QueuedJob> running = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<QueuedJob> awaitingRetry = Collections.newSetFromMap(new IdentityHashMap<>());

    private int pendingCount;
    private long deadLetteredCount;
    private boolean shutdown;

    @Autowired
    public InMemoryArtifactJobQueue(ObjectProvider<ArtifactJobHandler> handlerProvider, ArtifactProperties properties) {
        this(handlerProvider::getObject,
            properties.getQueue().getMaxParallel(),
            properties.getQueue().getMaxPending(),
            properties.getQueue().getMaxAttempts(),
            properties.getQueue().getRetryBackoff());
    }

    InMemoryArtifactJobQueue(ArtifactJobHandler handler,
                             int maxParallel,
                             int maxPending,
                             int maxAttempts,
                             Duration retryBackoff) {
        this(() -> handler, maxParallel, maxPending, maxAttempts, retryBackoff);
    }

    private InMemoryArtifactJobQueue(Supplier<ArtifactJobHandler> handlerSupplier,
                                     int maxParallel,
                                     int maxPending,
                                     int maxAttempts,
                                     Duration retryBackoff) {
        this.handlerSupplier = handlerSupplier;
        this.maxParallel = Math.min(Math.max(1, maxParallel), MAX_ALLOWED_PARALLEL);
        this.maxPending = Math.max(1, maxPending);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
        this.pendingByLane = new EnumMap<>(JobLane.class);
        for (JobLane lane : JobLane.values()) {
            pendingByLane.put(lane, new ArrayDeque<>());
        }
        this.executorService = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("artifact-job-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "artifact-job-retry");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized boolean enqueue(ArtifactJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job is required");
        }
        if (shutdown) {
            log.warn("Artifact job queue is shut down; refusing {}", job.describe());
            return false;
        }
        if (pendingCount >= maxPending) {
            log.warn("Artifact job queue pending limit reached (pending={}, max={}); refusing {}",
                pendingCount, maxPending, job.describe());
            return false;
        }
        pendingByLane.get(job.lane()).addLast(new QueuedJob(job, 1));
        pendingCount += 1;
        drain();
        return true;
    }

    /**
     * Returns queue depth and concurrency metrics.
     */
    public synchronized QueueSnapshot snapshot() {
        return new QueueSnapshot(running.size(), pendingCount, awaitingRetry.size(), deadLetteredCount, maxParallel);
    }

    @PreDestroy
    void shutdown() {
        List<QueuedJob> abandoned = new ArrayList<>();
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            for (Deque<QueuedJob> pending : pendingByLane.values()) {
                abandoned.addAll(pending);
                pending.clear();
            }
            pendingCount = 0;
            abandoned.addAll(awaitingRetry);
            awaitingRetry.clear();
        }
        retryTimer.shutdownNow();
        executorService.shutdownNow();
        awaitRunningJobs();
        synchronized (this) {
            abandoned.addAll(running);
            running.clear();
        }
        if (!abandoned.isEmpty()) {
            log.warn("Artifact job queue shutting down with {} unfinished job(s)", abandoned.size());
        }
        RuntimeException reason = new IllegalStateException("Artifact job queue shut down");
        for (QueuedJob queued : abandoned) {
            deadLetter(queued, reason);
        }
    }

    private void awaitRunningJobs() {
        try {
            if (!executorService.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Artifact jobs still running {} after shutdown", SHUTDOWN_GRACE);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for running artifact jobs to stop");
        }
    }

    private synchronized void drain() {
        while (!shutdown && running.size() < maxParallel) {
            QueuedJob next = shiftNext();
            if (next == null) {
                return;
            }
            running.add(next);
            executorService.submit(() -> execute(next));
        }
    }

    private QueuedJob shiftNext() {
        for (JobLane lane : JobLane.values()) {
            QueuedJob next = pendingByLane.get(lane).pollFirst();
            if (next != null) {
                pendingCount -= 1;
                return next;
            }
        }
        return null;
    }

    private void execute(QueuedJob queued) {
        try {
            WorkerOutcome outcome = handlerSupplier.get().handle(queued.job());
            log.debug("Artifact job {} finished with {} (attempt {})", queued.job().describe(), outcome, queued.attempt());
        } catch (RuntimeException ex) {
            handleFailure(queued, ex);
        } finally {
            synchronized (this) {
                running.remove(queued);
                drain();
            }
        }
    }

    private void handleFailure(QueuedJob queued, RuntimeException failure) {
        if (queued.attempt() < maxAttempts) {
            long delayMillis = retryBackoff.toMillis() * queued.attempt();
            log.warn("Artifact job {} failed on attempt {}/{}; retrying in {} ms: {}",
                queued.job().describe(), queued.attempt(), maxAttempts, delayMillis, failure.getMessage());
            if (scheduleRetry(queued.nextAttempt(), delayMillis)) {
                return;
            }
        }
        deadLetter(queued, failure);
    }

    private synchronized boolean scheduleRetry(QueuedJob retry, long delayMillis) {
        if (shutdown) {
            log.warn("Artifact job queue shut down before retrying {}", retry.job().describe());
            return false;
        }
        awaitingRetry.add(retry);
        retryTimer.schedule(() -> requeue(retry), delayMillis, TimeUnit.MILLISECONDS);
        return true;
    }

    private synchronized void requeue(QueuedJob retry) {
        if (!awaitingRetry.remove(retry)) {
            return;
        }
        pendingByLane.get(retry.job().lane()).addFirst(retry);
        pendingCount += 1;
        drain();
    }

    private void deadLetter(QueuedJob queued, RuntimeException failure) {
        synchronized (this) {
            deadLetteredCount += 1;
        }
        log.error("Artifact job {} dead-lettered after {} attempts", queued.job().describe(), queued.attempt(), failure);
        try {
            handlerSupplier.get().onDeadLetter(queued.job(), failure);
        } catch (RuntimeException cleanupFailure) {
            log.error("Dead-letter cleanup failed for artifact job {}", queued.job().describe(), cleanupFailure);
        }
    }

    private record QueuedJob(ArtifactJob job, int attempt) {
        private QueuedJob nextAttempt() {
            return new QueuedJob(job, attempt + 1);
        }
    }

    /**
     * Point-in-time snapshot of queue depth and concurrency limits.
     *
     * @param running jobs currently executing
     * @param pending jobs waiting to start
     * @param awaitingRetry failed jobs waiting for their backoff to elapse
     * @param deadLettered jobs abandoned since startup
     * @param maxParallel configured concurrency ceiling
     */
    public record QueueSnapshot(int running, int pending, int awaitingRetry, long deadLettered, int maxParallel) {
    }
}
