package net.agentcharter.support.queue;

import net.agentcharter.domain.artifact.ArtifactJob;

/**
 * Task queue that delivers generation jobs to the worker.
 *
 * <p>Implementations deliver each accepted job at least once, retry jobs whose execution throws,
 * and hand jobs that exhaust their attempts to {@link ArtifactJobHandler#onDeadLetter}.</p>
 */
public interface ArtifactJobQueue {

    /**
     * Accepts a job for asynchronous execution.
     *
     * @return {@code false} when the queue refused the job; the caller still owns the claim then
     */
    boolean enqueue(ArtifactJob job);
}
