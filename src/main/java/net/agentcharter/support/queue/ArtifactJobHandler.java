package net.agentcharter.support.queue;

import net.agentcharter.domain.artifact.ArtifactJob;
import net.agentcharter.domain.artifact.WorkerOutcome;

/**
 * Consumer side of {@link ArtifactJobQueue}.
 */
public interface ArtifactJobHandler {

    /**
     * Executes the job. Throwing marks the attempt as failed and makes the queue retry it.
     */
    WorkerOutcome handle(ArtifactJob job);

    /**
     * Called once a job has failed its last attempt or was abandoned by a queue shutdown.
     * Implementations release the job's claim.
     */
    void onDeadLetter(ArtifactJob job, RuntimeException lastFailure);
}
