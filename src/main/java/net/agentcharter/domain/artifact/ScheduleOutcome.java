package net.agentcharter.domain.artifact;

/**
 * Result of asking the scheduler to make one artifact kind fresh.
 */
public enum ScheduleOutcome {
    /** A claim was taken and a job enqueued (or registered to enqueue after commit). */
    SCHEDULED,
    /** The artifact is fresh, already claimed for this charter, or the charter is empty. */
    NOT_NEEDED,
    /** Another caller won the claim for the same charter. */
    CLAIM_LOST,
    /** The queue rejected the job; the claim was released. */
    ENQUEUE_FAILED,
    /** No generator is configured for the kind. */
    GENERATOR_UNAVAILABLE;

    public boolean isScheduled() {
        return this == SCHEDULED;
    }
}
