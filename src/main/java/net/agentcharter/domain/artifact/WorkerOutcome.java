package net.agentcharter.domain.artifact;

/**
 * Result of executing one generation job.
 */
public enum WorkerOutcome {
    PERSISTED,
    AGENT_MISSING,
    STALE_CLAIM,
    PREREQUISITE_MISSING,
    GENERATION_FAILED,
    /** The value was produced but a newer claim owns the kind now; the result was discarded. */
    CLAIM_SUPERSEDED
}
