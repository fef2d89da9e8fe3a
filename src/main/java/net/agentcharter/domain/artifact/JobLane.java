package net.agentcharter.domain.artifact;

/**
 * Priority lane of a generation job. Charter edits run ahead of backfill sweeps.
 */
public enum JobLane {
    INTERACTIVE,
    BACKFILL
}
