package net.agentcharter.domain.artifact;

/**
 * How an artifact's freshness relates to the agent's current charter.
 */
public enum FreshnessPolicy {
    /** Fresh only while the recorded source hash equals the current charter fingerprint. */
    CHARTER_BOUND,
    /** Fresh as soon as a value exists; a charter edit never regenerates it. */
    STICKY
}
