package net.agentcharter.domain.artifact;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for per-kind artifact claims.
 *
 * <p>Every mutating operation is a single conditional write. Empty strings stand for absent
 * hashes; implementations never store {@code null} in the hash columns.</p>
 */
public interface ArtifactClaimStore {

    Optional<AgentArtifactSnapshot> findAgent(UUID agentId);

    /**
     * Sets the requested hash for {@code kind} unless it already equals {@code charterHash}.
     *
     * @return {@code true} when this caller now owns the claim; {@code false} for a duplicate
     * claim or a missing agent
     */
    boolean tryClaim(UUID agentId, ArtifactKind kind, String charterHash);

    /**
     * Clears the requested hash only while it still equals {@code expectedHash}.
     */
    boolean clearClaim(UUID agentId, ArtifactKind kind, String expectedHash);

    /**
     * Clears whatever claim is outstanding. Used when the charter has become empty.
     */
    boolean clearAnyClaim(UUID agentId, ArtifactKind kind);

    /**
     * Writes the value and its source hash and clears the claim, in one write guarded by
     * {@code requested_hash = expectedHash}.
     *
     * @return {@code false} when a newer claim superseded this one; nothing is written then
     */
    boolean persistResult(UUID agentId, ArtifactKind kind, ArtifactValue value, String sourceHash, String expectedHash);

    /**
     * Agents with an id greater than {@code afterAgentId} that have a charter, no outstanding claim
     * and no produced value for {@code kind}, ordered by id.
     */
    List<UUID> findBackfillCandidates(ArtifactKind kind, UUID afterAgentId, int limit);
}
