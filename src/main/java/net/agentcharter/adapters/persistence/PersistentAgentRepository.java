package net.agentcharter.adapters.persistence;

import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Writes the agent row fields that drive artifact generation: name and charter.
 */
@Repository
public class PersistentAgentRepository {

    private final JdbcTemplate jdbcTemplate;

    public PersistentAgentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts a new agent row with empty artifact columns.
     *
     * @return generated agent id
     */
    public UUID insertAgent(String name, String charter) {
        UUID agentId = UUID.randomUUID();
        jdbcTemplate.update(
            """
            INSERT INTO persistent_agents (id, name, charter, created_at, updated_at)
            VALUES (?, ?, ?, NOW(), NOW())
            """,
            agentId,
            name == null ? "" : name.trim(),
            charter == null ? "" : charter
        );
        return agentId;
    }

    /**
     * Replaces the charter text.
     *
     * @return {@code false} when the agent does not exist
     */
    public boolean updateCharter(UUID agentId, String charter) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId is required");
        }
        int updated = jdbcTemplate.update(
            "UPDATE persistent_agents SET charter = ?, updated_at = NOW() WHERE id = ?",
            charter == null ? "" : charter,
            agentId
        );
        return updated == 1;
    }
}
