package net.agentcharter.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.agentcharter.domain.artifact.AgentArtifactSnapshot;
import net.agentcharter.domain.artifact.ArtifactClaimStore;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactState;
import net.agentcharter.domain.artifact.ArtifactValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for artifact claims stored on {@code persistent_agents}.
 *
 * <p>Each kind owns a value column (two for avatars), a {@code <kind>_charter_hash} column and a
 * {@code <kind>_requested_hash} column. Hash columns are {@code NOT NULL DEFAULT ''}. Every
 * mutation is one conditional {@code UPDATE}, which makes row-level locking the only
 * synchronization the claim protocol relies on.</p>
 */
@Repository
public class AgentArtifactRepository implements ArtifactClaimStore {

    private static final Logger log = LoggerFactory.getLogger(AgentArtifactRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AgentArtifactRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<AgentArtifactSnapshot> findAgent(UUID agentId) {
        requireAgentId(agentId);
        String sql = """
            SELECT id, name, charter,
                   short_description, short_description_charter_hash, short_description_requested_hash,
                   mini_description, mini_description_charter_hash, mini_description_requested_hash,
                   tags::text AS tags_json, tags_charter_hash, tags_requested_hash,
                   visual_description, visual_description_charter_hash, visual_description_requested_hash,
                   avatar_storage_key, avatar_content_type, avatar_charter_hash, avatar_requested_hash
            FROM persistent_agents
            WHERE id = ?
            """;
        return jdbcTemplate.query(
            sql,
            rs -> rs.next() ? Optional.of(mapSnapshot(rs)) : Optional.<AgentArtifactSnapshot>empty(),
            agentId
        );
    }

    @Override
    public boolean tryClaim(UUID agentId, ArtifactKind kind, String charterHash) {
        requireAgentId(agentId);
        requireKind(kind);
        requireHash(charterHash, "charterHash");
        String sql = """
            UPDATE persistent_agents
            SET %1$s = ?, updated_at = NOW()
            WHERE id = ? AND %1$s IS DISTINCT FROM ?
            """.formatted(kind.requestedHashColumn());
        return jdbcTemplate.update(sql, charterHash, agentId, charterHash) == 1;
    }

    /**
     * Runs in its own transaction: it is also called from after-commit callbacks, where writes
     * joining the finished transaction would never be committed.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean clearClaim(UUID agentId, ArtifactKind kind, String expectedHash) {
        requireAgentId(agentId);
        requireKind(kind);
        requireHash(expectedHash, "expectedHash");
        String sql = """
            UPDATE persistent_agents
            SET %1$s = ''
            WHERE id = ? AND %1$s = ?
            """.formatted(kind.requestedHashColumn());
        return jdbcTemplate.update(sql, agentId, expectedHash) == 1;
    }

    @Override
    public boolean clearAnyClaim(UUID agentId, ArtifactKind kind) {
        requireAgentId(agentId);
        requireKind(kind);
        String sql = """
            UPDATE persistent_agents
            SET %1$s = ''
            WHERE id = ? AND %1$s <> ''
            """.formatted(kind.requestedHashColumn());
        return jdbcTemplate.update(sql, agentId) == 1;
    }

    @Override
    public boolean persistResult(UUID agentId,
                                 ArtifactKind kind,
                                 ArtifactValue value,
                                 String sourceHash,
                                 String expectedHash) {
        requireAgentId(agentId);
        requireKind(kind);
        requireHash(sourceHash, "sourceHash");
        requireHash(expectedHash, "expectedHash");
        if (value == null || !value.isPresent()) {
            throw new IllegalArgumentException("A present value is required to persist " + kind);
        }

        int updated = switch (kind) {
            case SHORT_DESCRIPTION, MINI_DESCRIPTION, VISUAL_DESCRIPTION ->
                updateConditionally(agentId, kind, kind.columnPrefix() + " = ?", sourceHash, expectedHash,
                    textOf(kind, value));
            case TAGS ->
                updateConditionally(agentId, kind, "tags = CAST(? AS jsonb)", sourceHash, expectedHash,
                    serializeTags(value));
            case AVATAR -> {
                if (!(value instanceof ArtifactValue.ImageReference reference)) {
                    throw new IllegalArgumentException("Avatar must be stored before persisting; got " + value);
                }
                yield updateConditionally(agentId, kind, "avatar_storage_key = ?, avatar_content_type = ?",
                    sourceHash, expectedHash, reference.storageKey(), reference.contentType());
            }
        };
        return updated == 1;
    }

    @Override
    public List<UUID> findBackfillCandidates(ArtifactKind kind, UUID afterAgentId, int limit) {
        requireKind(kind);
        if (limit <= 0) {
            return List.of();
        }
        String cursorClause = afterAgentId == null ? "" : "AND id > ?";
        String sql = """
            SELECT id
            FROM persistent_agents
            WHERE btrim(charter) <> ''
              AND %1$s = ''
              AND %2$s = ''
              %3$s
            ORDER BY id
            LIMIT ?
            """.formatted(kind.requestedHashColumn(), kind.sourceHashColumn(), cursorClause);
        Object[] args = afterAgentId == null ? new Object[] {limit} : new Object[] {afterAgentId, limit};
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getObject("id", UUID.class), args);
    }

    private int updateConditionally(UUID agentId,
                                    ArtifactKind kind,
                                    String valueAssignments,
                                    String sourceHash,
                                    String expectedHash,
                                    Object... values) {
        String sql = """
            UPDATE persistent_agents
            SET %1$s, %2$s = ?, %3$s = '', updated_at = NOW()
            WHERE id = ? AND %3$s = ?
            """.formatted(valueAssignments, kind.sourceHashColumn(), kind.requestedHashColumn());
        Object[] args = Arrays.copyOf(values, values.length + 3);
        args[values.length] = sourceHash;
        args[values.length + 1] = agentId;
        args[values.length + 2] = expectedHash;
        return jdbcTemplate.update(sql, args);
    }

    private AgentArtifactSnapshot mapSnapshot(ResultSet rs) throws SQLException {
        UUID agentId = rs.getObject("id", UUID.class);
        Map<ArtifactKind, ArtifactState> states = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values()) {
            ArtifactValue value = switch (kind) {
                case SHORT_DESCRIPTION, MINI_DESCRIPTION, VISUAL_DESCRIPTION ->
                    new ArtifactValue.Text(rs.getString(kind.columnPrefix()));
                case TAGS -> new ArtifactValue.TagList(deserializeTags(agentId, rs.getString("tags_json")));
                case AVATAR -> new ArtifactValue.ImageReference(
                    rs.getString("avatar_storage_key"), rs.getString("avatar_content_type"));
            };
            states.put(kind, new ArtifactState(
                kind,
                value,
                rs.getString(kind.sourceHashColumn()),
                rs.getString(kind.requestedHashColumn())
            ));
        }
        return new AgentArtifactSnapshot(agentId, rs.getString("name"), rs.getString("charter"), states);
    }

    private String textOf(ArtifactKind kind, ArtifactValue value) {
        if (!(value instanceof ArtifactValue.Text text)) {
            throw new IllegalArgumentException(kind + " expects a text value; got " + value.getClass().getSimpleName());
        }
        return text.text();
    }

    private String serializeTags(ArtifactValue value) {
        if (!(value instanceof ArtifactValue.TagList tagList)) {
            throw new IllegalArgumentException("TAGS expects a tag list; got " + value.getClass().getSimpleName());
        }
        try {
            return objectMapper.writeValueAsString(tagList.tags());
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize tags " + tagList.tags(), ex);
        }
    }

    private List<String> deserializeTags(UUID agentId, String tagsJson) {
        if (!StringUtils.hasText(tagsJson)) {
            return List.of();
        }
        try {
            String[] tags = objectMapper.readValue(tagsJson, String[].class);
            return tags == null ? List.of() : List.of(tags);
        } catch (JacksonException ex) {
            log.error("Persisted tags for agent {} are not a JSON string array: {}", agentId, tagsJson, ex);
            throw new IllegalStateException("Persisted tags payload is invalid for agent " + agentId, ex);
        }
    }

    private static void requireAgentId(UUID agentId) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId is required");
        }
    }

    private static void requireKind(ArtifactKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
    }

    private static void requireHash(String hash, String name) {
        if (!StringUtils.hasText(hash)) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
