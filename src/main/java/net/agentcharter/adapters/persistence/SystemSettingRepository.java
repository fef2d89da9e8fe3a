package net.agentcharter.adapters.persistence;

import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

/**
 * Key/value settings persisted in {@code system_settings}; holds backfill cursors.
 */
@Repository
public class SystemSettingRepository {

    private final JdbcTemplate jdbcTemplate;

    public SystemSettingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> find(String key) {
        requireKey(key);
        String value = jdbcTemplate.query(
            "SELECT value_text FROM system_settings WHERE key = ?",
            rs -> rs.next() ? rs.getString("value_text") : null,
            key
        );
        return Optional.ofNullable(value);
    }

    /**
     * Inserts or overwrites the setting. A {@code null} value is stored as the empty string.
     */
    public void save(String key, String value) {
        requireKey(key);
        jdbcTemplate.update(
            """
            INSERT INTO system_settings (key, value_text, updated_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (key) DO UPDATE
            SET value_text = EXCLUDED.value_text, updated_at = NOW()
            """,
            key,
            value == null ? "" : value
        );
    }

    private static void requireKey(String key) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException("key is required");
        }
    }
}
