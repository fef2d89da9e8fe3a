package net.agentcharter.domain.artifact;

import java.util.Locale;

/**
 * Charter-derived presentation artifacts maintained for every persistent agent.
 *
 * <p>The column prefix names the three claim columns of a kind in {@code persistent_agents}:
 * {@code <prefix>_charter_hash}, {@code <prefix>_requested_hash} and the value column(s).</p>
 */
public enum ArtifactKind {
    SHORT_DESCRIPTION("short_description"),
    MINI_DESCRIPTION("mini_description"),
    TAGS("tags"),
    VISUAL_DESCRIPTION("visual_description"),
    AVATAR("avatar");

    private final String columnPrefix;

    ArtifactKind(String columnPrefix) {
        this.columnPrefix = columnPrefix;
    }

    public String columnPrefix() {
        return columnPrefix;
    }

    public String sourceHashColumn() {
        return columnPrefix + "_charter_hash";
    }

    public String requestedHashColumn() {
        return columnPrefix + "_requested_hash";
    }

    /**
     * Settings-store key holding the backfill cursor for this kind, e.g. {@code AGENT_AVATAR_BACKFILL_CURSOR}.
     */
    public String backfillCursorKey() {
        return "AGENT_" + name() + "_BACKFILL_CURSOR";
    }

    /**
     * Lower-case label used in log lines and configuration keys.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
