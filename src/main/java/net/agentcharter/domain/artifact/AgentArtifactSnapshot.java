package net.agentcharter.domain.artifact;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time read of an agent's charter plus the claim state of every artifact kind.
 */
public record AgentArtifactSnapshot(UUID agentId,
                                    String name,
                                    String charter,
                                    Map<ArtifactKind, ArtifactState> states) {

    public AgentArtifactSnapshot {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId is required");
        }
        charter = charter == null ? "" : charter;
        EnumMap<ArtifactKind, ArtifactState> copy = new EnumMap<>(ArtifactKind.class);
        if (states != null) {
            copy.putAll(states);
        }
        states = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the state for {@code kind}, or an empty state when the row carried none.
     */
    public ArtifactState state(ArtifactKind kind) {
        ArtifactState state = states.get(kind);
        return state != null ? state : ArtifactState.empty(kind);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "this agent" : name.trim();
    }
}
