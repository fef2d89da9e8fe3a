package net.agentcharter.domain.artifact;

import java.util.UUID;
import org.springframework.util.StringUtils;

/**
 * Unit of work handed to the job queue: generate {@code kind} for {@code agentId} as long as the
 * claim still equals {@code expectedHash}.
 */
public record ArtifactJob(UUID agentId, ArtifactKind kind, String expectedHash, JobLane lane) {

    public ArtifactJob {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (!StringUtils.hasText(expectedHash)) {
            throw new IllegalArgumentException("expectedHash is required");
        }
        lane = lane == null ? JobLane.INTERACTIVE : lane;
    }

    public ArtifactJob(UUID agentId, ArtifactKind kind, String expectedHash) {
        this(agentId, kind, expectedHash, JobLane.INTERACTIVE);
    }

    public String describe() {
        return kind.label() + ":" + agentId + ":" + expectedHash.substring(0, Math.min(12, expectedHash.length()));
    }
}
