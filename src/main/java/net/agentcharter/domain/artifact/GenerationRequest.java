package net.agentcharter.domain.artifact;

import java.util.UUID;

/**
 * Input handed to an artifact generator.
 *
 * @param agentId agent the artifact is produced for
 * @param agentName display name, may be blank
 * @param charter charter text the claim was taken against
 * @param prerequisiteValue value of the prerequisite kind, or {@code null} when the kind has none
 */
public record GenerationRequest(UUID agentId, String agentName, String charter, ArtifactValue prerequisiteValue) {

    public GenerationRequest {
        agentName = agentName == null ? "" : agentName.trim();
        charter = charter == null ? "" : charter;
    }

    public String prerequisiteText() {
        return prerequisiteValue instanceof ArtifactValue.Text text ? text.text() : "";
    }
}
