package net.agentcharter.application.agent;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.agentcharter.domain.artifact.ArtifactKind;

/**
 * Read model of an agent's charter-derived artifacts.
 *
 * @param agentId agent id
 * @param name display name
 * @param shortDescription one-line summary, empty until generated
 * @param miniDescription short role label, or {@link AgentCharterService#MINI_DESCRIPTION_PLACEHOLDER}
 * @param miniDescriptionSource {@code mini} when generated, {@code placeholder} otherwise
 * @param tags discovery tags
 * @param visualDescription identity paragraph
 * @param avatarUrl public avatar URL, or {@code null} without an avatar
 * @param freshness whether each kind currently matches the charter
 */
public record AgentPresentation(UUID agentId,
                                String name,
                                String shortDescription,
                                String miniDescription,
                                String miniDescriptionSource,
                                List<String> tags,
                                String visualDescription,
                                String avatarUrl,
                                Map<ArtifactKind, Boolean> freshness) {
}
