package net.agentcharter.application.agent;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.agentcharter.adapters.persistence.PersistentAgentRepository;
import net.agentcharter.application.artifact.ArtifactScheduler;
import net.agentcharter.domain.artifact.AgentArtifactSnapshot;
import net.agentcharter.domain.artifact.ArtifactClaimStore;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactKindRegistry;
import net.agentcharter.domain.artifact.ArtifactState;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.ScheduleOutcome;
import net.agentcharter.support.storage.AvatarImageStorage;
import net.agentcharter.util.ContentFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates agents and edits charters, scheduling artifact regeneration in the same transaction.
 *
 * <p>Because scheduling runs inside the write transaction, jobs are only enqueued once the new
 * charter is committed.</p>
 */
@Service
public class AgentCharterService {

    private static final Logger log = LoggerFactory.getLogger(AgentCharterService.class);

    public static final String MINI_DESCRIPTION_PLACEHOLDER = "Agent";
    public static final String SOURCE_MINI = "mini";
    public static final String SOURCE_PLACEHOLDER = "placeholder";

    private final PersistentAgentRepository agentRepository;
    private final ArtifactClaimStore claimStore;
    private final ArtifactScheduler scheduler;
    private final ArtifactKindRegistry kindRegistry;
    private final AvatarImageStorage avatarImageStorage;

    public AgentCharterService(PersistentAgentRepository agentRepository,
                               ArtifactClaimStore claimStore,
                               ArtifactScheduler scheduler,
                               ArtifactKindRegistry kindRegistry,
                               AvatarImageStorage avatarImageStorage) {
        this.agentRepository = agentRepository;
        this.claimStore = claimStore;
        this.scheduler = scheduler;
        this.kindRegistry = kindRegistry;
        this.avatarImageStorage = avatarImageStorage;
    }

    @Transactional
    public CharterUpdate createAgent(String name, String charter) {
        UUID agentId = agentRepository.insertAgent(name, charter);
        Map<ArtifactKind, ScheduleOutcome> outcomes = scheduler.ensureAllFresh(agentId);
        log.info("Created agent {} ({} artifact kinds scheduled)", agentId, countScheduled(outcomes));
        return new CharterUpdate(agentId, outcomes);
    }

    /**
     * Replaces the charter and schedules every artifact kind that no longer matches it.
     *
     * @throws IllegalArgumentException when the agent does not exist
     */
    @Transactional
    public CharterUpdate updateCharter(UUID agentId, String charter) {
        if (!agentRepository.updateCharter(agentId, charter)) {
            throw new IllegalArgumentException("Agent not found: " + agentId);
        }
        Map<ArtifactKind, ScheduleOutcome> outcomes = scheduler.ensureAllFresh(agentId);
        log.info("Updated charter of agent {} ({} artifact kinds scheduled)", agentId, countScheduled(outcomes));
        return new CharterUpdate(agentId, outcomes);
    }

    public Optional<AgentPresentation> presentation(UUID agentId) {
        return claimStore.findAgent(agentId).map(this::toPresentation);
    }

    private AgentPresentation toPresentation(AgentArtifactSnapshot agent) {
        String charterHash = ContentFingerprint.fingerprint(agent.charter());
        Map<ArtifactKind, Boolean> freshness = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : kindRegistry.kinds()) {
            freshness.put(kind, agent.state(kind).isFreshFor(charterHash, kindRegistry.descriptor(kind).freshnessPolicy()));
        }

        String mini = textOf(agent.state(ArtifactKind.MINI_DESCRIPTION));
        boolean hasMini = StringUtils.hasText(mini);

        String avatarUrl = null;
        if (agent.state(ArtifactKind.AVATAR).value() instanceof ArtifactValue.ImageReference avatar && avatar.isPresent()) {
            avatarUrl = avatarImageStorage.publicUrl(avatar.storageKey());
        }

        List<String> tags = agent.state(ArtifactKind.TAGS).value() instanceof ArtifactValue.TagList tagList
            ? tagList.tags()
            : List.of();

        return new AgentPresentation(
            agent.agentId(),
            agent.name(),
            textOf(agent.state(ArtifactKind.SHORT_DESCRIPTION)),
            hasMini ? mini.trim() : MINI_DESCRIPTION_PLACEHOLDER,
            hasMini ? SOURCE_MINI : SOURCE_PLACEHOLDER,
            tags,
            textOf(agent.state(ArtifactKind.VISUAL_DESCRIPTION)),
            avatarUrl,
            Map.copyOf(freshness)
        );
    }

    private static String textOf(ArtifactState state) {
        return state.value() instanceof ArtifactValue.Text text ? text.text() : "";
    }

    private static long countScheduled(Map<ArtifactKind, ScheduleOutcome> outcomes) {
        return outcomes.values().stream().filter(ScheduleOutcome::isScheduled).count();
    }

    /**
     * Result of a charter write.
     *
     * @param agentId affected agent
     * @param outcomes scheduling outcome per artifact kind
     */
    public record CharterUpdate(UUID agentId, Map<ArtifactKind, ScheduleOutcome> outcomes) {
    }
}
