package net.agentcharter.application.artifact;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.agentcharter.application.generation.ArtifactGeneratorRegistry;
import net.agentcharter.domain.artifact.AgentArtifactSnapshot;
import net.agentcharter.domain.artifact.ArtifactClaimStore;
import net.agentcharter.domain.artifact.ArtifactJob;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactKindDescriptor;
import net.agentcharter.domain.artifact.ArtifactKindRegistry;
import net.agentcharter.domain.artifact.ArtifactState;
import net.agentcharter.domain.artifact.JobLane;
import net.agentcharter.domain.artifact.ScheduleOutcome;
import net.agentcharter.support.queue.ArtifactJobQueue;
import net.agentcharter.util.ContentFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Decides whether an artifact kind needs regenerating and, if so, claims it and enqueues exactly
 * one job for the current charter fingerprint.
 *
 * <p>When called inside a transaction the enqueue is deferred until the transaction commits, so a
 * worker never observes an uncommitted charter or claim. A refused enqueue releases the claim.</p>
 */
@Service
public class ArtifactScheduler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactScheduler.class);

    private final ArtifactClaimStore claimStore;
    private final ArtifactJobQueue jobQueue;
    private final ArtifactKindRegistry kindRegistry;
    private final ArtifactGeneratorRegistry generatorRegistry;

    public ArtifactScheduler(ArtifactClaimStore claimStore,
                             ArtifactJobQueue jobQueue,
                             ArtifactKindRegistry kindRegistry,
                             ArtifactGeneratorRegistry generatorRegistry) {
        this.claimStore = claimStore;
        this.jobQueue = jobQueue;
        this.kindRegistry = kindRegistry;
        this.generatorRegistry = generatorRegistry;
    }

    public ScheduleOutcome ensureFresh(UUID agentId, ArtifactKind kind) {
        return ensureFresh(agentId, kind, JobLane.INTERACTIVE);
    }

    /**
     * Schedules generation of {@code kind} for the agent's current charter unless the artifact is
     * already fresh or claimed for it. Expected conditions are reported as outcomes, not exceptions.
     *
     * @param agentId agent to refresh
     * @param kind artifact kind
     * @param lane queue lane for the job
     * @return scheduling outcome
     */
    public ScheduleOutcome ensureFresh(UUID agentId, ArtifactKind kind, JobLane lane) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        Optional<AgentArtifactSnapshot> agent = claimStore.findAgent(agentId);
        if (agent.isEmpty()) {
            log.debug("Skipping {} refresh for missing agent {}", kind.label(), agentId);
            return ScheduleOutcome.NOT_NEEDED;
        }
        return ensureFresh(agent.get(), kind, lane);
    }

    /**
     * Runs {@link #ensureFresh(UUID, ArtifactKind, JobLane)} for every registered kind. A failure for
     * one kind is logged and does not stop the others.
     *
     * @return outcome per kind; kinds that failed are absent
     */
    public Map<ArtifactKind, ScheduleOutcome> ensureAllFresh(UUID agentId) {
        return ensureAllFresh(agentId, JobLane.INTERACTIVE);
    }

    public Map<ArtifactKind, ScheduleOutcome> ensureAllFresh(UUID agentId, JobLane lane) {
        Map<ArtifactKind, ScheduleOutcome> outcomes = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : kindRegistry.kinds()) {
            try {
                outcomes.put(kind, ensureFresh(agentId, kind, lane));
            } catch (RuntimeException ex) {
                log.error("Failed to schedule {} for agent {}", kind.label(), agentId, ex);
            }
        }
        return outcomes;
    }

    private ScheduleOutcome ensureFresh(AgentArtifactSnapshot agent, ArtifactKind kind, JobLane lane) {
        UUID agentId = agent.agentId();
        String charterHash = ContentFingerprint.fingerprint(agent.charter());
        if (charterHash.isEmpty()) {
            if (claimStore.clearAnyClaim(agentId, kind)) {
                log.info("Released {} claim for agent {} after its charter was cleared", kind.label(), agentId);
            }
            return ScheduleOutcome.NOT_NEEDED;
        }

        ArtifactKindDescriptor descriptor = kindRegistry.descriptor(kind);
        ArtifactState state = agent.state(kind);
        if (state.isFreshFor(charterHash, descriptor.freshnessPolicy()) || state.isClaimedFor(charterHash)) {
            return ScheduleOutcome.NOT_NEEDED;
        }

        if (descriptor.prerequisite() != null) {
            ArtifactKind prerequisite = descriptor.prerequisite();
            ArtifactKindDescriptor prerequisiteDescriptor = kindRegistry.descriptor(prerequisite);
            if (!agent.state(prerequisite).isFreshFor(charterHash, prerequisiteDescriptor.freshnessPolicy())) {
                log.debug("Deferring {} for agent {} until {} is fresh", kind.label(), agentId, prerequisite.label());
                return ensureFresh(agent, prerequisite, lane);
            }
        }

        if (!generatorRegistry.isAvailable(kind)) {
            return ScheduleOutcome.GENERATOR_UNAVAILABLE;
        }

        if (!claimStore.tryClaim(agentId, kind, charterHash)) {
            log.debug("Lost {} claim race for agent {}", kind.label(), agentId);
            return ScheduleOutcome.CLAIM_LOST;
        }

        ArtifactJob job = new ArtifactJob(agentId, kind, charterHash, lane);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    enqueueOrRelease(job);
                }
            });
            log.debug("Claimed {}; enqueue deferred until commit", job.describe());
            return ScheduleOutcome.SCHEDULED;
        }
        return enqueueOrRelease(job) ? ScheduleOutcome.SCHEDULED : ScheduleOutcome.ENQUEUE_FAILED;
    }

    private boolean enqueueOrRelease(ArtifactJob job) {
        boolean accepted;
        try {
            accepted = jobQueue.enqueue(job);
        } catch (RuntimeException ex) {
            log.error("Failed to enqueue {}", job.describe(), ex);
            accepted = false;
        }
        if (accepted) {
            log.info("Scheduled {}", job.describe());
            return true;
        }
        boolean released = claimStore.clearClaim(job.agentId(), job.kind(), job.expectedHash());
        log.warn("Artifact job {} was not enqueued; claim released={}", job.describe(), released);
        return false;
    }
}
