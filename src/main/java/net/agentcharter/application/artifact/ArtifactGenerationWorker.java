package net.agentcharter.application.artifact;

import java.util.Optional;
import java.util.UUID;
import net.agentcharter.application.generation.ArtifactGenerator;
import net.agentcharter.application.generation.ArtifactGeneratorRegistry;
import net.agentcharter.domain.artifact.AgentArtifactSnapshot;
import net.agentcharter.domain.artifact.ArtifactClaimStore;
import net.agentcharter.domain.artifact.ArtifactJob;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactKindRegistry;
import net.agentcharter.domain.artifact.ArtifactState;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.domain.artifact.GenerationResult;
import net.agentcharter.domain.artifact.WorkerOutcome;
import net.agentcharter.support.queue.ArtifactJobHandler;
import net.agentcharter.support.storage.AvatarImageStorage;
import net.agentcharter.util.ContentFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes one generation job: re-validates the claim against the current charter, calls the
 * generator and writes the result only while the claim still belongs to the job.
 *
 * <p>Generation faults release the claim and keep the last good value. Persistence faults
 * propagate so the queue retries the job.</p>
 */
@Service
public class ArtifactGenerationWorker implements ArtifactJobHandler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactGenerationWorker.class);

    private final ArtifactClaimStore claimStore;
    private final ArtifactKindRegistry kindRegistry;
    private final ArtifactGeneratorRegistry generatorRegistry;
    private final ArtifactScheduler scheduler;
    private final AvatarImageStorage avatarImageStorage;

    public ArtifactGenerationWorker(ArtifactClaimStore claimStore,
                                    ArtifactKindRegistry kindRegistry,
                                    ArtifactGeneratorRegistry generatorRegistry,
                                    ArtifactScheduler scheduler,
                                    AvatarImageStorage avatarImageStorage) {
        this.claimStore = claimStore;
        this.kindRegistry = kindRegistry;
        this.generatorRegistry = generatorRegistry;
        this.scheduler = scheduler;
        this.avatarImageStorage = avatarImageStorage;
    }

    @Override
    public WorkerOutcome handle(ArtifactJob job) {
        return execute(job);
    }

    @Override
    public void onDeadLetter(ArtifactJob job, RuntimeException lastFailure) {
        boolean released = claimStore.clearClaim(job.agentId(), job.kind(), job.expectedHash());
        log.warn("Released claim for dead-lettered job {} (released={}): {}",
            job.describe(), released, lastFailure == null ? "unknown" : lastFailure.getMessage());
    }

    /**
     * Runs the job to completion.
     *
     * @param job claimed job
     * @return outcome of the attempt
     */
    public WorkerOutcome execute(ArtifactJob job) {
        UUID agentId = job.agentId();
        ArtifactKind kind = job.kind();
        String expectedHash = job.expectedHash();

        Optional<AgentArtifactSnapshot> loaded = claimStore.findAgent(agentId);
        if (loaded.isEmpty()) {
            claimStore.clearClaim(agentId, kind, expectedHash);
            log.info("Dropping {}: agent no longer exists", job.describe());
            return WorkerOutcome.AGENT_MISSING;
        }
        AgentArtifactSnapshot agent = loaded.get();

        String charterHash = ContentFingerprint.fingerprint(agent.charter());
        if (charterHash.isEmpty() || !charterHash.equals(expectedHash)) {
            claimStore.clearClaim(agentId, kind, expectedHash);
            log.info("Dropping {}: charter changed since the claim was taken", job.describe());
            return WorkerOutcome.STALE_CLAIM;
        }

        ArtifactState state = agent.state(kind);
        if (!state.isClaimedFor(expectedHash)) {
            log.debug("Skipping {}: claim is no longer held (requested={})", job.describe(), state.requestedHash());
            return WorkerOutcome.CLAIM_SUPERSEDED;
        }

        ArtifactKind prerequisite = kindRegistry.descriptor(kind).prerequisite();
        ArtifactValue prerequisiteValue = null;
        if (prerequisite != null) {
            ArtifactState prerequisiteState = agent.state(prerequisite);
            if (!prerequisiteState.hasValue()) {
                claimStore.clearClaim(agentId, kind, expectedHash);
                log.info("Dropping {}: prerequisite {} has no value yet", job.describe(), prerequisite.label());
                scheduler.ensureFresh(agentId, prerequisite, job.lane());
                return WorkerOutcome.PREREQUISITE_MISSING;
            }
            prerequisiteValue = prerequisiteState.value();
        }

        GenerationResult result = generate(job, new GenerationRequest(agentId, agent.name(), agent.charter(), prerequisiteValue));
        if (!result.isSuccess()) {
            claimStore.clearClaim(agentId, kind, expectedHash);
            log.warn("Generation failed for {}: {}", job.describe(), result.error());
            return WorkerOutcome.GENERATION_FAILED;
        }

        ArtifactValue value = result.value();
        String previousStorageKey = null;
        if (value instanceof ArtifactValue.ImagePayload payload) {
            Optional<ArtifactValue.ImageReference> stored = storeImage(job, payload);
            if (stored.isEmpty()) {
                claimStore.clearClaim(agentId, kind, expectedHash);
                return WorkerOutcome.GENERATION_FAILED;
            }
            value = stored.get();
            if (state.value() instanceof ArtifactValue.ImageReference previous && previous.isPresent()) {
                previousStorageKey = previous.storageKey();
            }
        }

        if (!claimStore.persistResult(agentId, kind, value, expectedHash, expectedHash)) {
            log.debug("Discarding result of {}: a newer claim owns {}", job.describe(), kind.label());
            if (value instanceof ArtifactValue.ImageReference orphan) {
                deleteImage(orphan.storageKey());
            }
            return WorkerOutcome.CLAIM_SUPERSEDED;
        }
        log.info("Persisted {}", job.describe());

        if (previousStorageKey != null) {
            deleteImage(previousStorageKey);
        }
        chainDependents(job);
        return WorkerOutcome.PERSISTED;
    }

    private GenerationResult generate(ArtifactJob job, GenerationRequest request) {
        Optional<ArtifactGenerator> generator = generatorRegistry.find(job.kind());
        if (generator.isEmpty() || !generator.get().isAvailable()) {
            return GenerationResult.failure("No configured generator for " + job.kind().label());
        }
        try {
            GenerationResult result = generator.get().generate(request);
            return result == null ? GenerationResult.failure("Generator returned no result") : result;
        } catch (RuntimeException ex) {
            log.error("Generator for {} threw while processing {}", job.kind().label(), job.describe(), ex);
            return GenerationResult.failure(ex.getMessage());
        }
    }

    private Optional<ArtifactValue.ImageReference> storeImage(ArtifactJob job, ArtifactValue.ImagePayload payload) {
        try {
            String key = avatarImageStorage.store(job.agentId(), payload.bytes(), payload.contentType());
            return Optional.of(new ArtifactValue.ImageReference(key, payload.contentType()));
        } catch (RuntimeException ex) {
            log.error("Failed to store generated image for {}", job.describe(), ex);
            return Optional.empty();
        }
    }

    private void deleteImage(String storageKey) {
        try {
            avatarImageStorage.delete(storageKey);
        } catch (RuntimeException ex) {
            log.warn("Failed to delete unreferenced avatar object {}: {}", storageKey, ex.getMessage());
        }
    }

    private void chainDependents(ArtifactJob job) {
        for (ArtifactKind dependent : kindRegistry.dependentsOf(job.kind())) {
            try {
                scheduler.ensureFresh(job.agentId(), dependent, job.lane());
            } catch (RuntimeException ex) {
                log.error("Failed to chain {} after {}", dependent.label(), job.describe(), ex);
            }
        }
    }
}
