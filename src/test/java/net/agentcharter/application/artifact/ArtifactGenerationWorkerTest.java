package net.agentcharter.application.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import net.agentcharter.application.generation.ArtifactGenerator;
import net.agentcharter.application.generation.ArtifactGeneratorRegistry;
import net.agentcharter.domain.artifact.ArtifactJob;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactKindRegistry;
import net.agentcharter.domain.artifact.ArtifactState;
import net.agentcharter.domain.artifact.ArtifactValue;
import net.agentcharter.domain.artifact.GenerationResult;
import net.agentcharter.domain.artifact.JobLane;
import net.agentcharter.domain.artifact.ScheduleOutcome;
import net.agentcharter.domain.artifact.WorkerOutcome;
import net.agentcharter.support.storage.AvatarImageStorage;
import net.agentcharter.support.storage.AvatarStorageException;
import net.agentcharter.testutil.InMemoryArtifactClaimStore;
import net.agentcharter.testutil.RecordingArtifactJobQueue;
import net.agentcharter.testutil.StubArtifactGenerator;
import net.agentcharter.util.ContentFingerprint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArtifactGenerationWorkerTest {

    private static final String SALES = "Help with sales";
    private static final String RECRUITING = "Help with recruiting";
    private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 1, 2, 3};

    @Mock
    private AvatarImageStorage avatarImageStorage;

    private InMemoryArtifactClaimStore store;
    private RecordingArtifactJobQueue queue;
    private StubArtifactGenerator tagsGenerator;
    private StubArtifactGenerator visualGenerator;
    private StubArtifactGenerator avatarGenerator;
    private ArtifactScheduler scheduler;
    private ArtifactGenerationWorker worker;

    @BeforeEach
    void setUp() {
        store = new InMemoryArtifactClaimStore();
        queue = new RecordingArtifactJobQueue();
        tagsGenerator = new StubArtifactGenerator(ArtifactKind.TAGS, request -> GenerationResult.success(
            new ArtifactValue.TagList(request.charter().contains("sales")
                ? List.of("Sales", "Deal Closing", "B2B")
                : List.of("Recruiting", "Hiring", "Talent"))));
        visualGenerator = new StubArtifactGenerator(ArtifactKind.VISUAL_DESCRIPTION,
            request -> GenerationResult.success(new ArtifactValue.Text("A sharp fox in a navy suit")));
        avatarGenerator = new StubArtifactGenerator(ArtifactKind.AVATAR,
            request -> GenerationResult.success(new ArtifactValue.ImagePayload(PNG_BYTES, "image/png")));
        List<ArtifactGenerator> generators = new ArrayList<>(List.of(tagsGenerator, visualGenerator, avatarGenerator));
        ArtifactKindRegistry kindRegistry = ArtifactKindRegistry.standard();
        ArtifactGeneratorRegistry generatorRegistry = new ArtifactGeneratorRegistry(generators);
        scheduler = new ArtifactScheduler(store, queue, kindRegistry, generatorRegistry);
        worker = new ArtifactGenerationWorker(store, kindRegistry, generatorRegistry, scheduler, avatarImageStorage);
    }

    @Test
    void should_PersistValueAndReleaseClaim_When_ClaimStillCurrent() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.TAGS);

        WorkerOutcome outcome = worker.execute(job);

        ArtifactState state = store.state(agentId, ArtifactKind.TAGS);
        assertThat(outcome).isEqualTo(WorkerOutcome.PERSISTED);
        assertThat(state.value()).isEqualTo(new ArtifactValue.TagList(List.of("Sales", "Deal Closing", "B2B")));
        assertThat(state.valueSourceHash()).isEqualTo(ContentFingerprint.fingerprint(SALES));
        assertThat(state.hasOutstandingClaim()).isFalse();
    }

    @Test
    void should_ConvergeOnLatestCharter_When_CharterEditedAfterFirstGeneration() {
        UUID agentId = store.addAgent("Closer", SALES);
        worker.execute(scheduleSingle(agentId, ArtifactKind.TAGS));

        store.setCharter(agentId, RECRUITING);
        WorkerOutcome outcome = worker.execute(scheduleSingle(agentId, ArtifactKind.TAGS));

        ArtifactState state = store.state(agentId, ArtifactKind.TAGS);
        assertThat(outcome).isEqualTo(WorkerOutcome.PERSISTED);
        assertThat(state.value()).isEqualTo(new ArtifactValue.TagList(List.of("Recruiting", "Hiring", "Talent")));
        assertThat(state.valueSourceHash()).isEqualTo(ContentFingerprint.fingerprint(RECRUITING));
        assertThat(scheduler.ensureFresh(agentId, ArtifactKind.TAGS)).isEqualTo(ScheduleOutcome.NOT_NEEDED);
    }

    @Test
    void should_DropJobWithoutGenerating_When_CharterChangedBeforeExecution() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob staleJob = scheduleSingle(agentId, ArtifactKind.TAGS);
        store.setCharter(agentId, RECRUITING);

        WorkerOutcome outcome = worker.execute(staleJob);

        assertThat(outcome).isEqualTo(WorkerOutcome.STALE_CLAIM);
        assertThat(tagsGenerator.requests()).isEmpty();
        assertThat(store.state(agentId, ArtifactKind.TAGS).hasOutstandingClaim()).isFalse();
    }

    @Test
    void should_KeepNewerClaim_When_StaleJobRunsAfterSupersede() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob staleJob = scheduleSingle(agentId, ArtifactKind.TAGS);
        store.setCharter(agentId, RECRUITING);
        ArtifactJob currentJob = scheduleSingle(agentId, ArtifactKind.TAGS);

        assertThat(worker.execute(staleJob)).isEqualTo(WorkerOutcome.STALE_CLAIM);
        assertThat(store.state(agentId, ArtifactKind.TAGS).requestedHash()).isEqualTo(currentJob.expectedHash());

        assertThat(worker.execute(currentJob)).isEqualTo(WorkerOutcome.PERSISTED);
        assertThat(store.state(agentId, ArtifactKind.TAGS).valueSourceHash()).isEqualTo(ContentFingerprint.fingerprint(RECRUITING));
    }

    @Test
    void should_DiscardResult_When_ClaimSupersededDuringGeneration() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.TAGS);
        tagsGenerator.setBehavior(request -> {
            store.setCharter(agentId, RECRUITING);
            scheduler.ensureFresh(agentId, ArtifactKind.TAGS);
            return GenerationResult.success(new ArtifactValue.TagList(List.of("Sales")));
        });

        WorkerOutcome outcome = worker.execute(job);

        ArtifactState state = store.state(agentId, ArtifactKind.TAGS);
        assertThat(outcome).isEqualTo(WorkerOutcome.CLAIM_SUPERSEDED);
        assertThat(state.hasValue()).isFalse();
        assertThat(state.requestedHash()).isEqualTo(ContentFingerprint.fingerprint(RECRUITING));
        assertThat(store.persistCount()).isZero();
    }

    @Test
    void should_SkipDuplicateDelivery_When_JobAlreadyPersisted() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.TAGS);

        assertThat(worker.execute(job)).isEqualTo(WorkerOutcome.PERSISTED);
        assertThat(worker.execute(job)).isEqualTo(WorkerOutcome.CLAIM_SUPERSEDED);
        assertThat(tagsGenerator.requests()).hasSize(1);
        assertThat(store.persistCount()).isEqualTo(1);
    }

    @Test
    void should_KeepLastGoodValueAndAllowRetry_When_GenerationFails() {
        UUID agentId = store.addAgent("Closer", SALES);
        worker.execute(scheduleSingle(agentId, ArtifactKind.TAGS));
        store.setCharter(agentId, RECRUITING);
        tagsGenerator.setBehavior(request -> GenerationResult.failure("provider returned 500"));

        WorkerOutcome outcome = worker.execute(scheduleSingle(agentId, ArtifactKind.TAGS));

        ArtifactState state = store.state(agentId, ArtifactKind.TAGS);
        assertThat(outcome).isEqualTo(WorkerOutcome.GENERATION_FAILED);
        assertThat(state.value()).isEqualTo(new ArtifactValue.TagList(List.of("Sales", "Deal Closing", "B2B")));
        assertThat(state.valueSourceHash()).isEqualTo(ContentFingerprint.fingerprint(SALES));
        assertThat(state.hasOutstandingClaim()).isFalse();
        assertThat(scheduler.ensureFresh(agentId, ArtifactKind.TAGS)).isEqualTo(ScheduleOutcome.SCHEDULED);
    }

    @Test
    void should_TreatThrowingGeneratorAsFailure_When_GeneratorThrows() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.TAGS);
        tagsGenerator.setBehavior(request -> {
            throw new IllegalStateException("boom");
        });

        assertThat(worker.execute(job)).isEqualTo(WorkerOutcome.GENERATION_FAILED);
        assertThat(store.state(agentId, ArtifactKind.TAGS).hasOutstandingClaim()).isFalse();
    }

    @Test
    void should_ReportAgentMissing_When_AgentDeleted() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.TAGS);
        store.removeAgent(agentId);

        assertThat(worker.execute(job)).isEqualTo(WorkerOutcome.AGENT_MISSING);
        assertThat(tagsGenerator.requests()).isEmpty();
    }

    @Test
    void should_ChainAvatarExactlyOnce_When_VisualDescriptionPersisted() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob visualJob = scheduleSingle(agentId, ArtifactKind.VISUAL_DESCRIPTION);

        assertThat(worker.execute(visualJob)).isEqualTo(WorkerOutcome.PERSISTED);

        List<ArtifactJob> chained = queue.drain();
        assertThat(chained).extracting(ArtifactJob::kind).containsExactly(ArtifactKind.AVATAR);
        assertThat(scheduler.ensureFresh(agentId, ArtifactKind.AVATAR)).isEqualTo(ScheduleOutcome.NOT_NEEDED);
        assertThat(queue.size()).isZero();
    }

    @Test
    void should_StoreImageAndPersistReference_When_AvatarGenerated() {
        UUID agentId = store.addAgent("Closer", SALES);
        store.putState(agentId, new ArtifactState(ArtifactKind.VISUAL_DESCRIPTION,
            new ArtifactValue.Text("A sharp fox"), ContentFingerprint.fingerprint(SALES), ""));
        store.putState(agentId, new ArtifactState(ArtifactKind.AVATAR,
            new ArtifactValue.ImageReference("avatars/old.png", "image/png"), "", ""));
        when(avatarImageStorage.store(eq(agentId), any(byte[].class), eq("image/png"))).thenReturn("avatars/new.png");
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.AVATAR);

        WorkerOutcome outcome = worker.execute(job);

        assertThat(outcome).isEqualTo(WorkerOutcome.PERSISTED);
        assertThat(store.state(agentId, ArtifactKind.AVATAR).value())
            .isEqualTo(new ArtifactValue.ImageReference("avatars/new.png", "image/png"));
        assertThat(avatarGenerator.requests().get(0).prerequisiteText()).isEqualTo("A sharp fox");
        verify(avatarImageStorage).delete("avatars/old.png");
    }

    @Test
    void should_DeleteOrphanedImage_When_AvatarClaimSupersededDuringGeneration() {
        UUID agentId = store.addAgent("Closer", SALES);
        store.putState(agentId, new ArtifactState(ArtifactKind.VISUAL_DESCRIPTION,
            new ArtifactValue.Text("A sharp fox"), ContentFingerprint.fingerprint(SALES), ""));
        when(avatarImageStorage.store(eq(agentId), any(byte[].class), anyString())).thenReturn("avatars/orphan.png");
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.AVATAR);
        avatarGenerator.setBehavior(request -> {
            store.setCharter(agentId, RECRUITING);
            scheduler.ensureFresh(agentId, ArtifactKind.AVATAR);
            return GenerationResult.success(new ArtifactValue.ImagePayload(PNG_BYTES, "image/png"));
        });

        assertThat(worker.execute(job)).isEqualTo(WorkerOutcome.CLAIM_SUPERSEDED);
        verify(avatarImageStorage).delete("avatars/orphan.png");
        assertThat(store.state(agentId, ArtifactKind.AVATAR).hasValue()).isFalse();
    }

    @Test
    void should_ReleaseClaim_When_ImageStorageFails() {
        UUID agentId = store.addAgent("Closer", SALES);
        store.putState(agentId, new ArtifactState(ArtifactKind.VISUAL_DESCRIPTION,
            new ArtifactValue.Text("A sharp fox"), ContentFingerprint.fingerprint(SALES), ""));
        when(avatarImageStorage.store(eq(agentId), any(byte[].class), anyString()))
            .thenThrow(new AvatarStorageException("bucket unavailable", "avatars/x.png", null));
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.AVATAR);

        assertThat(worker.execute(job)).isEqualTo(WorkerOutcome.GENERATION_FAILED);
        assertThat(store.state(agentId, ArtifactKind.AVATAR).hasOutstandingClaim()).isFalse();
        verify(avatarImageStorage, never()).delete(anyString());
    }

    @Test
    void should_ReleaseClaimAndRequestPrerequisite_When_VisualDescriptionMissing() {
        UUID agentId = store.addAgent("Closer", SALES);
        String hash = ContentFingerprint.fingerprint(SALES);
        store.tryClaim(agentId, ArtifactKind.AVATAR, hash);

        WorkerOutcome outcome = worker.execute(new ArtifactJob(agentId, ArtifactKind.AVATAR, hash, JobLane.BACKFILL));

        assertThat(outcome).isEqualTo(WorkerOutcome.PREREQUISITE_MISSING);
        assertThat(store.state(agentId, ArtifactKind.AVATAR).hasOutstandingClaim()).isFalse();
        assertThat(queue.jobs()).containsExactly(new ArtifactJob(agentId, ArtifactKind.VISUAL_DESCRIPTION, hash, JobLane.BACKFILL));
        assertThat(avatarGenerator.requests()).isEmpty();
    }

    @Test
    void should_ReleaseClaim_When_JobDeadLettered() {
        UUID agentId = store.addAgent("Closer", SALES);
        ArtifactJob job = scheduleSingle(agentId, ArtifactKind.TAGS);

        worker.onDeadLetter(job, new IllegalStateException("database unavailable"));

        assertThat(store.state(agentId, ArtifactKind.TAGS).hasOutstandingClaim()).isFalse();
    }

    private ArtifactJob scheduleSingle(UUID agentId, ArtifactKind kind) {
        assertThat(scheduler.ensureFresh(agentId, kind)).isEqualTo(ScheduleOutcome.SCHEDULED);
        List<ArtifactJob> jobs = queue.drain();
        assertThat(jobs).hasSize(1);
        return jobs.get(0);
    }
}
