package net.agentcharter.application.artifact;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.agentcharter.adapters.persistence.SystemSettingRepository;
import net.agentcharter.application.generation.ArtifactGeneratorRegistry;
import net.agentcharter.config.ArtifactProperties;
import net.agentcharter.domain.artifact.ArtifactClaimStore;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.JobLane;
import net.agentcharter.domain.artifact.ScheduleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Walks agents that have never produced an artifact kind and schedules a bounded batch of them
 * per call, remembering its position in a per-kind cursor.
 *
 * <p>The cursor stores the last agent id examined. Once a scan past a non-empty cursor finds no
 * candidates the cursor resets, so the next sweep starts from the beginning again.</p>
 */
@Service
public class ArtifactBackfillSweeper {

    private static final Logger log = LoggerFactory.getLogger(ArtifactBackfillSweeper.class);

    private final ArtifactClaimStore claimStore;
    private final SystemSettingRepository settingRepository;
    private final ArtifactScheduler scheduler;
    private final ArtifactGeneratorRegistry generatorRegistry;
    private final ArtifactProperties properties;

    public ArtifactBackfillSweeper(ArtifactClaimStore claimStore,
                                   SystemSettingRepository settingRepository,
                                   ArtifactScheduler scheduler,
                                   ArtifactGeneratorRegistry generatorRegistry,
                                   ArtifactProperties properties) {
        this.claimStore = claimStore;
        this.settingRepository = settingRepository;
        this.scheduler = scheduler;
        this.generatorRegistry = generatorRegistry;
        this.properties = properties;
    }

    /**
     * Sweeps with the configured batch size and scan limit.
     */
    public int sweep(ArtifactKind kind) {
        ArtifactProperties.Backfill backfill = properties.getBackfill();
        return sweep(kind, backfill.getBatchSize(), backfill.getScanLimit());
    }

    /**
     * Schedules up to {@code batchSize} jobs among at most {@code scanLimit} candidates after the cursor.
     *
     * @return number of jobs scheduled
     */
    public int sweep(ArtifactKind kind, int batchSize, int scanLimit) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (batchSize <= 0 || scanLimit <= 0) {
            throw new IllegalArgumentException("batchSize and scanLimit must be positive");
        }
        if (!properties.getBackfill().isEnabledFor(kind)) {
            log.debug("Backfill disabled for {}", kind.label());
            return 0;
        }
        if (!generatorRegistry.isAvailable(kind)) {
            log.debug("Skipping {} backfill: generator not configured", kind.label());
            return 0;
        }

        String cursorKey = kind.backfillCursorKey();
        Optional<UUID> cursor = readCursor(cursorKey);
        List<UUID> candidates = claimStore.findBackfillCandidates(kind, cursor.orElse(null), scanLimit);
        if (candidates.isEmpty()) {
            if (cursor.isPresent()) {
                settingRepository.save(cursorKey, "");
                log.info("{} backfill reached the end of the agent list; cursor reset", kind.label());
            }
            return 0;
        }

        int scheduled = 0;
        UUID lastExamined = null;
        for (UUID agentId : candidates) {
            lastExamined = agentId;
            try {
                ScheduleOutcome outcome = scheduler.ensureFresh(agentId, kind, JobLane.BACKFILL);
                if (outcome.isScheduled()) {
                    scheduled += 1;
                }
            } catch (RuntimeException ex) {
                log.error("{} backfill failed for agent {}", kind.label(), agentId, ex);
            }
            if (scheduled >= batchSize) {
                break;
            }
        }

        settingRepository.save(cursorKey, lastExamined.toString());
        log.info("{} backfill scheduled {} job(s) from {} candidate(s); cursor={}",
            kind.label(), scheduled, candidates.size(), lastExamined);
        return scheduled;
    }

    private Optional<UUID> readCursor(String cursorKey) {
        Optional<String> stored = settingRepository.find(cursorKey).filter(StringUtils::hasText);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(stored.get().trim()));
        } catch (IllegalArgumentException ex) {
            log.warn("Ignoring malformed backfill cursor {}={}", cursorKey, stored.get());
            return Optional.empty();
        }
    }
}
