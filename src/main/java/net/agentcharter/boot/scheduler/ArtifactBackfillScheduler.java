package net.agentcharter.boot.scheduler;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.agentcharter.application.artifact.ArtifactBackfillSweeper;
import net.agentcharter.config.ArtifactProperties;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.ArtifactKindRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic backfill of artifacts missing for existing agents, one sweep per enabled kind.
 */
@Component
public class ArtifactBackfillScheduler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactBackfillScheduler.class);

    private final ArtifactBackfillSweeper sweeper;
    private final ArtifactKindRegistry kindRegistry;
    private final ArtifactProperties properties;

    public ArtifactBackfillScheduler(ArtifactBackfillSweeper sweeper,
                                     ArtifactKindRegistry kindRegistry,
                                     ArtifactProperties properties) {
        this.sweeper = sweeper;
        this.kindRegistry = kindRegistry;
        this.properties = properties;
    }

    @Scheduled(initialDelayString = "${app.artifacts.backfill.initial-delay:PT1M}",
               fixedDelayString = "${app.artifacts.backfill.interval:PT5M}")
    public void runScheduledBackfill() {
        runBackfillCycle();
    }

    /**
     * Sweeps every enabled kind. A failing kind is logged and the remaining kinds still run.
     *
     * @return jobs scheduled per swept kind
     */
    public BackfillSummary runBackfillCycle() {
        if (!properties.getBackfill().isEnabled()) {
            log.debug("Artifact backfill is disabled via configuration.");
            return new BackfillSummary(Map.of(), List.of());
        }
        Map<ArtifactKind, Integer> scheduled = new EnumMap<>(ArtifactKind.class);
        List<String> failures = new ArrayList<>();
        for (ArtifactKind kind : kindRegistry.kinds()) {
            if (!properties.getBackfill().isEnabledFor(kind)) {
                continue;
            }
            try {
                scheduled.put(kind, sweeper.sweep(kind));
            } catch (RuntimeException exception) {
                log.error("Artifact backfill sweep failed for {}.", kind.label(), exception);
                failures.add(kind.label() + ": " + resolveFailureMessage(exception));
            }
        }
        return new BackfillSummary(Map.copyOf(scheduled), List.copyOf(failures));
    }

    private static String resolveFailureMessage(RuntimeException exception) {
        String message = exception.getMessage();
        if (message == null || message.isBlank()) {
            return exception.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Outcome of one backfill cycle.
     *
     * @param scheduledByKind jobs scheduled per kind that swept successfully
     * @param failures per-kind failure details
     */
    public record BackfillSummary(Map<ArtifactKind, Integer> scheduledByKind, List<String> failures) {
    }
}
