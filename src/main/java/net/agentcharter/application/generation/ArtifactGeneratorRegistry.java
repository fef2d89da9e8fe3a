package net.agentcharter.application.generation;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.agentcharter.domain.artifact.ArtifactKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Binds every {@link ArtifactGenerator} bean to its artifact kind.
 */
@Component
public class ArtifactGeneratorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArtifactGeneratorRegistry.class);

    private final Map<ArtifactKind, ArtifactGenerator> generators;

    public ArtifactGeneratorRegistry(List<ArtifactGenerator> generators) {
        EnumMap<ArtifactKind, ArtifactGenerator> byKind = new EnumMap<>(ArtifactKind.class);
        for (ArtifactGenerator generator : generators) {
            ArtifactGenerator previous = byKind.putIfAbsent(generator.kind(), generator);
            if (previous != null) {
                throw new IllegalStateException("Multiple generators registered for " + generator.kind()
                    + ": " + previous.getClass().getSimpleName() + ", " + generator.getClass().getSimpleName());
            }
        }
        for (ArtifactKind kind : ArtifactKind.values()) {
            ArtifactGenerator generator = byKind.get(kind);
            if (generator == null) {
                log.warn("No artifact generator registered for {}", kind);
            } else if (!generator.isAvailable()) {
                log.info("Artifact generator for {} is not configured; {} jobs will not be scheduled", kind, kind.label());
            }
        }
        this.generators = byKind;
    }

    public Optional<ArtifactGenerator> find(ArtifactKind kind) {
        return Optional.ofNullable(generators.get(kind));
    }

    public boolean isAvailable(ArtifactKind kind) {
        ArtifactGenerator generator = generators.get(kind);
        return generator != null && generator.isAvailable();
    }
}
