package net.agentcharter.application.generation;

import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.domain.artifact.GenerationResult;

/**
 * Produces one artifact kind from an agent's charter.
 *
 * <p>Generation faults are reported through {@link GenerationResult#failure(String)}; implementations
 * do not throw for provider errors, empty output or rejected calls.</p>
 */
public interface ArtifactGenerator {

    ArtifactKind kind();

    /**
     * Whether the generator is configured (for example an API key is present).
     */
    boolean isAvailable();

    GenerationResult generate(GenerationRequest request);
}
