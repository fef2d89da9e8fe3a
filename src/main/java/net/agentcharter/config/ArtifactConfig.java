package net.agentcharter.config;

import net.agentcharter.domain.artifact.ArtifactKindRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Artifact kind dependency graph.
 */
@Configuration
public class ArtifactConfig {

    @Bean
    public ArtifactKindRegistry artifactKindRegistry() {
        return ArtifactKindRegistry.standard();
    }
}
