package net.agentcharter.support.ai;

/**
 * A generation provider call failed or returned unusable output.
 */
public class ArtifactGenerationException extends RuntimeException {

    public ArtifactGenerationException(String message) {
        super(message);
    }

    public ArtifactGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
