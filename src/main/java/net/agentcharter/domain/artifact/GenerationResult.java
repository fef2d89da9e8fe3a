package net.agentcharter.domain.artifact;

/**
 * Value or error returned by a generator. Generators report faults here instead of throwing.
 */
public record GenerationResult(ArtifactValue value, String error) {

    public static GenerationResult success(ArtifactValue value) {
        if (value == null || !value.isPresent()) {
            return failure("Generator returned an empty value");
        }
        return new GenerationResult(value, null);
    }

    public static GenerationResult failure(String error) {
        return new GenerationResult(null, error == null || error.isBlank() ? "Generation failed" : error);
    }

    public boolean isSuccess() {
        return value != null && error == null;
    }
}
