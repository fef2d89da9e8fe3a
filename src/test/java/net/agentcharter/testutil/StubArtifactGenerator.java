package net.agentcharter.testutil;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import net.agentcharter.application.generation.ArtifactGenerator;
import net.agentcharter.domain.artifact.ArtifactKind;
import net.agentcharter.domain.artifact.GenerationRequest;
import net.agentcharter.domain.artifact.GenerationResult;

/**
 * Generator whose output is computed by a test-supplied function; records every request it receives.
 */
public class StubArtifactGenerator implements ArtifactGenerator {

    private final ArtifactKind kind;
    private final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();
    private volatile boolean available = true;
    private volatile Function<GenerationRequest, GenerationResult> behavior;

    public StubArtifactGenerator(ArtifactKind kind, Function<GenerationRequest, GenerationResult> behavior) {
        this.kind = kind;
        this.behavior = behavior;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setBehavior(Function<GenerationRequest, GenerationResult> behavior) {
        this.behavior = behavior;
    }

    public List<GenerationRequest> requests() {
        return requests;
    }

    @Override
    public ArtifactKind kind() {
        return kind;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        requests.add(request);
        return behavior.apply(request);
    }
}
