package net.agentcharter.domain.artifact;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable dependency graph of artifact kinds, validated once at startup.
 *
 * <p>Construction fails with {@link IllegalStateException} when a prerequisite is not registered
 * or the prerequisite edges form a cycle, so a bad table never reaches the scheduler.</p>
 */
public final class ArtifactKindRegistry {

    private final Map<ArtifactKind, ArtifactKindDescriptor> descriptors;
    private final Map<ArtifactKind, List<ArtifactKind>> dependents;

    public ArtifactKindRegistry(Collection<ArtifactKindDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            throw new IllegalArgumentException("At least one artifact kind descriptor is required");
        }
        EnumMap<ArtifactKind, ArtifactKindDescriptor> byKind = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKindDescriptor descriptor : descriptors) {
            if (byKind.putIfAbsent(descriptor.kind(), descriptor) != null) {
                throw new IllegalStateException("Duplicate artifact kind descriptor: " + descriptor.kind());
            }
        }
        for (ArtifactKindDescriptor descriptor : byKind.values()) {
            descriptor.prerequisiteKind().ifPresent(prerequisite -> {
                if (!byKind.containsKey(prerequisite)) {
                    throw new IllegalStateException(
                        "Artifact kind " + descriptor.kind() + " depends on unregistered kind " + prerequisite);
                }
            });
        }
        rejectCycles(byKind);

        EnumMap<ArtifactKind, List<ArtifactKind>> dependentsByKind = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKindDescriptor descriptor : byKind.values()) {
            descriptor.prerequisiteKind().ifPresent(prerequisite ->
                dependentsByKind.computeIfAbsent(prerequisite, key -> new ArrayList<>()).add(descriptor.kind()));
        }
        dependentsByKind.replaceAll((kind, list) -> List.copyOf(list));

        this.descriptors = Map.copyOf(byKind);
        this.dependents = Map.copyOf(dependentsByKind);
    }

    /**
     * Builds the production table: avatars depend on the sticky visual description, every other
     * kind is generated straight from the charter.
     */
    public static ArtifactKindRegistry standard() {
        return new ArtifactKindRegistry(List.of(
            ArtifactKindDescriptor.independent(ArtifactKind.SHORT_DESCRIPTION),
            ArtifactKindDescriptor.independent(ArtifactKind.MINI_DESCRIPTION),
            ArtifactKindDescriptor.independent(ArtifactKind.TAGS),
            ArtifactKindDescriptor.sticky(ArtifactKind.VISUAL_DESCRIPTION),
            ArtifactKindDescriptor.dependsOn(ArtifactKind.AVATAR, ArtifactKind.VISUAL_DESCRIPTION)
        ));
    }

    public ArtifactKindDescriptor descriptor(ArtifactKind kind) {
        ArtifactKindDescriptor descriptor = descriptors.get(kind);
        if (descriptor == null) {
            throw new IllegalArgumentException("Artifact kind is not registered: " + kind);
        }
        return descriptor;
    }

    public boolean isRegistered(ArtifactKind kind) {
        return descriptors.containsKey(kind);
    }

    /**
     * Registered kinds in declaration order of {@link ArtifactKind}.
     */
    public List<ArtifactKind> kinds() {
        List<ArtifactKind> kinds = new ArrayList<>();
        for (ArtifactKind kind : ArtifactKind.values()) {
            if (descriptors.containsKey(kind)) {
                kinds.add(kind);
            }
        }
        return List.copyOf(kinds);
    }

    /**
     * Kinds that declare {@code kind} as their prerequisite.
     */
    public List<ArtifactKind> dependentsOf(ArtifactKind kind) {
        return dependents.getOrDefault(kind, List.of());
    }

    private static void rejectCycles(Map<ArtifactKind, ArtifactKindDescriptor> byKind) {
        for (ArtifactKind start : byKind.keySet()) {
            Set<ArtifactKind> visited = EnumSet.of(start);
            ArtifactKind current = byKind.get(start).prerequisite();
            while (current != null) {
                if (!visited.add(current)) {
                    throw new IllegalStateException("Artifact kind dependency cycle detected starting at " + start);
                }
                current = byKind.get(current).prerequisite();
            }
        }
    }
}
