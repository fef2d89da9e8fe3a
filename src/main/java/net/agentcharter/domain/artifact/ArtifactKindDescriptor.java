package net.agentcharter.domain.artifact;

import java.util.Optional;

/**
 * Static description of one artifact kind: its freshness policy and the kind it depends on.
 *
 * @param kind described kind
 * @param prerequisite kind that must hold a value before this kind can be generated, or {@code null}
 * @param freshnessPolicy freshness rule applied by the scheduler
 */
public record ArtifactKindDescriptor(ArtifactKind kind,
                                     ArtifactKind prerequisite,
                                     FreshnessPolicy freshnessPolicy) {

    public ArtifactKindDescriptor {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (freshnessPolicy == null) {
            freshnessPolicy = FreshnessPolicy.CHARTER_BOUND;
        }
        if (prerequisite == kind) {
            throw new IllegalArgumentException("Artifact kind " + kind + " cannot depend on itself");
        }
    }

    public static ArtifactKindDescriptor independent(ArtifactKind kind) {
        return new ArtifactKindDescriptor(kind, null, FreshnessPolicy.CHARTER_BOUND);
    }

    public static ArtifactKindDescriptor sticky(ArtifactKind kind) {
        return new ArtifactKindDescriptor(kind, null, FreshnessPolicy.STICKY);
    }

    public static ArtifactKindDescriptor dependsOn(ArtifactKind kind, ArtifactKind prerequisite) {
        return new ArtifactKindDescriptor(kind, prerequisite, FreshnessPolicy.CHARTER_BOUND);
    }

    public Optional<ArtifactKind> prerequisiteKind() {
        return Optional.ofNullable(prerequisite);
    }
}
