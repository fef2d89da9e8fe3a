package net.agentcharter.domain.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ArtifactKindRegistryTest {

    @Test
    void should_ChainAvatarToVisualDescription_When_StandardTableBuilt() {
        ArtifactKindRegistry registry = ArtifactKindRegistry.standard();

        assertThat(registry.kinds()).containsExactly(ArtifactKind.values());
        assertThat(registry.descriptor(ArtifactKind.AVATAR).prerequisite()).isEqualTo(ArtifactKind.VISUAL_DESCRIPTION);
        assertThat(registry.descriptor(ArtifactKind.VISUAL_DESCRIPTION).freshnessPolicy()).isEqualTo(FreshnessPolicy.STICKY);
        assertThat(registry.dependentsOf(ArtifactKind.VISUAL_DESCRIPTION)).containsExactly(ArtifactKind.AVATAR);
        assertThat(registry.dependentsOf(ArtifactKind.TAGS)).isEmpty();
    }

    @Test
    void should_RejectCycle_When_KindsDependOnEachOther() {
        List<ArtifactKindDescriptor> cyclic = List.of(
            ArtifactKindDescriptor.dependsOn(ArtifactKind.AVATAR, ArtifactKind.VISUAL_DESCRIPTION),
            ArtifactKindDescriptor.dependsOn(ArtifactKind.VISUAL_DESCRIPTION, ArtifactKind.AVATAR)
        );

        assertThatThrownBy(() -> new ArtifactKindRegistry(cyclic))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cycle");
    }

    @Test
    void should_RejectSelfDependency_When_DescriptorBuilt() {
        assertThatThrownBy(() -> ArtifactKindDescriptor.dependsOn(ArtifactKind.TAGS, ArtifactKind.TAGS))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_RejectUnregisteredPrerequisite_When_TableIncomplete() {
        List<ArtifactKindDescriptor> incomplete = List.of(
            ArtifactKindDescriptor.dependsOn(ArtifactKind.AVATAR, ArtifactKind.VISUAL_DESCRIPTION)
        );

        assertThatThrownBy(() -> new ArtifactKindRegistry(incomplete))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("unregistered");
    }

    @Test
    void should_RejectDuplicate_When_KindListedTwice() {
        List<ArtifactKindDescriptor> duplicated = List.of(
            ArtifactKindDescriptor.independent(ArtifactKind.TAGS),
            ArtifactKindDescriptor.sticky(ArtifactKind.TAGS)
        );

        assertThatThrownBy(() -> new ArtifactKindRegistry(duplicated))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void should_ThrowIllegalArgument_When_DescriptorRequestedForUnregisteredKind() {
        ArtifactKindRegistry registry = new ArtifactKindRegistry(List.of(ArtifactKindDescriptor.independent(ArtifactKind.TAGS)));

        assertThat(registry.isRegistered(ArtifactKind.AVATAR)).isFalse();
        assertThatThrownBy(() -> registry.descriptor(ArtifactKind.AVATAR))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
