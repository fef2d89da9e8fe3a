package net.agentcharter.support.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalDiskAvatarImageStorageTest {

    @TempDir
    Path tempDir;

    @Test
    void should_WriteUnderAgentDirectory_When_Storing() throws IOException {
        LocalDiskAvatarImageStorage storage = new LocalDiskAvatarImageStorage(tempDir, "avatars", "/media");
        UUID agentId = UUID.randomUUID();

        String key = storage.store(agentId, new byte[] {1, 2, 3}, "image/png");

        assertThat(key).startsWith("avatars/" + agentId + "/").endsWith(".png");
        assertThat(Files.readAllBytes(tempDir.resolve(key))).containsExactly(1, 2, 3);
        assertThat(storage.publicUrl(key)).isEqualTo("/media/" + key);
    }

    @Test
    void should_RemoveFile_When_Deleting() {
        LocalDiskAvatarImageStorage storage = new LocalDiskAvatarImageStorage(tempDir, "avatars", "/media");
        String key = storage.store(UUID.randomUUID(), new byte[] {9}, "image/webp");

        storage.delete(key);
        storage.delete(key);

        assertThat(Files.exists(tempDir.resolve(key))).isFalse();
    }

    @Test
    void should_RejectKey_When_ItEscapesRootDirectory() {
        LocalDiskAvatarImageStorage storage = new LocalDiskAvatarImageStorage(tempDir, "avatars", "/media");

        assertThatThrownBy(() -> storage.delete("../outside.png")).isInstanceOf(IllegalArgumentException.class);
    }
}
