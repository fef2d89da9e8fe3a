package net.agentcharter.support.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

@ExtendWith(MockitoExtension.class)
class S3AvatarImageStorageTest {

    @Mock
    private S3Client s3Client;

    @Test
    void should_PutObjectWithContentType_When_Storing() {
        S3AvatarImageStorage storage = new S3AvatarImageStorage(s3Client, "agent-media", "avatars", "https://cdn.example.com/");
        UUID agentId = UUID.randomUUID();

        String key = storage.store(agentId, new byte[] {1, 2}, "image/jpeg");

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("agent-media");
        assertThat(request.getValue().key()).isEqualTo(key).startsWith("avatars/" + agentId + "/").endsWith(".jpg");
        assertThat(request.getValue().contentType()).isEqualTo("image/jpeg");
        assertThat(storage.publicUrl(key)).isEqualTo("https://cdn.example.com/" + key);
    }

    @Test
    void should_WrapS3Error_When_UploadFails() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(S3Exception.builder().message("Access Denied").build());
        S3AvatarImageStorage storage = new S3AvatarImageStorage(s3Client, "agent-media", "avatars", null);

        assertThatThrownBy(() -> storage.store(UUID.randomUUID(), new byte[] {1}, "image/png"))
            .isInstanceOf(AvatarStorageException.class)
            .hasMessageContaining("Access Denied");
    }

    @Test
    void should_DeleteObjectInBucket_When_Deleting() {
        S3AvatarImageStorage storage = new S3AvatarImageStorage(s3Client, "agent-media", "avatars", null);

        storage.delete("avatars/a/b.png");

        ArgumentCaptor<DeleteObjectRequest> request = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(request.capture());
        assertThat(request.getValue().key()).isEqualTo("avatars/a/b.png");
        assertThat(storage.publicUrl("avatars/a/b.png")).isEqualTo("https://agent-media.s3.amazonaws.com/avatars/a/b.png");
    }
}
