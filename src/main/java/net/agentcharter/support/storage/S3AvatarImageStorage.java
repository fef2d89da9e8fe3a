package net.agentcharter.support.storage;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Stores avatar images in an S3 (or S3-compatible) bucket.
 */
public final class S3AvatarImageStorage implements AvatarImageStorage {

    private static final Logger logger = LoggerFactory.getLogger(S3AvatarImageStorage.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String keyPrefix;
    private final String publicBaseUrl;

    public S3AvatarImageStorage(S3Client s3Client, String bucketName, String keyPrefix, String publicBaseUrl) {
        if (s3Client == null) {
            throw new IllegalArgumentException("s3Client is required");
        }
        if (!StringUtils.hasText(bucketName)) {
            throw new IllegalStateException("S3 bucket name must be configured when S3 avatar storage is active.");
        }
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.keyPrefix = keyPrefix;
        this.publicBaseUrl = StringUtils.hasText(publicBaseUrl)
            ? publicBaseUrl
            : "https://" + bucketName + ".s3.amazonaws.com";
    }

    @Override
    public String store(UUID agentId, byte[] bytes, String contentType) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Avatar bytes are required");
        }
        String key = AvatarStorageKeys.newKey(keyPrefix, agentId, contentType);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();
            s3Client.putObject(request, RequestBody.fromBytes(bytes));
            logger.info("Uploaded avatar {} ({} bytes) to bucket {}", key, bytes.length, bucketName);
            return key;
        } catch (S3Exception exception) {
            throw new AvatarStorageException("S3 error uploading avatar " + key + ": " + resolveS3ErrorMessage(exception),
                key, exception);
        } catch (SdkClientException exception) {
            throw new AvatarStorageException("Unexpected error uploading avatar " + key + ": " + exception.getMessage(),
                key, exception);
        }
    }

    @Override
    public void delete(String storageKey) {
        if (!StringUtils.hasText(storageKey)) {
            return;
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(storageKey).build());
            logger.info("Deleted avatar object {}", storageKey);
        } catch (S3Exception exception) {
            throw new AvatarStorageException("S3 error deleting avatar " + storageKey + ": " + resolveS3ErrorMessage(exception),
                storageKey, exception);
        } catch (SdkClientException exception) {
            throw new AvatarStorageException("Unexpected error deleting avatar " + storageKey + ": " + exception.getMessage(),
                storageKey, exception);
        }
    }

    @Override
    public String publicUrl(String storageKey) {
        return AvatarStorageKeys.joinUrl(publicBaseUrl, storageKey);
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return exception.getMessage();
    }
}
