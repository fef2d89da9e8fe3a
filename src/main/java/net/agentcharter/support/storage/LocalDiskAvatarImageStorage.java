package net.agentcharter.support.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Filesystem avatar storage used when no S3 bucket is configured.
 */
public final class LocalDiskAvatarImageStorage implements AvatarImageStorage {

    private static final Logger logger = LoggerFactory.getLogger(LocalDiskAvatarImageStorage.class);

    private final Path rootDirectory;
    private final String keyPrefix;
    private final String publicBaseUrl;

    public LocalDiskAvatarImageStorage(Path rootDirectory, String keyPrefix, String publicBaseUrl) {
        if (rootDirectory == null) {
            throw new IllegalArgumentException("rootDirectory is required");
        }
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        this.keyPrefix = keyPrefix;
        this.publicBaseUrl = publicBaseUrl;
    }

    @Override
    public String store(UUID agentId, byte[] bytes, String contentType) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Avatar bytes are required");
        }
        String key = AvatarStorageKeys.newKey(keyPrefix, agentId, contentType);
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
            logger.info("Wrote avatar {} ({} bytes) to {}", key, bytes.length, target);
            return key;
        } catch (IOException exception) {
            throw new AvatarStorageException("Failed to write avatar " + key + " to " + target, key, exception);
        }
    }

    @Override
    public void delete(String storageKey) {
        if (!StringUtils.hasText(storageKey)) {
            return;
        }
        Path target = resolve(storageKey);
        try {
            if (Files.deleteIfExists(target)) {
                logger.info("Deleted avatar file {}", target);
            }
        } catch (IOException exception) {
            throw new AvatarStorageException("Failed to delete avatar file " + target, storageKey, exception);
        }
    }

    @Override
    public String publicUrl(String storageKey) {
        return AvatarStorageKeys.joinUrl(publicBaseUrl, storageKey);
    }

    private Path resolve(String storageKey) {
        Path resolved = rootDirectory.resolve(storageKey).normalize();
        if (!resolved.startsWith(rootDirectory)) {
            throw new IllegalArgumentException("Storage key escapes the avatar directory: " + storageKey);
        }
        return resolved;
    }
}
