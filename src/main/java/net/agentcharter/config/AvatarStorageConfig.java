package net.agentcharter.config;

import java.nio.file.Path;
import net.agentcharter.support.storage.AvatarImageStorage;
import net.agentcharter.support.storage.LocalDiskAvatarImageStorage;
import net.agentcharter.support.storage.S3AvatarImageStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Chooses S3 avatar storage when an {@link S3Client} bean exists, local disk otherwise.
 */
@Configuration
public class AvatarStorageConfig {

    private static final Logger logger = LoggerFactory.getLogger(AvatarStorageConfig.class);

    @Bean
    public AvatarImageStorage avatarImageStorage(ObjectProvider<S3Client> s3ClientProvider,
                                                 AvatarStorageProperties properties) {
        S3Client s3Client = s3ClientProvider.getIfAvailable();
        if (s3Client != null) {
            AvatarStorageProperties.S3 s3 = properties.getS3();
            return new S3AvatarImageStorage(s3Client, s3.getBucket(), properties.getKeyPrefix(), s3.getCdnUrl());
        }
        Path directory = Path.of(properties.getLocalDirectory());
        logger.info("Avatar images will be stored under {}", directory.toAbsolutePath());
        return new LocalDiskAvatarImageStorage(directory, properties.getKeyPrefix(), properties.getPublicBaseUrl());
    }
}
