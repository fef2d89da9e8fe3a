/**
 * S3 client for avatar image storage, built from {@code app.avatars.s3}. Supports a custom
 * endpoint for MinIO or other S3-compatible services.
 */
package net.agentcharter.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    @Bean(destroyMethod = "close")
    public S3Client avatarS3Client(AvatarStorageProperties properties) {
        AvatarStorageProperties.S3 s3 = properties.getS3();
        if (!s3.isConfigured()) {
            throw new IllegalStateException("Avatar S3 settings are incomplete: app.avatars.s3.bucket, access-key-id and secret-access-key are required");
        }
        String region = StringUtils.hasText(s3.getRegion()) ? s3.getRegion().trim() : "us-west-2";
        try {
            S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(s3.getAccessKeyId().trim(), s3.getSecretAccessKey().trim())));
            if (StringUtils.hasText(s3.getServerUrl())) {
                builder.endpointOverride(URI.create(s3.getServerUrl().trim()));
                builder.forcePathStyle(true);
                logger.info("Avatar bucket {} served by custom endpoint {} (region {})", s3.getBucket(), s3.getServerUrl(), region);
            } else {
                logger.info("Avatar bucket {} served by AWS in region {}", s3.getBucket(), region);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create avatar S3Client for bucket {}", s3.getBucket(), ex);
            throw new IllegalStateException("Failed to configure avatar S3Client", ex);
        }
    }
}
