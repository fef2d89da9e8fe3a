package net.agentcharter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Typed configuration for avatar image storage.
 */
@Component
@ConfigurationProperties(prefix = AvatarStorageProperties.PREFIX)
public class AvatarStorageProperties {

    static final String PREFIX = "app.avatars";

    private String keyPrefix = "avatars";
    private String localDirectory = "data/avatars";
    private String publicBaseUrl = "/media";
    private S3 s3 = new S3();

    /**
     * Object key prefix shared by S3 and local storage.
     */
    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    /**
     * Directory used when S3 is not configured.
     */
    public String getLocalDirectory() {
        return localDirectory;
    }

    public void setLocalDirectory(String localDirectory) {
        this.localDirectory = localDirectory;
    }

    /**
     * Base URL prepended to storage keys when avatars live on local disk.
     */
    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    public S3 getS3() {
        return s3;
    }

    public void setS3(S3 s3) {
        this.s3 = s3 == null ? new S3() : s3;
    }

    /**
     * Bucket and credentials for S3-backed avatars. All three of bucket, access key and secret
     * must be set before S3 storage is used.
     */
    public static class S3 {

        private String bucket;
        private String accessKeyId;
        private String secretAccessKey;
        private String serverUrl;
        private String region = "us-west-2";
        private String cdnUrl;

        public boolean isConfigured() {
            return StringUtils.hasText(bucket)
                && StringUtils.hasText(accessKeyId)
                && StringUtils.hasText(secretAccessKey);
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getAccessKeyId() {
            return accessKeyId;
        }

        public void setAccessKeyId(String accessKeyId) {
            this.accessKeyId = accessKeyId;
        }

        public String getSecretAccessKey() {
            return secretAccessKey;
        }

        public void setSecretAccessKey(String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
        }

        /**
         * Endpoint override for MinIO and other S3-compatible services; path-style access is forced when set.
         */
        public String getServerUrl() {
            return serverUrl;
        }

        public void setServerUrl(String serverUrl) {
            this.serverUrl = serverUrl;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        /**
         * Public base URL for stored avatars; the bucket's virtual-host URL when blank.
         */
        public String getCdnUrl() {
            return cdnUrl;
        }

        public void setCdnUrl(String cdnUrl) {
            this.cdnUrl = cdnUrl;
        }
    }
}
