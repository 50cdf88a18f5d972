package net.ogimage.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Connection settings for the bucket that holds rendered images.
 *
 * <p>Credentials normally arrive through {@code S3_ACCESS_KEY_ID} and {@code S3_SECRET_ACCESS_KEY},
 * which relaxed binding maps onto {@code s3.access-key-id} and {@code s3.secret-access-key}.</p>
 */
@Component
@ConfigurationProperties(prefix = "s3")
public class S3StorageProperties {

    private String accessKeyId = "";

    private String secretAccessKey = "";

    private String bucketName = "";

    /**
     * Custom endpoint for S3 compatible services. Blank targets AWS.
     */
    private String serverUrl = "";

    /**
     * CDN base URL that serves the bucket. Takes precedence over the endpoint when building public URLs.
     */
    private String publicCdnUrl = "";

    private String region = "us-east-1";

    /**
     * Upper bound on a whole S3 call including retries. Kept well below the abandoned-task cutoff
     * so an upload never outlives the worker's claim on its task.
     */
    private Duration apiCallTimeout = Duration.ofSeconds(30);

    @PostConstruct
    void validate() {
        Assert.isTrue(apiCallTimeout != null && !apiCallTimeout.isNegative() && !apiCallTimeout.isZero(),
            "s3.api-call-timeout must be positive");
    }

    public boolean hasCredentials() {
        return hasText(accessKeyId) && hasText(secretAccessKey);
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

    public String getBucketName() {
        return bucketName;
    }

    public void setBucketName(String bucketName) {
        this.bucketName = bucketName;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getPublicCdnUrl() {
        return publicCdnUrl;
    }

    public void setPublicCdnUrl(String publicCdnUrl) {
        this.publicCdnUrl = publicCdnUrl;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public Duration getApiCallTimeout() {
        return apiCallTimeout;
    }

    public void setApiCallTimeout(Duration apiCallTimeout) {
        this.apiCallTimeout = apiCallTimeout;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
