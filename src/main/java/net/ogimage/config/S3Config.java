/**
 * S3 client for the rendered image bucket
 *
 * Features:
 * - Only active for the S3 artifact store and only when both credentials are present
 * - Path-style addressing against a custom endpoint (MinIO, DigitalOcean Spaces)
 * - Every call bounded by s3.api-call-timeout so a stuck upload fails the render as a storage error
 */
package net.ogimage.config;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

@Configuration
@ConditionalOnExpression(
    "'${og.pipeline.artifact-store:s3}' == 's3'"
        + " and !'${s3.access-key-id:}'.isBlank()"
        + " and !'${s3.secret-access-key:}'.isBlank()")
public class S3Config {

    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    @Bean(destroyMethod = "close")
    public S3Client s3Client(S3StorageProperties s3) {
        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(s3.getRegion()))
            .credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create(s3.getAccessKeyId(), s3.getSecretAccessKey())))
            .overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(s3.getApiCallTimeout())
                .build());
        if (StringUtils.hasText(s3.getServerUrl())) {
            builder.endpointOverride(URI.create(s3.getServerUrl().trim())).forcePathStyle(true);
        }
        logger.info("Artifact bucket '{}' via {} (region {}, call timeout {}s)",
            s3.getBucketName(),
            StringUtils.hasText(s3.getServerUrl()) ? s3.getServerUrl() : "AWS",
            s3.getRegion(),
            s3.getApiCallTimeout().toSeconds());
        return builder.build();
    }
}
