package net.ogimage.support.s3;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import net.ogimage.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Infrastructure adapter for the S3 operations the artifact store needs.
 *
 * <p>This gateway centralizes all direct AWS SDK usage so higher layers deal in keys, bytes
 * and metadata. SDK failures are translated to {@link StorageUnavailableException}.</p>
 */
public final class S3ObjectStorageGateway {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorageGateway.class);
    private static final String BACKEND = "s3";

    private final S3Client s3Client;
    private final String bucketName;
    private final String publicCdnUrl;
    private final String serverUrl;

    public S3ObjectStorageGateway(@Nullable S3Client s3Client,
                                  String bucketName,
                                  String publicCdnUrl,
                                  String serverUrl) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.publicCdnUrl = publicCdnUrl;
        this.serverUrl = serverUrl;
    }

    /**
     * Validates startup configuration for this adapter.
     */
    public void validateConfiguration() {
        if (s3Client == null) {
            logger.warn("S3 object storage gateway initialized without an S3 client. Artifact reads and writes will fail.");
            return;
        }
        if (!hasText(bucketName)) {
            throw new IllegalStateException("S3 bucket name must be configured when S3 object storage is active.");
        }
    }

    public boolean isConfigured() {
        return s3Client != null && hasText(bucketName);
    }

    /**
     * Confirms the bucket exists and the credentials can reach it.
     *
     * @throws StorageUnavailableException when the client is missing or S3 rejects the request
     */
    public void verifyBucketAccess() {
        S3Client client = requireClient("head bucket", bucketName);
        try {
            client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
        } catch (S3Exception exception) {
            throw new StorageUnavailableException(BACKEND,
                "S3 error reaching bucket " + bucketName + ": " + resolveS3ErrorMessage(exception), exception);
        } catch (SdkClientException exception) {
            throw new StorageUnavailableException(BACKEND,
                "S3 client error reaching bucket " + bucketName + ": " + exception.getMessage(), exception);
        }
    }

    /**
     * Uploads a public-read object with user metadata and returns its public URL.
     */
    public CompletableFuture<String> uploadBytesAsync(String keyName,
                                                      byte[] payload,
                                                      String contentType,
                                                      Map<String, String> metadata) {
        return Mono.fromCallable(() -> {
                S3Client client = requireClient("upload", keyName);
                PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(keyName)
                    .contentType(contentType)
                    .acl(ObjectCannedACL.PUBLIC_READ)
                    .metadata(metadata)
                    .build();

                client.putObject(putObjectRequest, RequestBody.fromBytes(payload));
                logger.info("Successfully uploaded {} ({} bytes) to S3 bucket {}", keyName, payload.length, bucketName);
                return resolvePublicUrl(keyName);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(S3Exception.class, exception -> new StorageUnavailableException(
                BACKEND, "S3 error uploading key " + keyName + ": " + resolveS3ErrorMessage(exception), exception))
            .onErrorMap(SdkClientException.class, exception -> new StorageUnavailableException(
                BACKEND, "S3 client error uploading key " + keyName + ": " + exception.getMessage(), exception))
            .toFuture();
    }

    /**
     * Reads object metadata without downloading the payload.
     *
     * @return metadata of the stored object, or empty when the key does not exist
     */
    public Optional<ObjectMetadata> headObject(String keyName) {
        S3Client client = requireClient("head", keyName);
        try {
            HeadObjectResponse response = client.headObject(HeadObjectRequest.builder()
                .bucket(bucketName)
                .key(keyName)
                .build());
            return Optional.of(new ObjectMetadata(keyName, response.metadata(), response.lastModified()));
        } catch (NoSuchKeyException exception) {
            if (logger.isTraceEnabled()) {
                logger.trace("S3 key {} not found: {}", keyName, exception.getMessage());
            }
            return Optional.empty();
        } catch (S3Exception exception) {
            if (exception.statusCode() == 404) {
                return Optional.empty();
            }
            logger.error("S3 error reading metadata for key {}: {}", keyName, resolveS3ErrorMessage(exception), exception);
            throw new StorageUnavailableException(BACKEND,
                "S3 error reading key " + keyName + ": " + resolveS3ErrorMessage(exception), exception);
        } catch (SdkClientException exception) {
            logger.error("S3 client error reading metadata for key {}: {}", keyName, exception.getMessage(), exception);
            throw new StorageUnavailableException(BACKEND,
                "S3 client error reading key " + keyName + ": " + exception.getMessage(), exception);
        }
    }

    /**
     * Public URL for a key: CDN base when configured, else the custom endpoint, else AWS virtual-hosted style.
     */
    public String resolvePublicUrl(String keyName) {
        String normalizedKey = normalizePathSegment(keyName);

        if (hasText(publicCdnUrl)) {
            return joinPath(normalizeBaseUrl(publicCdnUrl), normalizedKey);
        }
        if (hasText(serverUrl)) {
            return joinPath(joinPath(normalizeBaseUrl(serverUrl), bucketName), normalizedKey);
        }
        return "https://" + bucketName + ".s3.amazonaws.com/" + normalizedKey;
    }

    /**
     * Returns the configured bucket name.
     */
    public String bucketName() {
        return bucketName;
    }

    /**
     * User metadata and modification time of a stored object.
     */
    public record ObjectMetadata(String key, Map<String, String> userMetadata, @Nullable Instant lastModified) {
        public ObjectMetadata {
            userMetadata = userMetadata == null ? Map.of() : Map.copyOf(userMetadata);
        }
    }

    private S3Client requireClient(String operation, String keyName) {
        if (s3Client == null) {
            throw new StorageUnavailableException(BACKEND,
                "S3 client is not configured for " + operation + " operation (key: " + keyName + ")");
        }
        return s3Client;
    }

    private static String normalizeBaseUrl(String value) {
        String trimmed = Objects.requireNonNullElse(value, "").trim();
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String normalizePathSegment(String value) {
        String trimmed = Objects.requireNonNullElse(value, "").trim();
        if (trimmed.startsWith("/")) {
            return trimmed.substring(1);
        }
        return trimmed;
    }

    private static String joinPath(String base, String suffix) {
        if (!hasText(base)) {
            return suffix;
        }
        if (base.endsWith("/")) {
            return base + suffix;
        }
        return base + "/" + suffix;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return exception.getMessage();
    }
}
