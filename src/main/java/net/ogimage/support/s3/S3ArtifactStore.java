package net.ogimage.support.s3;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import net.ogimage.application.render.ArtifactStore;
import net.ogimage.domain.render.Artifact;
import net.ogimage.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Artifact store backed by an S3 bucket.
 *
 * <p>Objects live at {@code <prefix><fingerprint>.png}. Freshness metadata travels as user
 * metadata ({@code stored-at} in epoch seconds and {@code ttl-seconds}) so a lookup needs
 * only a HEAD request.</p>
 */
public class S3ArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(S3ArtifactStore.class);

    static final String STORED_AT_METADATA = "stored-at";
    static final String TTL_METADATA = "ttl-seconds";
    private static final String CONTENT_TYPE = "image/png";

    private final S3ObjectStorageGateway gateway;
    private final String keyPrefix;
    private final Clock clock;

    public S3ArtifactStore(S3ObjectStorageGateway gateway, String keyPrefix, Clock clock) {
        this.gateway = gateway;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.clock = clock;
    }

    @Override
    public Optional<Artifact> lookup(String fingerprint) {
        String key = objectKey(fingerprint);
        return gateway.headObject(key).map(metadata -> toArtifact(fingerprint, metadata));
    }

    @Override
    public Artifact put(String fingerprint, byte[] image, Duration ttl) {
        String key = objectKey(fingerprint);
        Instant storedAt = clock.instant();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(STORED_AT_METADATA, Long.toString(storedAt.getEpochSecond()));
        metadata.put(TTL_METADATA, Long.toString(ttl.toSeconds()));
        try {
            String url = gateway.uploadBytesAsync(key, image, CONTENT_TYPE, metadata).join();
            return new Artifact(fingerprint, url, Instant.ofEpochSecond(storedAt.getEpochSecond()), ttl.toSeconds());
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof StorageUnavailableException storageUnavailable) {
                throw storageUnavailable;
            }
            throw new StorageUnavailableException("s3", "Upload of " + key + " failed: " + cause.getMessage(), cause);
        }
    }

    String objectKey(String fingerprint) {
        return keyPrefix + fingerprint + ".png";
    }

    private Artifact toArtifact(String fingerprint, S3ObjectStorageGateway.ObjectMetadata metadata) {
        Map<String, String> userMetadata = metadata.userMetadata();
        Instant storedAt = parseEpochSeconds(userMetadata.get(STORED_AT_METADATA))
            .orElseGet(() -> metadata.lastModified() != null ? metadata.lastModified() : Instant.EPOCH);
        long ttlSeconds = parseLong(userMetadata.get(TTL_METADATA)).orElse(0L);
        if (!userMetadata.containsKey(TTL_METADATA)) {
            log.debug("Artifact {} has no ttl metadata, treating it as expired", metadata.key());
        }
        return new Artifact(fingerprint, gateway.resolvePublicUrl(metadata.key()), storedAt, ttlSeconds);
    }

    private static Optional<Instant> parseEpochSeconds(String value) {
        return parseLong(value).map(Instant::ofEpochSecond);
    }

    private static Optional<Long> parseLong(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Math.max(0L, Long.parseLong(value.trim())));
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed artifact metadata value '{}'", value);
            return Optional.empty();
        }
    }
}
