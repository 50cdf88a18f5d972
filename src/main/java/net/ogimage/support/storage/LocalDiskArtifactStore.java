package net.ogimage.support.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.ogimage.application.render.ArtifactStore;
import net.ogimage.domain.render.Artifact;
import net.ogimage.exception.StorageUnavailableException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Filesystem artifact store for development without S3.
 *
 * <p>Writes {@code <fingerprint>.png} and a {@code <fingerprint>.json} sidecar holding the
 * freshness metadata. The sidecar is written last, so a lookup never sees metadata for an
 * image that is not fully on disk.</p>
 */
@Slf4j
public class LocalDiskArtifactStore implements ArtifactStore {

    private static final String BACKEND = "local-disk";

    private final Path rootDirectory;
    private final String publicBaseUrl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LocalDiskArtifactStore(Path rootDirectory, String publicBaseUrl, ObjectMapper objectMapper, Clock clock) {
        this.rootDirectory = rootDirectory;
        this.publicBaseUrl = publicBaseUrl == null ? "" : publicBaseUrl.trim();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<Artifact> lookup(String fingerprint) {
        Path sidecar = sidecarPath(fingerprint);
        if (!Files.exists(sidecar)) {
            return Optional.empty();
        }
        try {
            ArtifactSidecar metadata = objectMapper.readValue(Files.readAllBytes(sidecar), ArtifactSidecar.class);
            return Optional.of(new Artifact(
                fingerprint,
                publicUrl(imagePath(fingerprint)),
                Instant.ofEpochSecond(metadata.storedAt()),
                metadata.ttlSeconds()
            ));
        } catch (IOException | JacksonException ex) {
            log.error("Failed to read artifact metadata {}", sidecar, ex);
            throw new StorageUnavailableException(BACKEND, "Failed to read artifact metadata for " + fingerprint, ex);
        }
    }

    @Override
    public Artifact put(String fingerprint, byte[] image, Duration ttl) {
        Instant storedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        Path imagePath = imagePath(fingerprint);
        try {
            Files.createDirectories(rootDirectory);
            writeAtomically(imagePath, image);
            ArtifactSidecar sidecar = new ArtifactSidecar(fingerprint, storedAt.getEpochSecond(), ttl.toSeconds());
            writeAtomically(sidecarPath(fingerprint), objectMapper.writeValueAsBytes(sidecar));
        } catch (IOException | JacksonException ex) {
            log.error("Failed to write artifact {}", imagePath, ex);
            throw new StorageUnavailableException(BACKEND, "Failed to write artifact for " + fingerprint, ex);
        }
        log.info("Stored artifact {} ({} bytes) at {}", fingerprint, image.length, imagePath);
        return new Artifact(fingerprint, publicUrl(imagePath), storedAt, ttl.toSeconds());
    }

    private void writeAtomically(Path target, byte[] payload) throws IOException {
        Path temp = Files.createTempFile(rootDirectory, target.getFileName().toString(), ".tmp");
        Files.write(temp, payload);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path imagePath(String fingerprint) {
        return rootDirectory.resolve(fingerprint + ".png");
    }

    private Path sidecarPath(String fingerprint) {
        return rootDirectory.resolve(fingerprint + ".json");
    }

    private String publicUrl(Path imagePath) {
        if (publicBaseUrl.isEmpty()) {
            return imagePath.toAbsolutePath().toUri().toString();
        }
        String base = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
        return base + imagePath.getFileName();
    }

    record ArtifactSidecar(@JsonProperty("fingerprint") String fingerprint,
                           @JsonProperty("stored_at") long storedAt,
                           @JsonProperty("ttl_seconds") long ttlSeconds) {
    }
}
