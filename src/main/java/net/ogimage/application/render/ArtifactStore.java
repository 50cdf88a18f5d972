package net.ogimage.application.render;

import java.time.Duration;
import java.util.Optional;
import net.ogimage.domain.render.Artifact;
import net.ogimage.exception.StorageUnavailableException;

/**
 * Key to artifact lookup over the blob backend.
 *
 * <p>Implementations surface backend failures as {@link StorageUnavailableException} and
 * must provide read-after-write consistency: a lookup reflects the latest successful put.</p>
 */
public interface ArtifactStore {

    /**
     * @return the stored artifact for the fingerprint regardless of freshness, or empty when none exists
     */
    Optional<Artifact> lookup(String fingerprint);

    /**
     * Stores rendered PNG bytes under the fingerprint, replacing any previous artifact.
     */
    Artifact put(String fingerprint, byte[] image, Duration ttl);
}
