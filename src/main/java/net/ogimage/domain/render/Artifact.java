package net.ogimage.domain.render;

import java.time.Instant;

/**
 * A rendered image persisted in the blob backend together with its freshness metadata.
 *
 * <p>Artifacts are written once and never mutated. A stale artifact is replaced by a new
 * render, not refreshed in place.</p>
 *
 * @param fingerprint cache key the artifact satisfies
 * @param url public location of the stored image
 * @param storedAt instant the image was written
 * @param ttlSeconds freshness window measured from {@code storedAt}
 */
public record Artifact(String fingerprint, String url, Instant storedAt, long ttlSeconds) {

    public Artifact {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("Artifact fingerprint is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Artifact url is required");
        }
        if (storedAt == null) {
            throw new IllegalArgumentException("Artifact storedAt is required");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("Artifact ttlSeconds must be non-negative");
        }
    }

    public Instant expiresAt() {
        return storedAt.plusSeconds(ttlSeconds);
    }

    /**
     * Fresh iff {@code now < storedAt + ttlSeconds}; the expiry instant itself is already stale.
     */
    public boolean isFreshAt(Instant now) {
        return now.isBefore(expiresAt());
    }
}
