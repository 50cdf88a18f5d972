package net.ogimage.support.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import net.ogimage.application.render.ArtifactStore;
import net.ogimage.domain.render.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-through Caffeine cache in front of another {@link ArtifactStore}.
 *
 * <p>Each entry expires at its artifact's own expiry instant. Misses are never cached so an
 * artifact written by another instance becomes visible on the next lookup, and a local
 * {@link #put} replaces the entry immediately.</p>
 */
public class CachingArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(CachingArtifactStore.class);

    private final ArtifactStore delegate;
    private final Cache<String, Artifact> cache;

    public CachingArtifactStore(ArtifactStore delegate, long maxSize, Clock clock) {
        this(delegate, maxSize, clock, Ticker.systemTicker());
    }

    CachingArtifactStore(ArtifactStore delegate, long maxSize, Clock clock, Ticker ticker) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new ArtifactExpiry(clock))
            .ticker(ticker)
            .recordStats()
            .build();
    }

    @Override
    public Optional<Artifact> lookup(String fingerprint) {
        Artifact cached = cache.getIfPresent(fingerprint);
        if (cached != null) {
            log.trace("Artifact lookup cache hit for {}", fingerprint);
            return Optional.of(cached);
        }
        Optional<Artifact> loaded = delegate.lookup(fingerprint);
        loaded.ifPresent(artifact -> cache.put(fingerprint, artifact));
        return loaded;
    }

    @Override
    public Artifact put(String fingerprint, byte[] image, Duration ttl) {
        Artifact stored = delegate.put(fingerprint, image, ttl);
        cache.put(fingerprint, stored);
        return stored;
    }

    /**
     * Publishes hit, miss and eviction counts under the {@code cache.*} meters tagged with the cache name.
     */
    public CachingArtifactStore bindMetrics(MeterRegistry registry, String cacheName) {
        CaffeineCacheMetrics.monitor(registry, cache, cacheName);
        return this;
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class ArtifactExpiry implements Expiry<String, Artifact> {

        private final Clock clock;

        private ArtifactExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, Artifact value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, Artifact value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, Artifact value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Artifact artifact) {
            Duration remaining = Duration.between(clock.instant(), artifact.expiresAt());
            if (remaining.isNegative()) {
                return 0L;
            }
            try {
                return remaining.toNanos();
            } catch (ArithmeticException overflow) {
                return Long.MAX_VALUE;
            }
        }
    }
}
