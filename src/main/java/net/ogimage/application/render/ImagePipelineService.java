package net.ogimage.application.render;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import net.ogimage.config.PipelineProperties;
import net.ogimage.domain.render.Artifact;
import net.ogimage.domain.render.RenderTarget;
import net.ogimage.exception.InvalidImageRequestException;
import net.ogimage.exception.TaskNotFoundException;
import net.ogimage.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the render-and-cache pipeline.
 *
 * <p>{@link #requestImage(ImageRequest)} validates and normalizes the request, answers from
 * the artifact store when a fresh image exists, and otherwise acquires or joins the active
 * render task. {@link #getStatus(UUID)} is a pure read of the task ledger. Neither call waits
 * for a render.</p>
 */
@Service
public class ImagePipelineService {

    private static final Logger log = LoggerFactory.getLogger(ImagePipelineService.class);

    private final PipelineProperties properties;
    private final DomainAllowlistPolicy allowlistPolicy;
    private final Fingerprinter fingerprinter;
    private final ArtifactStore artifactStore;
    private final RenderDedupCoordinator dedupCoordinator;
    private final TaskLedger taskLedger;
    private final RenderWorkerPool workerPool;
    private final Clock clock;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public ImagePipelineService(PipelineProperties properties,
                                DomainAllowlistPolicy allowlistPolicy,
                                Fingerprinter fingerprinter,
                                ArtifactStore artifactStore,
                                RenderDedupCoordinator dedupCoordinator,
                                TaskLedger taskLedger,
                                RenderWorkerPool workerPool,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.properties = properties;
        this.allowlistPolicy = allowlistPolicy;
        this.fingerprinter = fingerprinter;
        this.artifactStore = artifactStore;
        this.dedupCoordinator = dedupCoordinator;
        this.taskLedger = taskLedger;
        this.workerPool = workerPool;
        this.clock = clock;
        this.cacheHits = meterRegistry.counter("og.pipeline.cache.hit");
        this.cacheMisses = meterRegistry.counter("og.pipeline.cache.miss");
    }

    /**
     * Returns a cached image URL or the id of the render task to poll.
     *
     * @throws InvalidImageRequestException for malformed URLs, disallowed domains or out-of-range parameters
     * @throws net.ogimage.exception.StorageUnavailableException when a backend cannot be reached
     * @throws net.ogimage.exception.DedupFailedException when task acquisition keeps losing races
     */
    public PipelineResult requestImage(ImageRequest request) {
        String url = request.url() == null ? "" : request.url().trim();
        if (UrlUtils.parseHttpUrl(url).isEmpty()) {
            throw new InvalidImageRequestException("Invalid or unsupported URL: '" + url + "'");
        }
        if (!allowlistPolicy.isAllowed(url)) {
            String domain = UrlUtils.extractHost(url).orElse(url);
            throw new InvalidImageRequestException("Domain '" + domain + "' is not allowed. Please contact "
                + properties.getContactEmail() + " if you want to whitelist it.");
        }
        int width = resolveDimension("width", request.width(), properties.getDefaultWidth(), properties.getMaxWidth());
        int height = resolveDimension("height", request.height(), properties.getDefaultHeight(), properties.getMaxHeight());
        Duration ttl = resolveTtl(request.ttlHours());

        String fingerprint = fingerprinter.fingerprint(url, width, height);

        if (!request.forceRefresh()) {
            Optional<Artifact> fresh = artifactStore.lookup(fingerprint)
                .filter(artifact -> artifact.isFreshAt(clock.instant()));
            if (fresh.isPresent()) {
                cacheHits.increment();
                log.debug("Cache hit for {} ({})", url, fingerprint);
                return PipelineResult.cached(fresh.get().url());
            }
            cacheMisses.increment();
            log.debug("Cache miss for {} ({})", url, fingerprint);
        } else {
            log.info("Force refresh requested for {} ({})", url, fingerprint);
        }

        RenderDedupCoordinator.Acquisition acquisition =
            dedupCoordinator.acquireOrJoin(fingerprint, new RenderTarget(url, width, height), ttl.toSeconds());
        if (acquisition.newOwner()) {
            workerPool.signalWork();
        }
        return PipelineResult.processing(acquisition.task().id());
    }

    /**
     * Reads the current state of a render task.
     *
     * @throws TaskNotFoundException when no task has the id
     */
    public TaskStatusView getStatus(UUID taskId) {
        return taskLedger.get(taskId)
            .map(TaskStatusView::from)
            .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private int resolveDimension(String name, Integer requested, int defaultValue, int maxValue) {
        if (requested == null) {
            return defaultValue;
        }
        if (requested <= 0 || requested > maxValue) {
            throw new InvalidImageRequestException(name + " must be between 1 and " + maxValue + " but was " + requested);
        }
        return requested;
    }

    private Duration resolveTtl(Integer ttlHours) {
        if (ttlHours == null) {
            return properties.defaultTtl();
        }
        if (ttlHours <= 0 || ttlHours > properties.getMaxTtlHours()) {
            throw new InvalidImageRequestException(
                "ttl must be between 1 and " + properties.getMaxTtlHours() + " hours but was " + ttlHours);
        }
        return Duration.ofHours(ttlHours);
    }
}
