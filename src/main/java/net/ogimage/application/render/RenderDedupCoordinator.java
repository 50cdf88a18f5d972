package net.ogimage.application.render;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import net.ogimage.config.PipelineProperties;
import net.ogimage.domain.render.RenderTarget;
import net.ogimage.domain.render.RenderTask;
import net.ogimage.exception.DedupFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Guarantees at most one active render task per fingerprint.
 *
 * <p>Correctness rests on the ledger's atomic {@link TaskLedger#createIfAbsent(RenderTask)}:
 * a caller that loses the insert race re-reads and joins the winner's task, within a bounded
 * number of attempts. Concurrent callers in this process are additionally collapsed onto a
 * single ledger round trip per fingerprint.</p>
 */
@Service
public class RenderDedupCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RenderDedupCoordinator.class);

    private final TaskLedger taskLedger;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration backoff;
    private final ConcurrentMap<String, CompletableFuture<Acquisition>> inFlight = new ConcurrentHashMap<>();

    public RenderDedupCoordinator(TaskLedger taskLedger, Clock clock, PipelineProperties properties) {
        this.taskLedger = taskLedger;
        this.clock = clock;
        this.maxAttempts = properties.getDedupMaxAttempts();
        this.backoff = properties.getDedupBackoff();
    }

    /**
     * Result of {@link #acquireOrJoin}.
     *
     * @param task the active task for the fingerprint
     * @param newOwner true when this call created the task and must signal the worker pool
     */
    public record Acquisition(RenderTask task, boolean newOwner) {
    }

    /**
     * Returns the active task for the fingerprint, creating a pending one when none exists.
     *
     * @throws DedupFailedException when every creation attempt lost a race without a task to join
     */
    public Acquisition acquireOrJoin(String fingerprint, RenderTarget target, long ttlSeconds) {
        CompletableFuture<Acquisition> mine = new CompletableFuture<>();
        CompletableFuture<Acquisition> existing = inFlight.putIfAbsent(fingerprint, mine);
        if (existing != null) {
            Acquisition shared = awaitShared(existing);
            log.debug("Joined concurrent acquisition of render task {} for {}", shared.task().id(), fingerprint);
            return new Acquisition(shared.task(), false);
        }
        try {
            Acquisition acquisition = acquireFromLedger(fingerprint, target, ttlSeconds);
            mine.complete(acquisition);
            return acquisition;
        } catch (RuntimeException ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(fingerprint, mine);
        }
    }

    /**
     * Joins the active task or inserts a new one. An empty insert result means another creator
     * won the race between our read and our insert, so the next attempt re-reads and joins it.
     * Backoff between attempts grows linearly.
     */
    private Acquisition acquireFromLedger(String fingerprint, RenderTarget target, long ttlSeconds) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<RenderTask> active = taskLedger.findActive(fingerprint);
            if (active.isPresent()) {
                log.info("Joining active render task {} ({}) for {}",
                    active.get().id(), active.get().state().statusLabel(), fingerprint);
                return new Acquisition(active.get(), false);
            }
            RenderTask candidate = RenderTask.pending(UUID.randomUUID(), fingerprint, target, ttlSeconds, clock.instant());
            Optional<RenderTask> created = taskLedger.createIfAbsent(candidate);
            if (created.isPresent()) {
                log.info("Created render task {} for {} ({})", created.get().id(), target.url(), fingerprint);
                return new Acquisition(created.get(), true);
            }
            if (attempt < maxAttempts) {
                long backoffMillis = Math.max(backoff.toMillis(), 1L) * attempt;
                log.debug("Lost render task creation race for {} (attempt {}/{}). Retrying in {}ms",
                    fingerprint, attempt, maxAttempts, backoffMillis);
                pause(backoffMillis);
            }
        }
        log.warn("Gave up acquiring render task for {} after {} attempts", fingerprint, maxAttempts);
        throw new DedupFailedException(fingerprint, maxAttempts);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry render task creation", ex);
        }
    }

    private static Acquisition awaitShared(CompletableFuture<Acquisition> shared) {
        try {
            return shared.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw ex;
        }
    }
}
