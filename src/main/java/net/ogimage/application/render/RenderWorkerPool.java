package net.ogimage.application.render;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import net.ogimage.config.PipelineProperties;
import net.ogimage.domain.render.Artifact;
import net.ogimage.domain.render.RenderFailureReason;
import net.ogimage.domain.render.RenderTask;
import net.ogimage.domain.render.TaskTransition;
import net.ogimage.exception.RenderFailedException;
import net.ogimage.exception.RenderTimeoutException;
import net.ogimage.exception.StorageUnavailableException;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Fixed set of workers that claim pending tasks from the ledger and render them.
 *
 * <p>Each worker claims the oldest pending task, renders it under a hard timeout, stores the
 * image and records the terminal state. Failed tasks are never retried here; a later request
 * creates a new task. When the pool is saturated pending tasks simply wait in the ledger.</p>
 */
@Service
@Slf4j
public class RenderWorkerPool {

    private final TaskLedger taskLedger;
    private final ArtifactStore artifactStore;
    private final PageRenderer pageRenderer;
    private final TimeLimiter renderTimeLimiter;
    private final PipelineProperties properties;

    private final Semaphore workSignal = new Semaphore(0);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger busyWorkers = new AtomicInteger();
    private final List<Thread> workers = new ArrayList<>();
    private final ExecutorService renderExecutor;

    private final Counter completedCounter;
    private final MeterRegistry meterRegistry;
    private final Timer renderDuration;

    public RenderWorkerPool(TaskLedger taskLedger,
                            ArtifactStore artifactStore,
                            PageRenderer pageRenderer,
                            TimeLimiter renderTimeLimiter,
                            PipelineProperties properties,
                            MeterRegistry meterRegistry) {
        this.taskLedger = taskLedger;
        this.artifactStore = artifactStore;
        this.pageRenderer = pageRenderer;
        this.renderTimeLimiter = renderTimeLimiter;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.completedCounter = meterRegistry.counter("og.render.completed");
        this.renderDuration = meterRegistry.timer("og.render.duration");
        AtomicInteger renderThreadCounter = new AtomicInteger();
        // One browser thread per worker. A render that ignores interruption keeps its slot.
        this.renderExecutor = Executors.newFixedThreadPool(properties.getWorkers(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("og-render-" + renderThreadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the worker threads. Idempotent.
     */
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 1; i <= properties.getWorkers(); i++) {
            String workerId = "render-worker-" + i + "-" + Long.toHexString(System.nanoTime());
            Thread thread = new Thread(() -> runWorker(workerId), "render-worker-" + i);
            thread.setDaemon(true);
            workers.add(thread);
            thread.start();
        }
        log.info("Started {} render workers (render timeout {}s)",
            properties.getWorkers(), properties.getRenderTimeout().toSeconds());
    }

    /**
     * Stops the workers and interrupts in-flight renders. The pool cannot be restarted.
     */
    @PreDestroy
    public synchronized void stop() {
        boolean wasRunning = running.getAndSet(false);
        workers.forEach(Thread::interrupt);
        workers.clear();
        renderExecutor.shutdownNow();
        if (wasRunning) {
            log.info("Stopped render workers");
        }
    }

    /**
     * Wakes an idle worker after a new pending task was created.
     */
    public void signalWork() {
        if (workSignal.availablePermits() < properties.getWorkers()) {
            workSignal.release();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int busyWorkers() {
        return busyWorkers.get();
    }

    public int workerCount() {
        return properties.getWorkers();
    }

    /**
     * Claims and processes at most one pending task on the calling thread.
     *
     * @return true when a task was claimed
     */
    public boolean processNext(String workerId) {
        Optional<RenderTask> claimed = taskLedger.claimNextPending(workerId);
        if (claimed.isEmpty()) {
            return false;
        }
        busyWorkers.incrementAndGet();
        try {
            execute(claimed.get(), workerId);
        } finally {
            busyWorkers.decrementAndGet();
        }
        return true;
    }

    private void runWorker(String workerId) {
        log.info("Render worker {} started", workerId);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean claimed;
            try {
                claimed = processNext(workerId);
            } catch (StorageUnavailableException ex) {
                log.error("Render worker {} cannot reach the task ledger: {}", workerId, ex.getMessage(), ex);
                claimed = false;
            } catch (RuntimeException ex) {
                log.error("Render worker {} hit an unexpected error", workerId, ex);
                claimed = false;
            }
            if (!claimed && !awaitWork()) {
                break;
            }
        }
        log.info("Render worker {} stopped", workerId);
    }

    private boolean awaitWork() {
        try {
            workSignal.tryAcquire(properties.getIdlePollInterval().toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void execute(RenderTask task, String workerId) {
        log.info("Worker {} claimed render task {} for {}", workerId, task.id(), task.target().url());
        Timer.Sample sample = Timer.start(meterRegistry);
        Callable<byte[]> renderCall = () -> pageRenderer.render(task.target(), properties.getPageLoadTimeout());
        byte[] image;
        try {
            image = renderTimeLimiter.executeFutureSupplier(() -> renderExecutor.submit(renderCall));
        } catch (TimeoutException | RenderTimeoutException ex) {
            fail(task, workerId, RenderFailureReason.TIMEOUT, null);
            return;
        } catch (RenderFailedException ex) {
            fail(task, workerId, RenderFailureReason.RENDER_ERROR, ex.getMessage());
            return;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fail(task, workerId, RenderFailureReason.RENDER_ERROR, "worker interrupted");
            return;
        } catch (Exception ex) {
            log.error("Renderer threw unexpectedly for task {}", task.id(), ex);
            fail(task, workerId, RenderFailureReason.RENDER_ERROR, ex.getMessage());
            return;
        } finally {
            sample.stop(renderDuration);
        }

        if (taskLedger.heartbeat(task.id(), workerId).isEmpty()) {
            log.warn("Render task {} was no longer owned by {} after rendering, discarding image", task.id(), workerId);
            return;
        }

        Artifact artifact;
        try {
            artifact = artifactStore.put(task.fingerprint(), image, Duration.ofSeconds(task.ttlSeconds()));
        } catch (StorageUnavailableException ex) {
            log.error("Failed to store artifact for task {}", task.id(), ex);
            fail(task, workerId, RenderFailureReason.STORAGE_ERROR, ex.getMessage());
            return;
        }

        Optional<RenderTask> completed = taskLedger.transition(TaskTransition.complete(task.id(), workerId, artifact.url()));
        if (completed.isPresent()) {
            completedCounter.increment();
            log.info("Render task {} completed: {}", task.id(), artifact.url());
        } else {
            log.warn("Render task {} was no longer owned by {} when completing", task.id(), workerId);
        }
    }

    private void fail(RenderTask task, String workerId, RenderFailureReason reason, String detail) {
        String errorMessage = reason.describe(detail);
        Optional<RenderTask> failed = taskLedger.transition(TaskTransition.fail(task.id(), workerId, errorMessage));
        meterRegistry.counter("og.render.failed", "reason", reason.code()).increment();
        if (failed.isPresent()) {
            log.warn("Render task {} for {} failed: {}", task.id(), task.target().url(), errorMessage);
        } else {
            log.warn("Render task {} was no longer owned by {} when failing with {}", task.id(), workerId, errorMessage);
        }
    }
}
