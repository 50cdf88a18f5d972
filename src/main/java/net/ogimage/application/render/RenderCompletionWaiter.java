package net.ogimage.application.render;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import net.ogimage.config.PipelineProperties;
import net.ogimage.domain.render.RenderTaskState;
import net.ogimage.exception.RenderWaitTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Waits for a render task to finish without holding a request thread.
 *
 * <p>The task status is re-read on the application {@link TaskScheduler} every
 * {@code og.pipeline.redirect-poll-interval} until it is completed or failed, or until
 * {@code og.pipeline.redirect-wait-timeout} elapses. The render itself is unaffected by a
 * waiter giving up.</p>
 */
@Service
public class RenderCompletionWaiter {

    private static final Logger log = LoggerFactory.getLogger(RenderCompletionWaiter.class);

    private final ImagePipelineService pipelineService;
    private final TaskScheduler taskScheduler;
    private final Duration waitTimeout;
    private final Duration pollInterval;

    public RenderCompletionWaiter(ImagePipelineService pipelineService,
                                  TaskScheduler taskScheduler,
                                  PipelineProperties properties) {
        this.pipelineService = pipelineService;
        this.taskScheduler = taskScheduler;
        this.waitTimeout = properties.getRedirectWaitTimeout();
        this.pollInterval = properties.getRedirectPollInterval();
    }

    /**
     * @return future completed with the terminal status view, or failed with
     *     {@link RenderWaitTimeoutException} when the wait runs out
     */
    public CompletableFuture<TaskStatusView> awaitTerminal(UUID taskId) {
        CompletableFuture<TaskStatusView> result = new CompletableFuture<>();
        long deadline = System.nanoTime() + waitTimeout.toNanos();
        check(taskId, deadline, result);
        return result;
    }

    private void check(UUID taskId, long deadline, CompletableFuture<TaskStatusView> result) {
        if (result.isDone()) {
            return;
        }
        try {
            TaskStatusView view = pipelineService.getStatus(taskId);
            if (isTerminal(view)) {
                result.complete(view);
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                log.warn("Gave up waiting for render task {} (still {}) after {}s", taskId, view.status(), waitTimeout.toSeconds());
                result.completeExceptionally(new RenderWaitTimeoutException(taskId, waitTimeout));
                return;
            }
            log.debug("Render task {} is {}, checking again in {}ms", taskId, view.status(), pollInterval.toMillis());
            taskScheduler.schedule(() -> check(taskId, deadline, result),
                taskScheduler.getClock().instant().plus(pollInterval));
        } catch (RuntimeException ex) {
            result.completeExceptionally(ex);
        }
    }

    private static boolean isTerminal(TaskStatusView view) {
        return RenderTaskState.COMPLETED.statusLabel().equals(view.status())
            || RenderTaskState.FAILED.statusLabel().equals(view.status());
    }
}
