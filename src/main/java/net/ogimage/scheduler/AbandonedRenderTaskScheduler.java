package net.ogimage.scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.ogimage.application.render.TaskLedger;
import net.ogimage.config.PipelineProperties;
import net.ogimage.domain.render.RenderFailureReason;
import net.ogimage.domain.render.RenderTask;
import net.ogimage.domain.render.TaskTransition;
import net.ogimage.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails processing tasks whose owning worker went away.
 *
 * <p>A task still in processing after the render timeout plus a grace period can no longer
 * be completed by its owner, which has already given up or crashed. Failing it on the
 * owner's behalf frees the fingerprint for a new task.</p>
 */
@Component
public class AbandonedRenderTaskScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbandonedRenderTaskScheduler.class);

    private final TaskLedger taskLedger;
    private final PipelineProperties properties;
    private final Clock clock;

    public AbandonedRenderTaskScheduler(TaskLedger taskLedger, PipelineProperties properties, Clock clock) {
        this.taskLedger = taskLedger;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${og.pipeline.abandoned-task-sweep-interval:PT30S}",
        initialDelayString = "${og.pipeline.abandoned-task-sweep-interval:PT30S}")
    public void sweep() {
        try {
            int reaped = failAbandonedTasks();
            if (reaped > 0) {
                LOGGER.warn("Failed {} abandoned render task(s)", reaped);
            }
        } catch (StorageUnavailableException ex) {
            LOGGER.error("Abandoned render task sweep skipped: {}", ex.getMessage(), ex);
        }
    }

    /**
     * @return number of tasks moved to failed
     */
    public int failAbandonedTasks() {
        Instant cutoff = clock.instant()
            .minus(properties.getRenderTimeout())
            .minus(properties.getAbandonedTaskGrace());
        List<RenderTask> stale = taskLedger.findProcessingUpdatedBefore(cutoff);
        int reaped = 0;
        for (RenderTask task : stale) {
            if (task.ownerId() == null) {
                LOGGER.warn("Processing render task {} has no owner recorded; leaving it untouched", task.id());
                continue;
            }
            Optional<RenderTask> failed = taskLedger.transition(TaskTransition.fail(
                task.id(), task.ownerId(), RenderFailureReason.ABANDONED.describe(null)));
            if (failed.isPresent()) {
                LOGGER.warn("Render task {} for {} abandoned by {} (last update {})",
                    task.id(), task.target().url(), task.ownerId(), task.updatedAt());
                reaped++;
            }
        }
        return reaped;
    }
}
