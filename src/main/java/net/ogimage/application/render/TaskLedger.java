package net.ogimage.application.render;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.ogimage.domain.render.RenderTask;
import net.ogimage.domain.render.TaskTransition;

/**
 * Source of truth for render task records.
 *
 * <p>Two guarantees back the pipeline: {@link #createIfAbsent(RenderTask)} is an atomic
 * check-and-create per fingerprint, and {@link #transition(TaskTransition)} only applies when
 * the stored task still matches the expected state and owner. Backend failures surface as
 * {@link net.ogimage.exception.StorageUnavailableException}.</p>
 */
public interface TaskLedger {

    /**
     * Inserts the pending task unless an active task already exists for its fingerprint.
     *
     * @return the inserted task, or empty when another active task holds the fingerprint
     */
    Optional<RenderTask> createIfAbsent(RenderTask pendingTask);

    /**
     * Finds the pending or processing task for the fingerprint, if any.
     */
    Optional<RenderTask> findActive(String fingerprint);

    Optional<RenderTask> get(UUID taskId);

    /**
     * Claims the oldest pending task for the worker, moving it to processing.
     *
     * @return the claimed task, or empty when nothing is pending
     */
    Optional<RenderTask> claimNextPending(String workerId);

    /**
     * Applies a guarded transition.
     *
     * @return the updated task, or empty when the task is missing, in another state or owned by someone else
     */
    Optional<RenderTask> transition(TaskTransition transition);

    /**
     * Marks a processing task as still alive by refreshing its update time.
     *
     * @return the refreshed task, or empty when the task is no longer processing under this owner
     */
    Optional<RenderTask> heartbeat(UUID taskId, String ownerId);

    /**
     * Lists processing tasks whose last update happened before the cutoff.
     */
    List<RenderTask> findProcessingUpdatedBefore(Instant cutoff);
}
