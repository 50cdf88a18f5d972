package net.ogimage.domain.render;

import java.time.Instant;
import java.util.UUID;

/**
 * One render attempt for a fingerprint and its lifecycle state.
 *
 * <p>{@code imageUrl} is present only on {@link RenderTaskState#COMPLETED} tasks and
 * {@code errorMessage} only on {@link RenderTaskState#FAILED} tasks. {@code ownerId}
 * identifies the worker that claimed the task and is absent while it is pending.</p>
 */
public record RenderTask(UUID id,
                         String fingerprint,
                         RenderTarget target,
                         long ttlSeconds,
                         RenderTaskState state,
                         String imageUrl,
                         String errorMessage,
                         String ownerId,
                         Instant createdAt,
                         Instant updatedAt) {

    public RenderTask {
        if (id == null) {
            throw new IllegalArgumentException("Render task id is required");
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("Render task fingerprint is required");
        }
        if (target == null || state == null || createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("Render task " + id + " is missing target, state or timestamps");
        }
        if (imageUrl != null && state != RenderTaskState.COMPLETED) {
            throw new IllegalArgumentException("Only completed tasks carry an image url (task " + id + ", state " + state + ")");
        }
        if (errorMessage != null && state != RenderTaskState.FAILED) {
            throw new IllegalArgumentException("Only failed tasks carry an error (task " + id + ", state " + state + ")");
        }
        if (state == RenderTaskState.COMPLETED && (imageUrl == null || imageUrl.isBlank())) {
            throw new IllegalArgumentException("Completed task " + id + " requires an image url");
        }
    }

    /**
     * Creates a freshly admitted task in {@link RenderTaskState#PENDING}.
     */
    public static RenderTask pending(UUID id, String fingerprint, RenderTarget target, long ttlSeconds, Instant now) {
        return new RenderTask(id, fingerprint, target, ttlSeconds, RenderTaskState.PENDING, null, null, null, now, now);
    }

    public RenderTask claimedBy(String workerId, Instant now) {
        requireTransition(RenderTaskState.PROCESSING);
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("Worker id is required to claim task " + id);
        }
        return new RenderTask(id, fingerprint, target, ttlSeconds, RenderTaskState.PROCESSING,
            null, null, workerId, createdAt, now);
    }

    /**
     * Refreshes {@code updatedAt} of a processing task so the abandoned-task sweep leaves it alone.
     */
    public RenderTask touched(Instant now) {
        if (state != RenderTaskState.PROCESSING) {
            throw new IllegalStateException("Render task " + id + " is " + state + ", only processing tasks can be touched");
        }
        return new RenderTask(id, fingerprint, target, ttlSeconds, state, imageUrl, errorMessage, ownerId, createdAt, now);
    }

    public RenderTask completed(String resultUrl, Instant now) {
        requireTransition(RenderTaskState.COMPLETED);
        return new RenderTask(id, fingerprint, target, ttlSeconds, RenderTaskState.COMPLETED,
            resultUrl, null, ownerId, createdAt, now);
    }

    public RenderTask failed(String error, Instant now) {
        requireTransition(RenderTaskState.FAILED);
        return new RenderTask(id, fingerprint, target, ttlSeconds, RenderTaskState.FAILED,
            null, error, ownerId, createdAt, now);
    }

    public boolean isOwnedBy(String workerId) {
        return ownerId != null && ownerId.equals(workerId);
    }

    private void requireTransition(RenderTaskState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Render task " + id + " cannot move from " + state + " to " + next);
        }
    }
}
