package net.ogimage.domain.render;

import java.util.UUID;

/**
 * Guarded single-owner state change applied by the Task Ledger.
 *
 * <p>The ledger applies the transition only when the stored task is still in
 * {@code expectedState} and owned by {@code ownerId}.</p>
 */
public record TaskTransition(UUID taskId,
                             String ownerId,
                             RenderTaskState expectedState,
                             RenderTaskState targetState,
                             String imageUrl,
                             String errorMessage) {

    public TaskTransition {
        if (taskId == null || ownerId == null || expectedState == null || targetState == null) {
            throw new IllegalArgumentException("Task transition requires task id, owner and both states");
        }
        if (!expectedState.canTransitionTo(targetState)) {
            throw new IllegalArgumentException("Illegal transition " + expectedState + " -> " + targetState);
        }
    }

    public static TaskTransition complete(UUID taskId, String ownerId, String imageUrl) {
        return new TaskTransition(taskId, ownerId, RenderTaskState.PROCESSING, RenderTaskState.COMPLETED, imageUrl, null);
    }

    public static TaskTransition fail(UUID taskId, String ownerId, String errorMessage) {
        return new TaskTransition(taskId, ownerId, RenderTaskState.PROCESSING, RenderTaskState.FAILED, null, errorMessage);
    }
}
