package net.ogimage.exception;

import java.time.Duration;
import java.util.UUID;

/**
 * A caller waiting for a render gave up before the task reached a terminal state.
 * RETRYABLE: Yes (the task keeps running; its status can still be polled)
 */
public class RenderWaitTimeoutException extends RuntimeException {

    private final UUID taskId;

    public RenderWaitTimeoutException(UUID taskId, Duration waited) {
        super("Render task " + taskId + " did not finish within " + waited.toSeconds() + "s");
        this.taskId = taskId;
    }

    public UUID getTaskId() {
        return taskId;
    }
}
