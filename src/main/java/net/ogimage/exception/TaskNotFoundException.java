package net.ogimage.exception;

import java.util.UUID;

/**
 * No render task exists for the requested id.
 */
public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(UUID taskId) {
        super("Render task not found: " + taskId);
    }
}
