package net.ogimage.application.render;

import java.util.UUID;
import net.ogimage.domain.render.RenderTask;

/**
 * Caller-visible projection of a render task.
 */
public record TaskStatusView(UUID taskId, String status, String imageUrl, String errorMessage) {

    static TaskStatusView from(RenderTask task) {
        return new TaskStatusView(task.id(), task.state().statusLabel(), task.imageUrl(), task.errorMessage());
    }
}
