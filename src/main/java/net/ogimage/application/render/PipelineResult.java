package net.ogimage.application.render;

import java.util.UUID;

/**
 * Outcome of an image request: either a fresh cached image or a task to poll.
 */
public record PipelineResult(Status status, String imageUrl, UUID taskId) {

    public enum Status {
        CACHED("cached"),
        PROCESSING("processing");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static PipelineResult cached(String imageUrl) {
        return new PipelineResult(Status.CACHED, imageUrl, null);
    }

    public static PipelineResult processing(UUID taskId) {
        return new PipelineResult(Status.PROCESSING, null, taskId);
    }

    public boolean isCached() {
        return status == Status.CACHED;
    }
}
