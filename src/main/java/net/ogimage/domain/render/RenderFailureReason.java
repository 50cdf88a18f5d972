package net.ogimage.domain.render;

/**
 * Classified reasons recorded on a {@link RenderTaskState#FAILED} task.
 */
public enum RenderFailureReason {
    TIMEOUT("timeout"),
    RENDER_ERROR("render_error"),
    STORAGE_ERROR("storage_error"),
    ABANDONED("abandoned");

    private final String code;

    RenderFailureReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Builds the persisted error message. Timeouts and abandoned tasks carry the bare code.
     */
    public String describe(String detail) {
        if (this == TIMEOUT || this == ABANDONED || detail == null || detail.isBlank()) {
            return code;
        }
        return code + ": " + detail.trim();
    }
}
