package net.ogimage.domain.render;

import java.util.Locale;

/**
 * Lifecycle states of a {@link RenderTask}.
 *
 * <p>Allowed transitions are {@code PENDING -> PROCESSING -> COMPLETED|FAILED}. Terminal
 * states never transition again; a later request for the same fingerprint creates a new task.</p>
 */
public enum RenderTaskState {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String statusLabel;

    RenderTaskState(String statusLabel) {
        this.statusLabel = statusLabel;
    }

    /**
     * Caller-visible status vocabulary used by the status endpoint.
     */
    public String statusLabel() {
        return statusLabel;
    }

    /**
     * Active tasks are joinable by later requests for the same fingerprint.
     */
    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(RenderTaskState next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * Parses the persisted column value (the enum name, case-insensitive).
     */
    public static RenderTaskState fromStorageValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Render task state value is required");
        }
        return RenderTaskState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
