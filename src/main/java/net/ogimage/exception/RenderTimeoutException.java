package net.ogimage.exception;

import java.time.Duration;

/**
 * A render exceeded its hard timeout.
 */
public class RenderTimeoutException extends RenderFailedException {

    private final Duration timeout;

    public RenderTimeoutException(String url, Duration timeout, Throwable cause) {
        super("Render of " + url + " exceeded " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
