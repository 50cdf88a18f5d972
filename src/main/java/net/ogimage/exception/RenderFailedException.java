package net.ogimage.exception;

/**
 * The renderer could not produce an image for the target page.
 * Recorded on the task as its terminal failure reason, never thrown to the requesting caller.
 */
public class RenderFailedException extends RuntimeException {

    public RenderFailedException(String message) {
        super(message);
    }

    public RenderFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
