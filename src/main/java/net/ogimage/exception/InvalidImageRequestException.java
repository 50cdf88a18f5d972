package net.ogimage.exception;

/**
 * Malformed target URL, out-of-range parameters or a domain outside the whitelist.
 * RETRYABLE: No (the request itself must change)
 */
public class InvalidImageRequestException extends IllegalArgumentException {

    public InvalidImageRequestException(String message) {
        super(message);
    }
}
