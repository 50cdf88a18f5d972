package net.ogimage.exception;

/**
 * Task creation for a fingerprint kept losing races against concurrent creators.
 * RETRYABLE: Yes (the caller should simply repeat the request)
 */
public class DedupFailedException extends RuntimeException {

    private final String fingerprint;
    private final int attempts;

    public DedupFailedException(String fingerprint, int attempts) {
        super("Could not acquire or join a render task for fingerprint " + fingerprint + " after " + attempts + " attempts");
        this.fingerprint = fingerprint;
        this.attempts = attempts;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public int getAttempts() {
        return attempts;
    }
}
