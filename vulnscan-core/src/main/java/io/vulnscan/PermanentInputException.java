package io.vulnscan;

/**
 * Failure caused by the input itself: bad credentials, a malformed or unknown
 * repository reference, a request the provider rejects, or vectors of the
 * wrong width. Never retried.
 */
public class PermanentInputException extends RuntimeException {

    /**
     * Why the input was rejected.
     */
    public enum Reason {
        AUTH_REQUIRED,
        INVALID_INPUT,
        NOT_FOUND,
        WIDTH_MISMATCH
    }

    private final Reason reason;

    public PermanentInputException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PermanentInputException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
