package io.vulnscan;

/**
 * Failure of an external provider that may succeed when retried.
 *
 * <p>Thrown for timeouts, rate limiting, server-side errors and network
 * interruptions. Callers retry these with bounded exponential backoff.</p>
 */
public class TransientProviderException extends RuntimeException {

    /**
     * Why the provider call failed.
     */
    public enum Reason {
        RATE_LIMITED,
        TIMEOUT,
        SERVICE_ERROR,
        NETWORK
    }

    private final Reason reason;

    public TransientProviderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransientProviderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
