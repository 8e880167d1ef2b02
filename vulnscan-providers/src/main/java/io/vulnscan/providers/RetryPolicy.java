package io.vulnscan.providers;

import io.vulnscan.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for external provider calls.
 *
 * <p>Only {@link TransientProviderException} is retried. Anything else,
 * including {@link io.vulnscan.PermanentInputException}, propagates at once.</p>
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff, Sleeper sleeper) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /**
     * Pauses between attempts. Replaced in tests to avoid real waiting.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (sleeper == null) sleeper = d -> Thread.sleep(d.toMillis());
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), null);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, null);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff, sleeper);
    }

    public RetryPolicy withSleeper(Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff, sleeper);
    }

    /**
     * Backoff before attempt {@code attempt + 1}, given {@code attempt} failures so far.
     */
    public Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientProviderException e) {
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                Duration wait = backoff(attempt);
                log.warn("{} failed ({}), waiting {}ms before retry {}/{}",
                    operation, e.getReason(), wait.toMillis(), attempt, maxAttempts - 1);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting to retry " + operation, interrupted);
                }
            }
        }
    }
}
