package fr.lapetina.genrouter.infrastructure.provider;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Transient retry inside one provider adapter: exponential backoff with +/-30% jitter.
 * Retries never move to another provider.
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0);

    private static final double JITTER = 0.3;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    /**
     * Delay before retry number {@code retry} (1-based), jitter applied.
     * A provider-supplied Retry-After wins when it is longer.
     */
    public Duration delayFor(int retry, Duration retryAfter) {
        double base = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        double capped = Math.min(base, maxBackoff.toMillis());
        double jitter = 1.0 + ThreadLocalRandom.current().nextDouble(-JITTER, JITTER);
        long delayMs = Math.round(capped * jitter);
        if (retryAfter != null && retryAfter.toMillis() > delayMs) {
            delayMs = retryAfter.toMillis();
        }
        return Duration.ofMillis(Math.max(0, delayMs));
    }

    public boolean allowsRetry(int retriesSoFar, ProviderException failure) {
        return failure.isRetryable() && retriesSoFar < maxRetries;
    }
}
