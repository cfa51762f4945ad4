package fr.lapetina.genrouter.infrastructure.provider;

import fr.lapetina.genrouter.domain.model.FailureKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Failure of a provider call. The message is safe to surface: it never carries the
 * provider's raw response payload.
 */
public class ProviderException extends RuntimeException {

    private final FailureKind kind;
    private final boolean retryable;
    private final Duration retryAfter;

    public ProviderException(FailureKind kind, String message, boolean retryable, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Failure kind is required");
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    public ProviderException(FailureKind kind, String message) {
        this(kind, message, false, null, null);
    }

    public static ProviderException timeout(String message, Throwable cause) {
        return new ProviderException(FailureKind.PROVIDER_TIMEOUT, message, false, null, cause);
    }

    public static ProviderException rateLimited(Duration retryAfter) {
        return new ProviderException(FailureKind.PROVIDER_RATE_LIMITED, "Rate limited by provider", true, retryAfter, null);
    }

    public static ProviderException error(String message, boolean retryable, Throwable cause) {
        return new ProviderException(FailureKind.PROVIDER_ERROR, message, retryable, null, cause);
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Delay requested by the provider before retrying, or null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
