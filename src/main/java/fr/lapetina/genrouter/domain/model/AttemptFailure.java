package fr.lapetina.genrouter.domain.model;

import java.util.Objects;

/**
 * Why one candidate did not produce the result. Carried inside terminal failures.
 *
 * @param message safe, provider-neutral description; never the provider's raw error payload
 */
public record AttemptFailure(String providerId, FailureKind kind, String message) {
    public AttemptFailure {
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(kind, "Failure kind is required");
    }

    @Override
    public String toString() {
        return providerId + ":" + kind + (message != null ? " (" + message + ")" : "");
    }
}
