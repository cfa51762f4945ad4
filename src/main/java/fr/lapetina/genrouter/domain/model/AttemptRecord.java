package fr.lapetina.genrouter.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One provider attempt, as kept by the metrics collector.
 *
 * @param attemptIndex 0-based position of the provider in the candidate list
 * @param failureKind  null on success
 * @param billedUnits  0 on failure
 */
public record AttemptRecord(
        Instant timestamp,
        String correlationId,
        int attemptIndex,
        String providerId,
        Modality modality,
        String tier,
        Outcome outcome,
        FailureKind failureKind,
        Duration latency,
        long billedUnits
) {
    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    public AttemptRecord {
        Objects.requireNonNull(timestamp, "Timestamp is required");
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(outcome, "Outcome is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (outcome == Outcome.SUCCESS && failureKind != null) {
            throw new IllegalArgumentException("A successful attempt has no failure kind");
        }
        if (outcome == Outcome.FAILURE) {
            Objects.requireNonNull(failureKind, "Failure kind is required for a failed attempt");
            billedUnits = 0;
        }
    }

    public static AttemptRecord success(
            Instant timestamp, GenerationRequest request, int attemptIndex,
            String providerId, Duration latency, long billedUnits
    ) {
        return new AttemptRecord(timestamp, request.correlationId(), attemptIndex, providerId,
                request.modality(), request.tier(), Outcome.SUCCESS, null, latency, billedUnits);
    }

    public static AttemptRecord failure(
            Instant timestamp, GenerationRequest request, int attemptIndex,
            String providerId, FailureKind kind, Duration latency
    ) {
        return new AttemptRecord(timestamp, request.correlationId(), attemptIndex, providerId,
                request.modality(), request.tier(), Outcome.FAILURE, kind, latency, 0);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isFallback() {
        return attemptIndex > 0;
    }
}
