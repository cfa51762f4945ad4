package fr.lapetina.genrouter.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one generation request.
 * Either a success carrying the output of exactly one provider, or a terminal
 * failure carrying what happened to each attempted candidate, in order.
 * A failure is never billed.
 */
public record OrchestrationResult(
        String requestId,
        String correlationId,
        String providerId,
        GenerationOutput output,
        long billedUnits,
        BigDecimal cost,
        long creditsCharged,
        FailureKind failureKind,
        String errorMessage,
        List<AttemptFailure> attempts,
        Duration latency,
        boolean fromCache
) {
    public OrchestrationResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (failureKind != null) {
            if (!failureKind.isTerminal()) {
                throw new IllegalArgumentException("Not a terminal failure kind: " + failureKind);
            }
            billedUnits = 0;
            cost = BigDecimal.ZERO;
            creditsCharged = 0;
        } else {
            Objects.requireNonNull(providerId, "Provider ID is required on success");
            Objects.requireNonNull(output, "Output is required on success");
            if (cost == null) {
                cost = BigDecimal.ZERO;
            }
        }
    }

    public static OrchestrationResult success(
            GenerationRequest request,
            ProviderDescriptor provider,
            GenerationOutput output,
            Duration latency
    ) {
        long units = output.billedUnits();
        return new OrchestrationResult(
                request.requestId(), request.correlationId(), provider.getId(), output,
                units, provider.costOf(units), provider.creditsFor(units),
                null, null, null, latency, false
        );
    }

    public static OrchestrationResult failure(
            GenerationRequest request,
            FailureKind kind,
            String message,
            List<AttemptFailure> attempts,
            Duration latency
    ) {
        return new OrchestrationResult(
                request.requestId(), request.correlationId(), null, null,
                0, BigDecimal.ZERO, 0, kind, message, attempts, latency, false
        );
    }

    public static OrchestrationResult rejected(GenerationRequest request, FailureKind kind, String message) {
        return failure(request, kind, message, null, Duration.ZERO);
    }

    /**
     * Copy of this result served from the idempotency cache.
     */
    public OrchestrationResult asCached(String requestId) {
        return new OrchestrationResult(
                requestId, correlationId, providerId, output, billedUnits, cost, creditsCharged,
                failureKind, errorMessage, attempts, latency, true
        );
    }

    public boolean isSuccess() {
        return failureKind == null;
    }
}
