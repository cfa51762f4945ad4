package fr.lapetina.genrouter.infrastructure.metrics;

import fr.lapetina.genrouter.domain.model.FailureKind;

import java.util.Map;

/**
 * Aggregated attempt statistics for one provider, or for all providers together.
 * Latencies are in milliseconds; percentiles use the nearest-rank method.
 */
public record ProviderStats(
        String providerId,
        long attempts,
        long successes,
        long failures,
        Map<FailureKind, Long> failuresByKind,
        double averageLatencyMs,
        long p50LatencyMs,
        long p95LatencyMs,
        long p99LatencyMs,
        long billedUnits
) {
    public ProviderStats {
        failuresByKind = failuresByKind != null ? Map.copyOf(failuresByKind) : Map.of();
    }

    public static ProviderStats empty(String providerId) {
        return new ProviderStats(providerId, 0, 0, 0, Map.of(), 0.0, 0, 0, 0, 0);
    }

    public double successRate() {
        return attempts == 0 ? 0.0 : (double) successes / attempts;
    }
}
