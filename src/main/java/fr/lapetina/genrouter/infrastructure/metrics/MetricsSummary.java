package fr.lapetina.genrouter.infrastructure.metrics;

import java.time.Instant;
import java.util.Map;

/**
 * Read-time aggregate of the retained attempt records.
 *
 * @param fallbackSuccesses successes served by a candidate other than the first
 * @param windowStart       timestamp of the oldest retained record, null when empty
 * @param requests          request-level totals, not bound to the retention window
 */
public record MetricsSummary(
        ProviderStats total,
        Map<String, ProviderStats> byProvider,
        Map<String, Long> attemptsByTier,
        long fallbackSuccesses,
        Instant windowStart,
        Instant generatedAt,
        RequestStats requests
) {
    public MetricsSummary {
        byProvider = Map.copyOf(byProvider);
        attemptsByTier = Map.copyOf(attemptsByTier);
    }

    public ProviderStats provider(String providerId) {
        return byProvider.getOrDefault(providerId, ProviderStats.empty(providerId));
    }
}
