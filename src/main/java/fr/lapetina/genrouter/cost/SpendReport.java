package fr.lapetina.genrouter.cost;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Actual spend over the metrics window, per provider.
 */
public record SpendReport(
        Map<String, ProviderSpend> byProvider,
        BigDecimal totalCost,
        Instant windowStart,
        Instant generatedAt
) {
    public SpendReport {
        byProvider = Map.copyOf(byProvider);
    }

    /**
     * @param unitPrice null when the provider is no longer in the catalog
     */
    public record ProviderSpend(String providerId, long billedUnits, BigDecimal unitPrice, BigDecimal cost) {
    }
}
