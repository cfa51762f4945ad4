package fr.lapetina.genrouter.cost;

import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsSummary;
import fr.lapetina.genrouter.infrastructure.metrics.ProviderStats;
import fr.lapetina.genrouter.infrastructure.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Joins observed billed units with the catalog's current prices.
 * Separate from {@link CostEstimator}, which never looks at observed traffic.
 */
public final class SpendReporter {

    private static final Logger log = LoggerFactory.getLogger(SpendReporter.class);

    private final ProviderRegistry registry;

    public SpendReporter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public SpendReport report(MetricsSummary metrics) {
        Map<String, SpendReport.ProviderSpend> byProvider = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO.setScale(CostEstimator.SCALE, CostEstimator.ROUNDING);

        for (ProviderStats stats : metrics.byProvider().values()) {
            Optional<ProviderDescriptor> provider = registry.getProvider(stats.providerId());
            BigDecimal unitPrice = provider.map(ProviderDescriptor::getUnitPrice).orElse(null);
            BigDecimal cost = unitPrice != null
                    ? unitPrice.multiply(BigDecimal.valueOf(stats.billedUnits())).setScale(CostEstimator.SCALE, CostEstimator.ROUNDING)
                    : BigDecimal.ZERO.setScale(CostEstimator.SCALE, CostEstimator.ROUNDING);
            if (unitPrice == null && stats.billedUnits() > 0) {
                log.warn("Billed units for provider missing from catalog: providerId={}, units={}",
                        stats.providerId(), stats.billedUnits());
            }
            byProvider.put(stats.providerId(),
                    new SpendReport.ProviderSpend(stats.providerId(), stats.billedUnits(), unitPrice, cost));
            total = total.add(cost);
        }

        return new SpendReport(byProvider, total, metrics.windowStart(), metrics.generatedAt());
    }
}
