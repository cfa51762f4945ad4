package fr.lapetina.genrouter.admin;

import fr.lapetina.genrouter.cost.CostProjection;
import fr.lapetina.genrouter.cost.SpendReport;
import fr.lapetina.genrouter.domain.model.HealthState;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsSummary;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time operator view: provider health, attempt metrics, projected and observed cost.
 */
public record AdminReport(
        Instant generatedAt,
        Map<String, HealthState> health,
        MetricsSummary metrics,
        List<CostProjection> costProjections,
        SpendReport spend
) {
    public AdminReport {
        health = health != null ? Map.copyOf(health) : Map.of();
        costProjections = costProjections != null ? List.copyOf(costProjections) : List.of();
    }
}
