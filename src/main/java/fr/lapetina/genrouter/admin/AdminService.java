package fr.lapetina.genrouter.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.genrouter.cost.CostEstimator;
import fr.lapetina.genrouter.cost.CostProjection;
import fr.lapetina.genrouter.cost.SpendReport;
import fr.lapetina.genrouter.cost.SpendReporter;
import fr.lapetina.genrouter.domain.model.HealthState;
import fr.lapetina.genrouter.infrastructure.health.HealthTracker;
import fr.lapetina.genrouter.infrastructure.metrics.AttemptMetricsCollector;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Read and reset operations for operators. Nothing here is on the request path.
 */
public final class AdminService {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final HealthTracker healthTracker;
    private final AttemptMetricsCollector metricsCollector;
    private final CostEstimator costEstimator;
    private final SpendReporter spendReporter;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public AdminService(
            HealthTracker healthTracker,
            AttemptMetricsCollector metricsCollector,
            CostEstimator costEstimator,
            SpendReporter spendReporter,
            MetricsRegistry metricsRegistry,
            Clock clock
    ) {
        this.healthTracker = healthTracker;
        this.metricsCollector = metricsCollector;
        this.costEstimator = costEstimator;
        this.spendReporter = spendReporter;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Map<String, HealthState> health() {
        return healthTracker.snapshot();
    }

    public MetricsSummary metrics() {
        return metricsCollector.getMetrics();
    }

    /**
     * Per-user projection for every tier the catalog declares.
     */
    public List<CostProjection> costProjections() {
        return costEstimator.estimateAll();
    }

    public SpendReport spend() {
        return spendReporter.report(metricsCollector.getMetrics());
    }

    public void clearMetrics() {
        metricsCollector.clear();
        log.info("Attempt metrics cleared by operator");
    }

    public void resetHealth() {
        healthTracker.reset();
        log.info("All provider circuits reset by operator");
    }

    public void resetHealth(String providerId) {
        healthTracker.reset(providerId);
        log.info("Provider circuit reset by operator: providerId={}", providerId);
    }

    public void forceOpen(String providerId) {
        healthTracker.forceOpen(providerId);
        log.warn("Provider circuit forced open by operator: providerId={}", providerId);
    }

    public AdminReport report() {
        MetricsSummary metrics = metricsCollector.getMetrics();
        return new AdminReport(
                clock.instant(),
                healthTracker.snapshot(),
                metrics,
                costEstimator.estimateAll(),
                spendReporter.report(metrics)
        );
    }

    /**
     * The {@link #report()} as JSON, dates in ISO-8601.
     */
    public String reportJson() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize admin report", e);
        }
    }

    /**
     * Micrometer registry in Prometheus text exposition format.
     */
    public String prometheus() {
        return metricsRegistry.scrape();
    }
}
