package fr.lapetina.genrouter.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.genrouter.cost.CostEstimator;
import fr.lapetina.genrouter.cost.SpendReporter;
import fr.lapetina.genrouter.domain.model.AttemptRecord;
import fr.lapetina.genrouter.domain.model.CircuitState;
import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.GenerationOutput;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.domain.model.TierPolicy;
import fr.lapetina.genrouter.infrastructure.health.HealthTracker;
import fr.lapetina.genrouter.infrastructure.health.ProviderCircuitBreaker;
import fr.lapetina.genrouter.infrastructure.metrics.AttemptMetricsCollector;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.genrouter.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AdminServiceTest {

    private MutableClock clock;
    private HealthTracker healthTracker;
    private AttemptMetricsCollector collector;
    private MetricsRegistry metricsRegistry;
    private AdminService adminService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        ProviderRegistry registry = new ProviderRegistry(
                List.of(ProviderDescriptor.builder()
                        .id("provider-a")
                        .modality(Modality.TEXT)
                        .unitPrice("0.000002")
                        .tiers(Set.of("pro"))
                        .build()),
                List.of(new TierPolicy("pro", Map.of(Modality.TEXT, 100_000L, Modality.IMAGE, 0L), null, null, null))
        );
        healthTracker = new HealthTracker(ProviderCircuitBreaker.Settings.DEFAULTS, clock);
        healthTracker.register(registry.getAllProviders().stream().map(ProviderDescriptor::getId).toList());
        metricsRegistry = new MetricsRegistry("admin_test");
        collector = new AttemptMetricsCollector(100, Duration.ofHours(1), clock, metricsRegistry);
        adminService = new AdminService(healthTracker, collector, new CostEstimator(registry),
                new SpendReporter(registry), metricsRegistry, clock);
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    private void recordSuccess(long units) {
        collector.record(AttemptRecord.success(clock.instant(), GenerationRequest.text("pro", "hi"),
                0, "provider-a", Duration.ofMillis(120), units));
    }

    @Test
    @DisplayName("should serialize the report with ISO-8601 dates")
    void shouldSerializeReport() throws Exception {
        recordSuccess(500_000);

        JsonNode report = new ObjectMapper().readTree(adminService.reportJson());

        assertThat(report.get("generatedAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(report.at("/health/provider-a/status").asText()).isEqualTo("CLOSED");
        assertThat(report.at("/metrics/total/billedUnits").asLong()).isEqualTo(500_000);
        assertThat(report.at("/spend/totalCost").decimalValue()).isEqualByComparingTo("1.0");
        assertThat(report.at("/costProjections/0/tier").asText()).isEqualTo("pro");
    }

    @Test
    @DisplayName("should report request totals with the cache hit rate")
    void shouldReportRequestTotals() throws Exception {
        GenerationRequest request = GenerationRequest.text("pro", "hi");
        ProviderDescriptor provider = ProviderDescriptor.builder().id("provider-a").modality(Modality.TEXT).build();
        OrchestrationResult success = OrchestrationResult.success(
                request, provider, GenerationOutput.text("ok", 1), Duration.ofMillis(5));
        collector.recordRequest(success, false);
        collector.recordRequest(success.asCached("repeat"), false);
        collector.recordRequest(OrchestrationResult.rejected(request, FailureKind.CANCELLED, "gone"), false);
        collector.recordRequest(success, true);

        assertThat(adminService.report().metrics().requests().requests()).isEqualTo(4);

        JsonNode report = new ObjectMapper().readTree(adminService.reportJson());
        assertThat(report.at("/metrics/requests/successes").asLong()).isEqualTo(3);
        assertThat(report.at("/metrics/requests/failuresByKind/CANCELLED").asLong()).isEqualTo(1);
        assertThat(report.at("/metrics/requests/cacheHitRate").asDouble()).isEqualTo(0.25);
        assertThat(report.at("/metrics/requests/fallbackRate").asDouble()).isEqualTo(0.25);
        assertThat(adminService.prometheus()).contains("admin_test_requests_completed_total");
    }

    @Test
    @DisplayName("should project the cost of every declared tier")
    void shouldProjectCosts() {
        assertThat(adminService.costProjections()).singleElement()
                .satisfies(p -> assertThat(p.perUserCost()).isEqualByComparingTo("0.2"));
    }

    @Test
    @DisplayName("should reset a forced-open provider")
    void shouldResetHealth() {
        adminService.forceOpen("provider-a");
        assertThat(adminService.health().get("provider-a").status()).isEqualTo(CircuitState.OPEN);

        adminService.resetHealth("provider-a");

        assertThat(adminService.health().get("provider-a").status()).isEqualTo(CircuitState.CLOSED);
        assertThat(adminService.health().get("provider-a").tripCount()).isZero();
    }

    @Test
    @DisplayName("should reset every provider at once")
    void shouldResetAllHealth() {
        adminService.forceOpen("provider-a");

        adminService.resetHealth();

        assertThat(healthTracker.isEligible("provider-a")).isTrue();
    }

    @Test
    @DisplayName("should drop recorded attempts on clear")
    void shouldClearMetrics() {
        recordSuccess(10);

        adminService.clearMetrics();

        assertThat(adminService.metrics().total().attempts()).isZero();
        assertThat(adminService.spend().byProvider()).isEmpty();
    }

    @Test
    @DisplayName("should expose attempts in Prometheus format")
    void shouldScrapePrometheus() {
        recordSuccess(10);

        assertThat(adminService.prometheus()).contains("admin_test");
    }
}
