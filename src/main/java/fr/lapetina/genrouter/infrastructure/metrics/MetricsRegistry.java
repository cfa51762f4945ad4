package fr.lapetina.genrouter.infrastructure.metrics;

import fr.lapetina.genrouter.domain.event.EventState;
import fr.lapetina.genrouter.domain.model.AttemptRecord;
import fr.lapetina.genrouter.domain.model.CircuitState;
import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Micrometer view of the router, exposed in Prometheus format.
 *
 * Provides:
 * - Attempt counters per provider, modality and outcome
 * - Failure counters per provider and kind
 * - Attempt latency timers with percentiles
 * - Billed units per provider
 * - Terminal failures and pipeline request states
 * - Completed requests by outcome, cache hits and fallbacks
 * - Circuit state gauge per provider
 * - JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> billedUnitCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> terminalCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> completedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final Set<String> circuitGauges = ConcurrentHashMap.newKeySet();

    private final AtomicInteger globalInFlight = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);
    private final AtomicInteger registeredProviders = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_requests", globalInFlight, AtomicInteger::get)
                .description("Requests admitted by the pipeline and not yet completed")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        Gauge.builder(prefix + "_providers", registeredProviders, AtomicInteger::get)
                .description("Number of providers in the catalog")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("genrouter");
    }

    /**
     * Publishes one provider attempt.
     */
    public void recordAttempt(AttemptRecord attempt) {
        String provider = attempt.providerId();
        String modality = modalityTag(attempt.modality());
        String outcome = attempt.outcome().name();

        attemptCounters.computeIfAbsent(provider + ":" + modality + ":" + outcome, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Provider attempts")
                        .tag("provider", provider)
                        .tag("modality", modality)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(provider + ":" + modality, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Provider attempt latency")
                        .tag("provider", provider)
                        .tag("modality", modality)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(attempt.latency());

        if (attempt.isSuccess()) {
            billedUnitCounters.computeIfAbsent(provider, k ->
                    Counter.builder(prefix + "_billed_units_total")
                            .description("Units billed by providers")
                            .tag("provider", provider)
                            .tag("unit", attempt.modality() != null ? attempt.modality().getBilledUnit() : "unknown")
                            .register(registry)
            ).increment(attempt.billedUnits());
        } else {
            FailureKind kind = attempt.failureKind();
            failureCounters.computeIfAbsent(provider + ":" + kind.name(), k ->
                    Counter.builder(prefix + "_attempt_failures_total")
                            .description("Failed provider attempts by kind")
                            .tag("provider", provider)
                            .tag("kind", kind.name())
                            .register(registry)
            ).increment();
        }
    }

    /**
     * Counts a failure surfaced to the caller.
     */
    public void incrementTerminalFailure(FailureKind kind, String tier) {
        terminalCounters.computeIfAbsent(kind.name() + ":" + tier, k ->
                Counter.builder(prefix + "_terminal_failures_total")
                        .description("Requests that ended in a terminal failure")
                        .tag("kind", kind.name())
                        .tag("tier", tier)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a request returned to its caller, tagged with how it was served.
     */
    public void recordRequest(OrchestrationResult result, boolean servedByFallback) {
        String outcome;
        if (!result.isSuccess()) {
            outcome = result.failureKind().name();
        } else if (result.fromCache()) {
            outcome = "CACHE_HIT";
        } else if (servedByFallback) {
            outcome = "FALLBACK";
        } else {
            outcome = "SUCCESS";
        }
        completedCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_requests_completed_total")
                        .description("Requests returned to callers by outcome")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts pipeline events by tier, modality and state.
     */
    public void incrementRequestCount(String tier, Modality modality, EventState state) {
        String modalityTag = modalityTag(modality);
        String key = tier + ":" + modalityTag + ":" + state.name();
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Requests seen by the submission pipeline")
                        .tag("tier", tier)
                        .tag("modality", modalityTag)
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (validation, admission, queue).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers a circuit state gauge for a provider (0=OPEN, 1=HALF_OPEN, 2=CLOSED).
     * Registering the same provider twice is a no-op.
     */
    public void registerCircuitState(String providerId, Supplier<CircuitState> state) {
        if (!circuitGauges.add(providerId)) {
            return;
        }
        Gauge.builder(prefix + "_circuit_state", state, s -> circuitValue(s.get()))
                .description("Provider circuit state (0=OPEN, 1=HALF_OPEN, 2=CLOSED)")
                .tag("provider", providerId)
                .register(registry);
    }

    public void setGlobalInFlight(int value) {
        globalInFlight.set(value);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    public void setRegisteredProviders(int value) {
        registeredProviders.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }

    private static String modalityTag(Modality modality) {
        return modality != null ? modality.configName() : "unknown";
    }

    private static double circuitValue(CircuitState state) {
        return switch (state) {
            case OPEN -> 0;
            case HALF_OPEN -> 1;
            case CLOSED -> 2;
        };
    }
}
