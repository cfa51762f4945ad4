package fr.lapetina.genrouter;

import fr.lapetina.genrouter.admin.AdminService;
import fr.lapetina.genrouter.cost.CostEstimator;
import fr.lapetina.genrouter.cost.SpendReporter;
import fr.lapetina.genrouter.disruptor.GenerationPipeline;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.domain.model.TierPolicy;
import fr.lapetina.genrouter.infrastructure.config.CatalogMapper;
import fr.lapetina.genrouter.infrastructure.config.ConfigLoader;
import fr.lapetina.genrouter.infrastructure.config.RouterConfig;
import fr.lapetina.genrouter.infrastructure.health.HealthTracker;
import fr.lapetina.genrouter.infrastructure.health.ProviderCircuitBreaker;
import fr.lapetina.genrouter.infrastructure.metrics.AttemptMetricsCollector;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genrouter.infrastructure.provider.HttpProviderAdapter;
import fr.lapetina.genrouter.infrastructure.provider.ProviderAdapter;
import fr.lapetina.genrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.genrouter.orchestrator.IdempotencyCache;
import fr.lapetina.genrouter.orchestrator.Orchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds one instance of every router component from configuration and wires them together.
 * This is the primary entry point for obtaining a configured router.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RouterFactory router = RouterFactory.create("config.yaml").start()) {
 *     OrchestrationResult result = router.getOrchestrator().execute(request);
 *     // or asynchronously: router.getPipeline().submit(request)
 * }
 * }</pre>
 */
public class RouterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterFactory.class);

    private final ConfigLoader configLoader;
    private final RouterConfig config;
    private final Clock clock;
    private final Function<RouterConfig.ProviderConfig, ProviderAdapter> adapterFactory;

    private final MetricsRegistry metricsRegistry;
    private final HealthTracker healthTracker;
    private final ProviderRegistry registry;
    private final AttemptMetricsCollector metricsCollector;
    private final Orchestrator orchestrator;
    private final CostEstimator costEstimator;
    private final SpendReporter spendReporter;
    private final GenerationPipeline pipeline;
    private final AdminService adminService;

    private volatile Map<String, ProviderAdapter> adapters = Map.of();

    /**
     * @param adapterFactory builds the adapter for one configured provider; {@code null}
     *                       uses {@link HttpProviderAdapter}
     */
    protected RouterFactory(
            String configPath,
            Function<RouterConfig.ProviderConfig, ProviderAdapter> adapterFactory,
            Clock clock
    ) {
        log.info("Initializing RouterFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();
        this.clock = clock;
        this.adapterFactory = adapterFactory != null ? adapterFactory : this::createHttpAdapter;

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.healthTracker = new HealthTracker(healthSettings(config), clock);

        this.registry = new ProviderRegistry();
        registry.addListener(event -> {
            healthTracker.register(event.providerIds());
            for (String providerId : event.providerIds()) {
                metricsRegistry.registerCircuitState(providerId, () -> healthTracker.getState(providerId).status());
            }
            metricsRegistry.setRegisteredProviders(event.providers().size());
        });

        this.metricsCollector = new AttemptMetricsCollector(
                config.getMetrics().getMaxRecords(),
                Duration.ofMillis(config.getMetrics().getRetentionMs()),
                clock,
                metricsRegistry
        );

        this.orchestrator = new Orchestrator(
                registry,
                healthTracker,
                metricsCollector,
                metricsRegistry,
                new IdempotencyCache(
                        Duration.ofMillis(config.getIdempotency().getTtlMs()),
                        config.getIdempotency().getMaxEntries(),
                        clock
                ),
                clock
        );

        applyCatalog(config);

        this.costEstimator = new CostEstimator(registry);
        this.spendReporter = new SpendReporter(registry);

        this.pipeline = GenerationPipeline.builder()
                .fromConfig(config)
                .registry(registry)
                .orchestrator(orchestrator)
                .metricsRegistry(metricsRegistry)
                .build();

        this.adminService = new AdminService(
                healthTracker, metricsCollector, costEstimator, spendReporter, metricsRegistry, clock
        );

        configLoader.addListener(this::onConfigChanged);

        log.info("RouterFactory initialized: providers={}, tiers={}", registry.size(), registry.knownTiers());
    }

    /**
     * Creates a router from the specified configuration file, calling providers over HTTP.
     */
    public static RouterFactory create(String configPath) {
        return new RouterFactory(configPath, null, Clock.systemUTC());
    }

    /**
     * Creates a router from the default configuration (config.yaml).
     */
    public static RouterFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the submission pipeline and the configuration watcher.
     */
    public RouterFactory start() {
        pipeline.start();
        configLoader.startWatching();
        log.info("Router started");
        return this;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public GenerationPipeline getPipeline() {
        return pipeline;
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public HealthTracker getHealthTracker() {
        return healthTracker;
    }

    public AttemptMetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public CostEstimator getCostEstimator() {
        return costEstimator;
    }

    public SpendReporter getSpendReporter() {
        return spendReporter;
    }

    public AdminService getAdminService() {
        return adminService;
    }

    public RouterConfig getConfig() {
        return configLoader.getCurrentConfig();
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Rebuilds adapters and swaps the catalog. Providers dropped from the configuration
     * lose their adapter; their health state is kept.
     */
    private void applyCatalog(RouterConfig catalog) {
        Map<String, ProviderAdapter> previous = adapters;
        Map<String, ProviderAdapter> next = new HashMap<>();
        for (RouterConfig.ProviderConfig provider : catalog.getProviders()) {
            if (!provider.isEnabled()) {
                continue;
            }
            ProviderAdapter adapter = adapterFactory.apply(provider);
            if (adapter != null) {
                next.put(provider.getId(), adapter);
            }
        }

        List<ProviderDescriptor> descriptors = CatalogMapper.toDescriptors(catalog, provider -> {
            String providerId = provider.getId();
            return () -> {
                ProviderAdapter adapter = adapters.get(providerId);
                return adapter != null && adapter.isAvailable();
            };
        });
        List<TierPolicy> tiers = CatalogMapper.toTierPolicies(catalog);

        try {
            registry.reload(descriptors, tiers);
        } catch (RuntimeException e) {
            next.values().forEach(RouterFactory::closeQuietly);
            throw e;
        }
        this.adapters = Map.copyOf(next);
        next.values().forEach(orchestrator::registerAdapter);

        for (Map.Entry<String, ProviderAdapter> entry : previous.entrySet()) {
            if (!next.containsKey(entry.getKey())) {
                orchestrator.removeAdapter(entry.getKey());
            }
            closeQuietly(entry.getValue());
        }
    }

    private ProviderAdapter createHttpAdapter(RouterConfig.ProviderConfig provider) {
        if (provider.getEndpoint() == null || provider.getEndpoint().isBlank()) {
            log.warn("Provider has no endpoint, it will never be attempted: providerId={}", provider.getId());
            return null;
        }
        return HttpProviderAdapter.builder()
                .fromConfig(provider, configLoader.getCurrentConfig())
                .build();
    }

    private static ProviderCircuitBreaker.Settings healthSettings(RouterConfig config) {
        RouterConfig.HealthConfig health = config.getHealth();
        return new ProviderCircuitBreaker.Settings(
                health.getFailureThreshold(),
                Duration.ofMillis(health.getCooldownMs()),
                health.getBackoffMultiplier(),
                Duration.ofMillis(health.getMaxCooldownMs())
        );
    }

    private void onConfigChanged(RouterConfig oldConfig, RouterConfig newConfig) {
        log.info("Configuration changed, applying catalog updates...");
        try {
            applyCatalog(newConfig);
            log.info("Catalog updated: providers={}, tiers={}", registry.size(), registry.knownTiers());
        } catch (RuntimeException e) {
            log.error("Failed to apply new catalog, keeping the current one", e);
        }
    }

    private static void closeQuietly(ProviderAdapter adapter) {
        try {
            adapter.close();
        } catch (Exception e) {
            log.warn("Error closing provider adapter: providerId={}", adapter.providerId(), e);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down RouterFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        adapters.values().forEach(RouterFactory::closeQuietly);

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("RouterFactory shut down");
    }
}
