package fr.lapetina.genrouter.infrastructure.config;

import fr.lapetina.genrouter.domain.model.Modality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * YAML configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation before a configuration becomes current
 * - File watching for automatic reload
 * - Listener notification on changes
 *
 * A reload that fails to parse or validate leaves the current configuration in place.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<RouterConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(RouterConfig.class, new LoaderOptions()));
    }

    /**
     * Loads, validates and publishes the configuration.
     *
     * @throws ConfigurationException if loading or validation fails
     */
    public RouterConfig load() {
        return publish(loadFromPath());
    }

    /**
     * Loads configuration from an input stream.
     */
    public RouterConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private RouterConfig publish(RouterConfig config) {
        validate(config);
        RouterConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private RouterConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private RouterConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private RouterConfig parse(InputStream is, String source) {
        try {
            RouterConfig config = yaml.load(is);
            return config != null ? config : new RouterConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks cross-references and ranges that the YAML binding cannot express.
     *
     * @throws ConfigurationException describing the first problem found
     */
    public static void validate(RouterConfig config) {
        Set<String> providerIds = new HashSet<>();
        for (RouterConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Provider id is required");
            }
            if (!providerIds.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
            try {
                Modality.fromString(provider.getModality());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Provider " + provider.getId() + ": " + e.getMessage(), e);
            }
            if (provider.getUnitPrice() == null || provider.getUnitPrice().signum() < 0) {
                throw new ConfigurationException("Provider " + provider.getId() + ": unitPrice must be >= 0");
            }
            if (provider.getCreditWeight() < 1) {
                throw new ConfigurationException("Provider " + provider.getId() + ": creditWeight must be >= 1");
            }
        }

        Set<String> tierIds = new HashSet<>();
        for (RouterConfig.TierConfig tier : config.getTiers()) {
            if (tier.getId() == null || tier.getId().isBlank()) {
                throw new ConfigurationException("Tier id is required");
            }
            if (!tierIds.add(tier.getId())) {
                throw new ConfigurationException("Duplicate tier id: " + tier.getId());
            }
            for (String providerId : tier.getProviders()) {
                if (!providerIds.contains(providerId)) {
                    throw new ConfigurationException("Tier " + tier.getId() + " lists unknown provider: " + providerId);
                }
            }
            validateModalityKeys(tier.getId(), tier.getAllowances());
            validateModalityKeys(tier.getId(), tier.getUsageIntensity());
            validateModalityKeys(tier.getId(), tier.getUnlimitedUsage());
            for (Map.Entry<String, Number> entry : tier.getUsageIntensity().entrySet()) {
                double intensity = entry.getValue().doubleValue();
                if (intensity < 0.0 || intensity > 1.0) {
                    throw new ConfigurationException(
                            "Tier " + tier.getId() + ": usageIntensity." + entry.getKey() + " must be within [0, 1]");
                }
            }
        }

        RouterConfig.HealthConfig health = config.getHealth();
        if (health.getFailureThreshold() < 1) {
            throw new ConfigurationException("health.failureThreshold must be >= 1");
        }
        if (health.getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException("health.backoffMultiplier must be >= 1.0");
        }
        if (config.getMetrics().getMaxRecords() < 1) {
            throw new ConfigurationException("metrics.maxRecords must be >= 1");
        }
        int ringBufferSize = config.getPipeline().getRingBufferSize();
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("pipeline.ringBufferSize must be a power of 2");
        }
    }

    private static void validateModalityKeys(String tierId, Map<String, Number> values) {
        for (Map.Entry<String, Number> entry : values.entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigurationException("Tier " + tierId + ": missing value for " + entry.getKey());
            }
            try {
                Modality.fromString(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Tier " + tierId + ": " + e.getMessage(), e);
            }
        }
    }

    /**
     * Returns the current configuration.
     */
    public RouterConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed != null && changed.equals(configPath.getFileName())) {
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. Keeps the current configuration on failure.
     */
    public RouterConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RouterConfig oldConfig, RouterConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
