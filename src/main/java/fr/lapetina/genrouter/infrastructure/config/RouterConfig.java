package fr.lapetina.genrouter.infrastructure.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the generation router.
 * Designed to be populated from YAML.
 */
public class RouterConfig {

    private List<ProviderConfig> providers = new ArrayList<>();
    private List<TierConfig> tiers = new ArrayList<>();
    private HealthConfig health = new HealthConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private IdempotencyConfig idempotency = new IdempotencyConfig();
    private PipelineConfig pipeline = new PipelineConfig();

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<TierConfig> getTiers() { return tiers; }
    public void setTiers(List<TierConfig> tiers) { this.tiers = tiers; }

    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public IdempotencyConfig getIdempotency() { return idempotency; }
    public void setIdempotency(IdempotencyConfig idempotency) { this.idempotency = idempotency; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    /**
     * One generation provider. {@code timeoutMs} of 0 falls back to {@code timeouts.providerTimeoutMs}.
     */
    public static class ProviderConfig {
        private String id;
        private String displayName;
        private String modality;
        private BigDecimal unitPrice = BigDecimal.ZERO;
        private int priority = 100;
        private Set<String> tiers = new LinkedHashSet<>();
        private int creditWeight = 1;
        private long timeoutMs;
        private boolean enabled = true;
        private String credentialEnv;
        private String endpoint;
        private String model;
        private String usageField;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getModality() { return modality; }
        public void setModality(String modality) { this.modality = modality; }

        public BigDecimal getUnitPrice() { return unitPrice; }
        public void setUnitPrice(BigDecimal unitPrice) { this.unitPrice = unitPrice; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public Set<String> getTiers() { return tiers; }
        public void setTiers(Set<String> tiers) { this.tiers = tiers; }

        public int getCreditWeight() { return creditWeight; }
        public void setCreditWeight(int creditWeight) { this.creditWeight = creditWeight; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getCredentialEnv() { return credentialEnv; }
        public void setCredentialEnv(String credentialEnv) { this.credentialEnv = credentialEnv; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getUsageField() { return usageField; }
        public void setUsageField(String usageField) { this.usageField = usageField; }
    }

    /**
     * Subscription tier. Allowance maps are keyed by modality name ({@code text}, {@code image});
     * an allowance of -1 is unlimited, 0 closes the modality.
     */
    public static class TierConfig {
        private String id;
        private Set<String> providers = new LinkedHashSet<>();
        private Map<String, Number> allowances = new LinkedHashMap<>();
        private Map<String, Number> usageIntensity = new LinkedHashMap<>();
        private Map<String, Number> unlimitedUsage = new LinkedHashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public Set<String> getProviders() { return providers; }
        public void setProviders(Set<String> providers) { this.providers = providers; }

        public Map<String, Number> getAllowances() { return allowances; }
        public void setAllowances(Map<String, Number> allowances) { this.allowances = allowances; }

        public Map<String, Number> getUsageIntensity() { return usageIntensity; }
        public void setUsageIntensity(Map<String, Number> usageIntensity) { this.usageIntensity = usageIntensity; }

        public Map<String, Number> getUnlimitedUsage() { return unlimitedUsage; }
        public void setUnlimitedUsage(Map<String, Number> unlimitedUsage) { this.unlimitedUsage = unlimitedUsage; }
    }

    /**
     * Circuit breaker configuration.
     */
    public static class HealthConfig {
        private int failureThreshold = 3;
        private long cooldownMs = 60000;
        private double backoffMultiplier = 2.0;
        private long maxCooldownMs = 600000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public long getMaxCooldownMs() { return maxCooldownMs; }
        public void setMaxCooldownMs(long maxCooldownMs) { this.maxCooldownMs = maxCooldownMs; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long providerTimeoutMs = 30000;
        private long connectTimeoutMs = 10000;

        public long getProviderTimeoutMs() { return providerTimeoutMs; }
        public void setProviderTimeoutMs(long providerTimeoutMs) { this.providerTimeoutMs = providerTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Transient retry inside a provider adapter. Never crosses providers.
     */
    public static class RetryConfig {
        private int maxRetries = 2;
        private long initialBackoffMs = 200;
        private long maxBackoffMs = 5000;
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "genrouter";
        private int maxRecords = 10000;
        private long retentionMs = 3600000;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public int getMaxRecords() { return maxRecords; }
        public void setMaxRecords(int maxRecords) { this.maxRecords = maxRecords; }

        public long getRetentionMs() { return retentionMs; }
        public void setRetentionMs(long retentionMs) { this.retentionMs = retentionMs; }
    }

    public static class IdempotencyConfig {
        private long ttlMs = 600000;
        private int maxEntries = 10000;

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }

    /**
     * LMAX Disruptor front door configuration.
     */
    public static class PipelineConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxGlobalInFlight = 1000;
        private int maxPromptLength = 100000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getMaxGlobalInFlight() { return maxGlobalInFlight; }
        public void setMaxGlobalInFlight(int maxGlobalInFlight) { this.maxGlobalInFlight = maxGlobalInFlight; }

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }
    }
}
