package fr.lapetina.genrouter.infrastructure.config;

import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.domain.model.TierPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Turns the YAML catalog into registry entries.
 */
public final class CatalogMapper {

    private CatalogMapper() {
    }

    /**
     * Builds one descriptor per configured provider. A disabled provider is kept in the
     * catalog (tiers may still name it) but is never live.
     *
     * @param liveness liveness predicate for an enabled provider, typically "credential present"
     */
    public static List<ProviderDescriptor> toDescriptors(
            RouterConfig config,
            Function<RouterConfig.ProviderConfig, BooleanSupplier> liveness
    ) {
        long defaultTimeoutMs = config.getTimeouts().getProviderTimeoutMs();
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        for (RouterConfig.ProviderConfig provider : config.getProviders()) {
            long timeoutMs = provider.getTimeoutMs() > 0 ? provider.getTimeoutMs() : defaultTimeoutMs;
            BooleanSupplier live = provider.isEnabled() ? liveness.apply(provider) : () -> false;
            descriptors.add(ProviderDescriptor.builder()
                    .id(provider.getId())
                    .displayName(provider.getDisplayName())
                    .modality(Modality.fromString(provider.getModality()))
                    .unitPrice(provider.getUnitPrice())
                    .priority(provider.getPriority())
                    .tiers(provider.getTiers())
                    .creditWeight(provider.getCreditWeight())
                    .timeout(Duration.ofMillis(timeoutMs))
                    .liveness(live)
                    .build());
        }
        return descriptors;
    }

    public static List<TierPolicy> toTierPolicies(RouterConfig config) {
        List<TierPolicy> policies = new ArrayList<>();
        for (RouterConfig.TierConfig tier : config.getTiers()) {
            policies.add(new TierPolicy(
                    tier.getId(),
                    byModality(tier.getAllowances(), Number::longValue),
                    byModality(tier.getUsageIntensity(), Number::doubleValue),
                    byModality(tier.getUnlimitedUsage(), Number::longValue),
                    tier.getProviders()
            ));
        }
        return policies;
    }

    private static <V> Map<Modality, V> byModality(Map<String, Number> values, Function<Number, V> convert) {
        Map<Modality, V> result = new EnumMap<>(Modality.class);
        values.forEach((key, value) -> result.put(Modality.fromString(key), convert.apply(value)));
        return result;
    }
}
