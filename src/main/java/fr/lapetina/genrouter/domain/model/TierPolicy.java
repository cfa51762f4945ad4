package fr.lapetina.genrouter.domain.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Usage policy of one subscription tier.
 *
 * Allowances are expressed in credits per billing period. A modality that is
 * not listed is unlimited; {@link #UNLIMITED} states it explicitly and zero
 * closes the modality for the tier.
 *
 * @param id               tier identifier (free, pro, premium, ...)
 * @param allowances       credits per period for each modality
 * @param usageIntensity   expected fraction of a limited allowance a user consumes
 * @param unlimitedUsage   expected credits per user when the allowance is unlimited
 * @param providers        providers this tier is eligible for, in addition to the
 *                         tiers each provider lists itself
 */
public record TierPolicy(
        String id,
        Map<Modality, Long> allowances,
        Map<Modality, Double> usageIntensity,
        Map<Modality, Long> unlimitedUsage,
        Set<String> providers
) {
    public static final long UNLIMITED = -1L;

    public TierPolicy {
        Objects.requireNonNull(id, "Tier ID is required");
        allowances = allowances != null ? copy(allowances) : Map.of();
        usageIntensity = usageIntensity != null ? copy(usageIntensity) : Map.of();
        unlimitedUsage = unlimitedUsage != null ? copy(unlimitedUsage) : Map.of();
        providers = providers != null ? Set.copyOf(providers) : Set.of();
        for (Map.Entry<Modality, Double> entry : usageIntensity.entrySet()) {
            double value = entry.getValue();
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(
                        "Usage intensity must be within [0, 1]: tier=" + id + ", modality=" + entry.getKey());
            }
        }
    }

    /**
     * Creates a policy with no allowance limits.
     */
    public static TierPolicy unlimited(String id) {
        return new TierPolicy(id, null, null, null, null);
    }

    public long allowance(Modality modality) {
        return allowances.getOrDefault(modality, UNLIMITED);
    }

    public boolean isUnlimited(Modality modality) {
        return allowance(modality) < 0;
    }

    /**
     * Whether this tier may generate the modality at all.
     */
    public boolean permits(Modality modality) {
        return allowance(modality) != 0;
    }

    public double intensity(Modality modality) {
        return usageIntensity.getOrDefault(modality, 1.0);
    }

    public long unlimitedUsage(Modality modality) {
        return unlimitedUsage.getOrDefault(modality, 0L);
    }

    private static <V> Map<Modality, V> copy(Map<Modality, V> source) {
        Map<Modality, V> copy = new EnumMap<>(Modality.class);
        copy.putAll(source);
        return Map.copyOf(copy);
    }
}
