package fr.lapetina.genrouter.cost;

import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.domain.model.TierPolicy;
import fr.lapetina.genrouter.infrastructure.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Projects what a tier of users is expected to cost.
 *
 * <p>For each modality the expected provider is the head of the tier's candidate list.
 * Projected credits are the allowance scaled by the tier's usage intensity, the
 * unlimited-usage assumption when the allowance is unlimited, or zero when the modality is
 * closed. Credits convert to billed units through the provider's credit weight and units
 * to money through its unit price.
 *
 * <p>Pure given the registry contents: never consults observed metrics or provider health.
 */
public final class CostEstimator {

    private static final Logger log = LoggerFactory.getLogger(CostEstimator.class);

    public static final int SCALE = 6;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final ProviderRegistry registry;

    public CostEstimator(ProviderRegistry registry) {
        this.registry = registry;
    }

    public CostProjection estimate(String tier) {
        return estimate(tier, 1);
    }

    /**
     * Aggregate exposure for {@code userCount} users of the tier.
     */
    public CostProjection estimate(String tier, long userCount) {
        if (userCount < 0) {
            throw new IllegalArgumentException("userCount must not be negative");
        }
        TierPolicy policy = registry.getTierPolicy(tier).orElseGet(() -> TierPolicy.unlimited(tier));

        Map<Modality, CostProjection.ModalityProjection> byModality = new EnumMap<>(Modality.class);
        BigDecimal perUser = BigDecimal.ZERO.setScale(SCALE, ROUNDING);
        for (Modality modality : Modality.values()) {
            CostProjection.ModalityProjection projection = project(policy, modality);
            byModality.put(modality, projection);
            perUser = perUser.add(projection.cost());
        }

        BigDecimal total = perUser.multiply(BigDecimal.valueOf(userCount)).setScale(SCALE, ROUNDING);
        log.debug("Cost projected: tier={}, users={}, perUser={}, total={}",
                tier, userCount, perUser.toPlainString(), total.toPlainString());
        return new CostProjection(tier, userCount, byModality, perUser, total);
    }

    /**
     * One projection per known tier, per single user.
     */
    public List<CostProjection> estimateAll() {
        List<CostProjection> projections = new ArrayList<>();
        for (String tier : registry.knownTiers()) {
            projections.add(estimate(tier));
        }
        return projections;
    }

    private CostProjection.ModalityProjection project(TierPolicy policy, Modality modality) {
        long allowance = policy.allowance(modality);
        List<ProviderDescriptor> candidates = registry.candidatesFor(modality, policy.id());
        BigDecimal zero = BigDecimal.ZERO.setScale(SCALE, ROUNDING);
        if (candidates.isEmpty()) {
            return new CostProjection.ModalityProjection(modality, null, allowance, zero, zero, zero, zero);
        }
        ProviderDescriptor provider = candidates.get(0);

        BigDecimal credits;
        if (allowance == 0) {
            credits = zero;
        } else if (policy.isUnlimited(modality)) {
            credits = BigDecimal.valueOf(policy.unlimitedUsage(modality)).setScale(SCALE, ROUNDING);
        } else {
            credits = BigDecimal.valueOf(allowance)
                    .multiply(BigDecimal.valueOf(policy.intensity(modality)))
                    .setScale(SCALE, ROUNDING);
        }

        BigDecimal units = credits.divide(BigDecimal.valueOf(provider.getCreditWeight()), SCALE, ROUNDING);
        BigDecimal cost = units.multiply(provider.getUnitPrice()).setScale(SCALE, ROUNDING);
        return new CostProjection.ModalityProjection(
                modality, provider.getId(), allowance, credits, units, provider.getUnitPrice(), cost);
    }
}
