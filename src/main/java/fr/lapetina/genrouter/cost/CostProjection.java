package fr.lapetina.genrouter.cost;

import fr.lapetina.genrouter.domain.model.Modality;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Forward-looking cost exposure of one tier.
 *
 * @param perUserCost  projected cost of one user over a billing period, across modalities
 * @param totalCost    {@code perUserCost * userCount}
 */
public record CostProjection(
        String tier,
        long userCount,
        Map<Modality, ModalityProjection> byModality,
        BigDecimal perUserCost,
        BigDecimal totalCost
) {
    public CostProjection {
        byModality = Map.copyOf(byModality);
    }

    /**
     * Projection for one modality.
     *
     * @param providerId       expected provider (head of the candidate list), null when none qualifies
     * @param allowance        tier allowance in credits, -1 when unlimited
     * @param projectedCredits credits one user is expected to spend
     * @param projectedUnits   billed units those credits buy at the provider's credit weight
     * @param unitPrice        provider price per billed unit, zero when no provider
     * @param cost             {@code projectedUnits * unitPrice}
     */
    public record ModalityProjection(
            Modality modality,
            String providerId,
            long allowance,
            BigDecimal projectedCredits,
            BigDecimal projectedUnits,
            BigDecimal unitPrice,
            BigDecimal cost
    ) {
    }
}
