package fr.lapetina.genrouter.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Catalog entry for one generation provider.
 * Immutable once built; the liveness predicate is the only part evaluated at call time.
 */
public final class ProviderDescriptor {

    /**
     * Candidate order: ascending priority, then cheapest unit price, then id.
     */
    public static final Comparator<ProviderDescriptor> CANDIDATE_ORDER =
            Comparator.comparingInt(ProviderDescriptor::getPriority)
                    .thenComparing(ProviderDescriptor::getUnitPrice)
                    .thenComparing(ProviderDescriptor::getId);

    private final String id;
    private final String displayName;
    private final Modality modality;
    private final BigDecimal unitPrice;
    private final int priority;
    private final Set<String> eligibleTiers;
    private final BooleanSupplier liveness;
    private final Duration timeout;
    private final int creditWeight;

    private ProviderDescriptor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.modality = Objects.requireNonNull(builder.modality, "Modality is required");
        this.unitPrice = Objects.requireNonNull(builder.unitPrice, "Unit price is required");
        if (unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Unit price must not be negative: " + id);
        }
        if (builder.creditWeight < 1) {
            throw new IllegalArgumentException("Credit weight must be at least 1: " + id);
        }
        this.displayName = builder.displayName != null ? builder.displayName : builder.id;
        this.priority = builder.priority;
        this.eligibleTiers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.eligibleTiers));
        this.liveness = builder.liveness;
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout is required");
        this.creditWeight = builder.creditWeight;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Modality getModality() {
        return modality;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public int getPriority() {
        return priority;
    }

    public Set<String> getEligibleTiers() {
        return eligibleTiers;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getCreditWeight() {
        return creditWeight;
    }

    public boolean isEligibleFor(String tier) {
        return eligibleTiers.contains(tier);
    }

    /**
     * Evaluates the liveness predicate (credential present, adapter wired, ...).
     */
    public boolean isLive() {
        return liveness.getAsBoolean();
    }

    public BigDecimal costOf(long billedUnits) {
        return unitPrice.multiply(BigDecimal.valueOf(billedUnits));
    }

    public long creditsFor(long billedUnits) {
        return billedUnits * creditWeight;
    }

    /**
     * Returns a copy with additional eligible tiers.
     */
    public ProviderDescriptor withAdditionalTiers(Set<String> tiers) {
        Builder copy = toBuilder();
        copy.eligibleTiers.addAll(tiers);
        return copy.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .displayName(displayName)
                .modality(modality)
                .unitPrice(unitPrice)
                .priority(priority)
                .tiers(eligibleTiers)
                .liveness(liveness)
                .timeout(timeout)
                .creditWeight(creditWeight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderDescriptor that = (ProviderDescriptor) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ProviderDescriptor{" +
                "id='" + id + '\'' +
                ", modality=" + modality +
                ", priority=" + priority +
                ", unitPrice=" + unitPrice.toPlainString() +
                ", tiers=" + eligibleTiers +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String displayName;
        private Modality modality;
        private BigDecimal unitPrice = BigDecimal.ZERO;
        private int priority = 100;
        private final Set<String> eligibleTiers = new LinkedHashSet<>();
        private BooleanSupplier liveness = () -> true;
        private Duration timeout = Duration.ofSeconds(30);
        private int creditWeight = 1;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder modality(Modality modality) {
            this.modality = modality;
            return this;
        }

        public Builder unitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
            return this;
        }

        public Builder unitPrice(String unitPrice) {
            this.unitPrice = new BigDecimal(unitPrice);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder addTier(String tier) {
            this.eligibleTiers.add(tier);
            return this;
        }

        public Builder tiers(Set<String> tiers) {
            this.eligibleTiers.addAll(tiers);
            return this;
        }

        public Builder liveness(BooleanSupplier liveness) {
            this.liveness = Objects.requireNonNull(liveness, "liveness");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder creditWeight(int creditWeight) {
            this.creditWeight = creditWeight;
            return this;
        }

        public ProviderDescriptor build() {
            return new ProviderDescriptor(this);
        }
    }
}
