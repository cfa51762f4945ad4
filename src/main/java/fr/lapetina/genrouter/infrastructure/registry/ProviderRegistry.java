package fr.lapetina.genrouter.infrastructure.registry;

import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.domain.model.TierPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Catalog of providers and tier policies.
 *
 * The catalog is an immutable snapshot swapped through an {@link AtomicReference}
 * on reload, so a reader sees either the old set or the new one, never a mix.
 * Tier gating lives here: a provider is a candidate only if the tier is
 * eligible for it and the tier's allowance for the modality is not zero.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final List<Consumer<RegistryReloadEvent>> listeners = new CopyOnWriteArrayList<>();

    public ProviderRegistry() {
    }

    public ProviderRegistry(Collection<ProviderDescriptor> providers, Collection<TierPolicy> tiers) {
        reload(providers, tiers);
    }

    /**
     * Ordered candidates for a request: modality matches, tier eligible, tier allowance
     * not zero, liveness holds. Ascending priority, then unit price, then id.
     * An empty list is a normal answer.
     */
    public List<ProviderDescriptor> candidatesFor(Modality modality, String tier) {
        Snapshot current = snapshot.get();
        TierPolicy policy = current.tiers().get(tier);
        if (policy != null && !policy.permits(modality)) {
            log.debug("Tier closed for modality: tier={}, modality={}", tier, modality);
            return List.of();
        }
        return current.providers().values().stream()
                .filter(p -> p.getModality() == modality)
                .filter(p -> p.isEligibleFor(tier))
                .filter(ProviderDescriptor::isLive)
                .sorted(ProviderDescriptor.CANDIDATE_ORDER)
                .toList();
    }

    /**
     * Atomically replaces the whole catalog.
     * Eligibility declared on a tier's provider list is merged into the providers' own tier sets.
     *
     * @throws IllegalArgumentException on duplicate provider or tier ids, or when a
     *                                  tier lists a provider that does not exist
     */
    public void reload(Collection<ProviderDescriptor> providers, Collection<TierPolicy> tiers) {
        Map<String, TierPolicy> tierMap = new LinkedHashMap<>();
        for (TierPolicy tier : tiers) {
            if (tierMap.putIfAbsent(tier.id(), tier) != null) {
                throw new IllegalArgumentException("Duplicate tier ID: " + tier.id());
            }
        }

        Map<String, ProviderDescriptor> providerMap = new LinkedHashMap<>();
        for (ProviderDescriptor provider : providers) {
            if (providerMap.putIfAbsent(provider.getId(), provider) != null) {
                throw new IllegalArgumentException("Duplicate provider ID: " + provider.getId());
            }
        }

        for (TierPolicy tier : tierMap.values()) {
            for (String providerId : tier.providers()) {
                ProviderDescriptor provider = providerMap.get(providerId);
                if (provider == null) {
                    throw new IllegalArgumentException(
                            "Tier " + tier.id() + " lists unknown provider: " + providerId);
                }
                if (!provider.isEligibleFor(tier.id())) {
                    providerMap.put(providerId, provider.withAdditionalTiers(Set.of(tier.id())));
                }
            }
        }

        Snapshot next = new Snapshot(
                Collections.unmodifiableMap(providerMap),
                Collections.unmodifiableMap(tierMap)
        );
        Snapshot previous = snapshot.getAndSet(next);

        Set<String> added = new HashSet<>(next.providers().keySet());
        added.removeAll(previous.providers().keySet());
        Set<String> removed = new HashSet<>(previous.providers().keySet());
        removed.removeAll(next.providers().keySet());

        log.info("Provider registry reloaded: providers={}, tiers={}, added={}, removed={}",
                providerMap.size(), tierMap.size(), added, removed);
        notifyListeners(new RegistryReloadEvent(Set.copyOf(added), Set.copyOf(removed),
                List.copyOf(next.providers().values())));
    }

    public Optional<ProviderDescriptor> getProvider(String providerId) {
        return Optional.ofNullable(snapshot.get().providers().get(providerId));
    }

    public List<ProviderDescriptor> getAllProviders() {
        return new ArrayList<>(snapshot.get().providers().values());
    }

    public Optional<TierPolicy> getTierPolicy(String tier) {
        return Optional.ofNullable(snapshot.get().tiers().get(tier));
    }

    public List<TierPolicy> getTierPolicies() {
        return new ArrayList<>(snapshot.get().tiers().values());
    }

    /**
     * Tiers with a configured policy plus every tier named by a provider.
     */
    public Set<String> knownTiers() {
        Snapshot current = snapshot.get();
        Set<String> tiers = new LinkedHashSet<>(current.tiers().keySet());
        for (ProviderDescriptor provider : current.providers().values()) {
            tiers.addAll(provider.getEligibleTiers());
        }
        return Collections.unmodifiableSet(tiers);
    }

    public boolean isKnownTier(String tier) {
        return knownTiers().contains(tier);
    }

    public int size() {
        return snapshot.get().providers().size();
    }

    public void addListener(Consumer<RegistryReloadEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryReloadEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryReloadEvent event) {
        for (Consumer<RegistryReloadEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener", e);
            }
        }
    }

    private record Snapshot(Map<String, ProviderDescriptor> providers, Map<String, TierPolicy> tiers) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());
    }

    /**
     * Published after each reload.
     */
    public record RegistryReloadEvent(Set<String> added, Set<String> removed, List<ProviderDescriptor> providers) {
        public Set<String> providerIds() {
            Set<String> ids = new HashSet<>();
            for (ProviderDescriptor provider : providers) {
                ids.add(provider.getId());
            }
            return ids;
        }
    }
}
