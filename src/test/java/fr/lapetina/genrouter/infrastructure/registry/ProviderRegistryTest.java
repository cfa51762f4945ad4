package fr.lapetina.genrouter.infrastructure.registry;

import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.domain.model.TierPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    private ProviderRegistry registry;

    private static ProviderDescriptor text(String id, int priority, String price, String... tiers) {
        return ProviderDescriptor.builder()
                .id(id)
                .modality(Modality.TEXT)
                .priority(priority)
                .unitPrice(price)
                .tiers(Set.of(tiers))
                .build();
    }

    private static TierPolicy tier(String id, long textAllowance, long imageAllowance) {
        return new TierPolicy(id,
                Map.of(Modality.TEXT, textAllowance, Modality.IMAGE, imageAllowance),
                null, null, null);
    }

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(
                List.of(
                        text("provider-a", 1, "0.002", "pro", "premium"),
                        text("provider-b", 2, "0.001", "free", "pro", "premium")
                ),
                List.of(tier("free", 1000, 0), tier("pro", 10_000, 50), tier("premium", -1, -1))
        );
    }

    @Nested
    @DisplayName("candidatesFor")
    class Candidates {

        @Test
        @DisplayName("should only offer providers eligible for the tier")
        void shouldFilterByTier() {
            assertThat(registry.candidatesFor(Modality.TEXT, "free"))
                    .extracting(ProviderDescriptor::getId)
                    .containsExactly("provider-b");
        }

        @Test
        @DisplayName("should order candidates by priority before price")
        void shouldOrderByPriority() {
            assertThat(registry.candidatesFor(Modality.TEXT, "pro"))
                    .extracting(ProviderDescriptor::getId)
                    .containsExactly("provider-a", "provider-b");
        }

        @Test
        @DisplayName("should break priority ties by unit price then id")
        void shouldBreakTiesByPriceThenId() {
            registry.reload(List.of(
                    text("zeta", 1, "0.001", "pro"),
                    text("alpha", 1, "0.001", "pro"),
                    text("cheap", 1, "0.0005", "pro")
            ), List.of());

            assertThat(registry.candidatesFor(Modality.TEXT, "pro"))
                    .extracting(ProviderDescriptor::getId)
                    .containsExactly("cheap", "alpha", "zeta");
        }

        @Test
        @DisplayName("should return nothing when the tier allowance for the modality is zero")
        void shouldCloseModalityWithZeroAllowance() {
            registry.reload(List.of(
                    ProviderDescriptor.builder().id("img").modality(Modality.IMAGE).addTier("free").build()
            ), List.of(tier("free", 1000, 0)));

            assertThat(registry.candidatesFor(Modality.IMAGE, "free")).isEmpty();
        }

        @Test
        @DisplayName("should skip providers whose liveness check fails")
        void shouldSkipDeadProviders() {
            AtomicBoolean live = new AtomicBoolean(false);
            registry.reload(List.of(
                    text("provider-b", 2, "0.001", "free").toBuilder().liveness(live::get).build()
            ), List.of());

            assertThat(registry.candidatesFor(Modality.TEXT, "free")).isEmpty();

            live.set(true);
            assertThat(registry.candidatesFor(Modality.TEXT, "free")).hasSize(1);
        }

        @Test
        @DisplayName("should return an empty list for unknown modality matches")
        void shouldReturnEmptyForNoMatch() {
            assertThat(registry.candidatesFor(Modality.IMAGE, "pro")).isEmpty();
        }
    }

    @Test
    @DisplayName("should merge tier provider lists into provider eligibility")
    void shouldMergeTierProviders() {
        registry.reload(
                List.of(text("provider-a", 1, "0.002")),
                List.of(new TierPolicy("pro", null, null, null, Set.of("provider-a")))
        );

        assertThat(registry.getProvider("provider-a")).get()
                .satisfies(p -> assertThat(p.isEligibleFor("pro")).isTrue());
    }

    @Test
    @DisplayName("should reject duplicate ids and unknown provider references")
    void shouldRejectInvalidCatalog() {
        assertThatThrownBy(() -> registry.reload(
                List.of(text("dup", 1, "0.1"), text("dup", 2, "0.2")), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dup");

        assertThatThrownBy(() -> registry.reload(
                List.of(text("provider-a", 1, "0.1")),
                List.of(new TierPolicy("pro", null, null, null, Set.of("ghost")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");

        // a rejected reload leaves the previous catalog in place
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should notify listeners with added and removed providers")
    void shouldNotifyListeners() {
        List<ProviderRegistry.RegistryReloadEvent> events = new ArrayList<>();
        registry.addListener(events::add);

        registry.reload(List.of(text("provider-b", 2, "0.001", "free"), text("provider-c", 3, "0.001", "free")), List.of());

        assertThat(events).hasSize(1);
        assertThat(events.get(0).added()).containsExactly("provider-c");
        assertThat(events.get(0).removed()).containsExactly("provider-a");
    }

    @Test
    @DisplayName("should never expose a half-applied catalog to concurrent readers")
    void shouldReloadAtomically() throws Exception {
        List<ProviderDescriptor> catalogOne = List.of(
                text("one-a", 1, "0.1", "pro"), text("one-b", 2, "0.1", "pro"));
        List<ProviderDescriptor> catalogTwo = List.of(
                text("two-a", 1, "0.1", "pro"), text("two-b", 2, "0.1", "pro"), text("two-c", 3, "0.1", "pro"));
        registry.reload(catalogOne, List.of());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        AtomicBoolean stop = new AtomicBoolean(false);
        try {
            Future<?> writer = executor.submit(() -> {
                for (int i = 0; i < 2000; i++) {
                    registry.reload(i % 2 == 0 ? catalogTwo : catalogOne, List.of());
                }
                stop.set(true);
            });
            Future<Boolean> reader = executor.submit(() -> {
                while (!stop.get()) {
                    List<String> ids = registry.candidatesFor(Modality.TEXT, "pro").stream()
                            .map(ProviderDescriptor::getId)
                            .toList();
                    boolean consistent = ids.equals(List.of("one-a", "one-b"))
                            || ids.equals(List.of("two-a", "two-b", "two-c"));
                    if (!consistent) {
                        return false;
                    }
                }
                return true;
            });

            writer.get(10, TimeUnit.SECONDS);
            assertThat(reader.get(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            stop.set(true);
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("should expose tier policies and known tiers")
    void shouldExposeTiers() {
        assertThat(registry.knownTiers()).containsExactlyInAnyOrder("free", "pro", "premium");
        assertThat(registry.isKnownTier("enterprise")).isFalse();
        assertThat(registry.getTierPolicy("premium")).get()
                .satisfies(p -> assertThat(p.isUnlimited(Modality.TEXT)).isTrue());
    }
}
