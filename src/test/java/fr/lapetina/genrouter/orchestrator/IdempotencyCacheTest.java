package fr.lapetina.genrouter.orchestrator;

import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.GenerationOutput;
import fr.lapetina.genrouter.domain.model.GenerationPayload;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyCacheTest {

    private MutableClock clock;
    private IdempotencyCache cache;
    private GenerationRequest request;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new IdempotencyCache(Duration.ofMinutes(10), 2, clock, Runnable::run);
        request = request("pro", Modality.TEXT, "cid");
    }

    private static GenerationRequest request(String tier, Modality modality, String correlationId) {
        return GenerationRequest.builder()
                .correlationId(correlationId)
                .tier(tier)
                .modality(modality)
                .payload(GenerationPayload.ofPrompt("hello"))
                .build();
    }

    private OrchestrationResult success() {
        ProviderDescriptor provider = ProviderDescriptor.builder().id("provider-a").modality(Modality.TEXT).build();
        return OrchestrationResult.success(request, provider, GenerationOutput.text("ok", 3), Duration.ofMillis(5));
    }

    @Test
    @DisplayName("should hand the key to the first caller and the owner's future to the next")
    void shouldJoinInFlight() {
        CompletableFuture<OrchestrationResult> owner = new CompletableFuture<>();

        assertThat(cache.joinOrRegister(request, owner)).isNull();
        assertThat(cache.joinOrRegister(request, new CompletableFuture<>())).isSameAs(owner);
    }

    @Test
    @DisplayName("should keep a success for the TTL counted from completion")
    void shouldKeepSuccessForTtl() {
        CompletableFuture<OrchestrationResult> owner = new CompletableFuture<>();
        cache.joinOrRegister(request, owner);
        clock.advance(Duration.ofMinutes(5));
        cache.complete(request, owner, success());

        clock.advance(Duration.ofMinutes(9));
        assertThat(cache.joinOrRegister(request, new CompletableFuture<>())).isSameAs(owner);

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.joinOrRegister(request, new CompletableFuture<>())).isNull();
    }

    @Test
    @DisplayName("should forget failures so a retry runs again")
    void shouldDropFailures() {
        CompletableFuture<OrchestrationResult> owner = new CompletableFuture<>();
        cache.joinOrRegister(request, owner);

        cache.complete(request, owner, OrchestrationResult.rejected(request, FailureKind.ALL_PROVIDERS_EXHAUSTED, "x"));

        assertThat(cache.size()).isZero();
        assertThat(cache.joinOrRegister(request, new CompletableFuture<>())).isNull();
    }

    @Test
    @DisplayName("should ignore completion from a caller that does not own the key")
    void shouldIgnoreForeignCompletion() {
        CompletableFuture<OrchestrationResult> owner = new CompletableFuture<>();
        cache.joinOrRegister(request, owner);

        cache.complete(request, new CompletableFuture<>(), null);

        assertThat(cache.joinOrRegister(request, new CompletableFuture<>())).isSameAs(owner);
    }

    @Test
    @DisplayName("should keep a reused correlation id apart across tiers and modalities")
    void shouldSeparateTierAndModality() {
        CompletableFuture<OrchestrationResult> owner = new CompletableFuture<>();
        cache.joinOrRegister(request, owner);

        GenerationRequest otherTier = request("free", Modality.TEXT, "cid");
        GenerationRequest otherModality = request("pro", Modality.IMAGE, "cid");

        assertThat(cache.joinOrRegister(otherTier, new CompletableFuture<>())).isNull();
        assertThat(cache.joinOrRegister(otherModality, new CompletableFuture<>())).isNull();
        assertThat(cache.joinOrRegister(request, new CompletableFuture<>())).isSameAs(owner);
    }

    @Test
    @DisplayName("should stay within its maximum size")
    void shouldBoundSize() {
        for (int i = 0; i < 10; i++) {
            cache.joinOrRegister(request("pro", Modality.TEXT, "cid-" + i), new CompletableFuture<>());
        }

        assertThat(cache.size()).isLessThanOrEqualTo(2);
    }
}
