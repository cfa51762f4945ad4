package fr.lapetina.genrouter.infrastructure.provider;

import fr.lapetina.genrouter.domain.model.GenerationOutput;
import fr.lapetina.genrouter.domain.model.GenerationPayload;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Bridge between the router and one provider's API.
 *
 * <p>The returned future completes with the output on success, or exceptionally with a
 * {@link ProviderException} describing the failure kind. Cancelling the future must
 * abort the underlying call. Transient retries, if any, happen inside the adapter and
 * must finish within {@code timeout}.
 */
public interface ProviderAdapter extends AutoCloseable {

    String providerId();

    CompletableFuture<GenerationOutput> invoke(GenerationPayload payload, Duration timeout);

    /**
     * Whether the adapter can currently be called at all, e.g. its credential is configured.
     */
    default boolean isAvailable() {
        return true;
    }

    @Override
    default void close() {
    }
}
