package fr.lapetina.genrouter.orchestrator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Results keyed by correlation id, tier and modality, so that a resubmitted request is
 * never generated twice and a reused correlation id never crosses tiers or modalities.
 *
 * An entry is in flight until its owner completes it. Successes are rewritten on
 * completion and stay for the TTL from then; failures are dropped at once so the caller
 * can try again.
 */
public final class IdempotencyCache {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyCache.class);

    record Key(String correlationId, String tier, Modality modality) {
        static Key of(GenerationRequest request) {
            return new Key(request.correlationId(), request.tier(), request.modality());
        }
    }

    private final Cache<Key, CompletableFuture<OrchestrationResult>> cache;
    private final ConcurrentMap<Key, CompletableFuture<OrchestrationResult>> entries;

    public IdempotencyCache(Duration ttl, int maxEntries, Clock clock) {
        this(ttl, maxEntries, clock, null);
    }

    /**
     * @param executor runs eviction maintenance; null for Caffeine's default
     */
    IdempotencyCache(Duration ttl, int maxEntries, Clock clock, Executor executor) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(tickerOf(clock));
        if (executor != null) {
            builder.executor(executor);
        }
        this.cache = builder.build();
        this.entries = cache.asMap();
    }

    /**
     * Registers {@code owner} as the in-flight computation for the request's key, unless
     * another live entry exists.
     *
     * @return the existing entry's future to join, or null when the caller now owns the key
     */
    public CompletableFuture<OrchestrationResult> joinOrRegister(
            GenerationRequest request, CompletableFuture<OrchestrationResult> owner) {
        return entries.putIfAbsent(Key.of(request), owner);
    }

    /**
     * Completes the owner's entry: successes are kept for the TTL, failures removed.
     */
    public void complete(GenerationRequest request, CompletableFuture<OrchestrationResult> owner, OrchestrationResult result) {
        Key key = Key.of(request);
        if (result != null && result.isSuccess()) {
            if (!entries.replace(key, owner, owner)) {
                log.debug("Idempotency entry gone before completion: correlationId={}", key.correlationId());
            }
        } else {
            entries.remove(key, owner);
        }
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }

    private static Ticker tickerOf(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }
}
