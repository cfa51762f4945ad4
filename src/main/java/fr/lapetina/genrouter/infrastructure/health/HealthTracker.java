package fr.lapetina.genrouter.infrastructure.health;

import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.HealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider circuit breakers, keyed by provider id.
 *
 * Provides:
 * - outcome recording ({@link #recordOutcome}), the only path that moves a circuit on traffic
 * - a pure eligibility check and a slot-claiming {@link #acquire} used to build candidate lists
 * - admin operations: reset, force open, force close
 *
 * State is held in this process only. Entries are created CLOSED on first sight
 * and never removed, so a provider dropped from the catalog and added back keeps its history.
 */
public final class HealthTracker {

    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    private final Map<String, ProviderCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final ProviderCircuitBreaker.Settings settings;
    private final Clock clock;

    public HealthTracker(ProviderCircuitBreaker.Settings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public HealthTracker() {
        this(ProviderCircuitBreaker.Settings.DEFAULTS, Clock.systemUTC());
    }

    /**
     * Creates CLOSED entries for providers not seen yet.
     */
    public void register(Collection<String> providerIds) {
        for (String id : providerIds) {
            breakers.computeIfAbsent(id, this::newBreaker);
        }
    }

    /**
     * Reports the outcome of one attempt. Failures of a kind that does not reflect on
     * the provider (cancellation, pipeline rejections) are ignored.
     */
    public void recordOutcome(String providerId, boolean success, FailureKind kind) {
        if (!success && (kind == null || !kind.countsAgainstProvider())) {
            log.debug("Outcome not held against provider: providerId={}, kind={}", providerId, kind);
            return;
        }
        ProviderCircuitBreaker breaker = breaker(providerId);
        if (success) {
            breaker.recordSuccess(clock.instant());
        } else {
            breaker.recordFailure(clock.instant());
        }
    }

    public boolean isEligible(String providerId) {
        return isEligible(providerId, clock.instant());
    }

    /**
     * Pure check: would a request be let through now. Claims no slot.
     */
    public boolean isEligible(String providerId, Instant now) {
        return breaker(providerId).isEligible(now);
    }

    public Admission acquire(String providerId) {
        return acquire(providerId, clock.instant());
    }

    /**
     * Admits a request to the provider; {@link Admission#TRIAL} means the caller holds the
     * half-open slot and must either report an outcome or call {@link #releaseTrial}.
     */
    public Admission acquire(String providerId, Instant now) {
        return breaker(providerId).acquire(now);
    }

    public void releaseTrial(String providerId) {
        ProviderCircuitBreaker breaker = breakers.get(providerId);
        if (breaker != null) {
            breaker.releaseTrial();
        }
    }

    /**
     * Current state of every known provider, sorted by id.
     */
    public Map<String, HealthState> snapshot() {
        Map<String, HealthState> snapshot = new TreeMap<>();
        Instant now = clock.instant();
        breakers.forEach((id, breaker) -> snapshot.put(id, breaker.snapshot(now)));
        return snapshot;
    }

    public HealthState getState(String providerId) {
        return breaker(providerId).snapshot(clock.instant());
    }

    public void reset() {
        breakers.values().forEach(ProviderCircuitBreaker::reset);
        log.info("Health tracker reset: providers={}", breakers.size());
    }

    public void reset(String providerId) {
        breaker(providerId).reset();
    }

    public void forceOpen(String providerId) {
        breaker(providerId).forceOpen(clock.instant());
    }

    public void forceClose(String providerId) {
        breaker(providerId).forceClose(clock.instant());
    }

    public ProviderCircuitBreaker.Settings getSettings() {
        return settings;
    }

    private ProviderCircuitBreaker breaker(String providerId) {
        return breakers.computeIfAbsent(providerId, this::newBreaker);
    }

    private ProviderCircuitBreaker newBreaker(String providerId) {
        log.debug("Circuit breaker created: providerId={}", providerId);
        return new ProviderCircuitBreaker(providerId, settings);
    }
}
