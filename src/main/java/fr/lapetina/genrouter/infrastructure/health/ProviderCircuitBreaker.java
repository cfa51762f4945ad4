package fr.lapetina.genrouter.infrastructure.health;

import fr.lapetina.genrouter.domain.model.CircuitState;
import fr.lapetina.genrouter.domain.model.HealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Circuit breaker guarding one provider.
 *
 * States:
 * - CLOSED: provider attempted; consecutive failures counted
 * - OPEN: threshold reached, provider excluded until the cooldown ends
 * - HALF_OPEN: cooldown over, a single trial request decides recovery
 *
 * Each trip without recovery multiplies the cooldown, up to a cap.
 * All transitions are compare-and-swap loops over an immutable {@link HealthState}.
 */
public final class ProviderCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    /**
     * Breaker tuning shared by every provider.
     */
    public record Settings(int failureThreshold, Duration cooldown, double backoffMultiplier, Duration maxCooldown) {
        public static final Settings DEFAULTS =
                new Settings(3, Duration.ofSeconds(60), 2.0, Duration.ofMinutes(10));

        public Settings {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("Failure threshold must be at least 1");
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
            }
            if (cooldown == null || cooldown.isNegative()) {
                throw new IllegalArgumentException("Cooldown must not be negative");
            }
            if (maxCooldown == null || maxCooldown.compareTo(cooldown) < 0) {
                maxCooldown = cooldown;
            }
        }
    }

    private final String providerId;
    private final Settings settings;
    private final AtomicReference<HealthState> state = new AtomicReference<>(HealthState.INITIAL);

    public ProviderCircuitBreaker(String providerId, Settings settings) {
        this.providerId = providerId;
        this.settings = settings;
    }

    public ProviderCircuitBreaker(String providerId) {
        this(providerId, Settings.DEFAULTS);
    }

    /**
     * Pure eligibility check; claims nothing.
     */
    public boolean isEligible(Instant now) {
        HealthState current = state.get();
        return switch (current.effectiveStatus(now)) {
            case CLOSED -> true;
            case OPEN -> false;
            case HALF_OPEN -> !current.trialInFlight();
        };
    }

    /**
     * Admits a request, claiming the trial slot when the circuit is half-open.
     */
    public Admission acquire(Instant now) {
        while (true) {
            HealthState current = state.get();
            CircuitState effective = current.effectiveStatus(now);
            if (effective == CircuitState.CLOSED) {
                return Admission.ADMITTED;
            }
            if (effective == CircuitState.OPEN || current.trialInFlight()) {
                return Admission.REJECTED;
            }
            HealthState next = current.withStatus(CircuitState.HALF_OPEN).withTrial(true);
            if (state.compareAndSet(current, next)) {
                if (current.status() == CircuitState.OPEN) {
                    log.info("Circuit breaker transitioning to HALF_OPEN: providerId={}", providerId);
                }
                log.debug("Trial slot acquired: providerId={}", providerId);
                return Admission.TRIAL;
            }
        }
    }

    /**
     * Gives back an unused trial slot. The circuit stays HALF_OPEN so a later request can try.
     */
    public void releaseTrial() {
        Transition t = update(s -> s.trialInFlight() ? s.withTrial(false) : s);
        if (t.previous().trialInFlight()) {
            log.debug("Trial slot released: providerId={}", providerId);
        }
    }

    public void recordSuccess(Instant now) {
        Transition t = update(s -> switch (s.status()) {
            case CLOSED, OPEN -> s.withSuccess(now);
            case HALF_OPEN -> s.closed(now);
        });
        if (t.previous().status() == CircuitState.HALF_OPEN) {
            log.info("Circuit breaker CLOSED after recovery: providerId={}", providerId);
        }
    }

    public void recordFailure(Instant now) {
        Transition t = update(s -> switch (s.status()) {
            case CLOSED -> s.consecutiveFailures() + 1 >= settings.failureThreshold()
                    ? s.opened(now, now.plus(cooldownForTrip(s.tripCount() + 1)))
                    : s.withFailure(now);
            case HALF_OPEN -> s.opened(now, now.plus(cooldownForTrip(s.tripCount() + 1)));
            case OPEN -> s.withFailure(now);
        });
        HealthState next = t.next();
        if (t.previous().status() == CircuitState.CLOSED && next.status() == CircuitState.OPEN) {
            log.warn("Circuit breaker OPENED: providerId={}, failures={}, cooldownUntil={}",
                    providerId, next.consecutiveFailures(), next.cooldownUntil());
        } else if (t.previous().status() == CircuitState.HALF_OPEN) {
            log.warn("Circuit breaker OPENED (half-open failure): providerId={}, trip={}, cooldownUntil={}",
                    providerId, next.tripCount(), next.cooldownUntil());
        }
    }

    /**
     * Opens the circuit for one base cooldown. For admin use.
     */
    public void forceOpen(Instant now) {
        HealthState old = state.getAndUpdate(s -> new HealthState(
                CircuitState.OPEN, s.consecutiveFailures(), s.lastFailureAt(), s.lastSuccessAt(),
                now.plus(cooldownForTrip(Math.max(1, s.tripCount()))), Math.max(1, s.tripCount()), false));
        log.info("Circuit breaker forced from {} to OPEN: providerId={}", old.status(), providerId);
    }

    public void forceClose(Instant now) {
        HealthState old = state.getAndUpdate(s -> s.closed(now));
        log.info("Circuit breaker forced from {} to CLOSED: providerId={}", old.status(), providerId);
    }

    public void reset() {
        state.set(HealthState.INITIAL);
        log.info("Circuit breaker reset: providerId={}", providerId);
    }

    /**
     * {@code min(base * multiplier^(trip-1), max)}.
     */
    public Duration cooldownForTrip(int trip) {
        double factor = Math.pow(settings.backoffMultiplier(), Math.max(0, trip - 1));
        double millis = settings.cooldown().toMillis() * factor;
        long capped = (long) Math.min(millis, settings.maxCooldown().toMillis());
        return Duration.ofMillis(capped);
    }

    public HealthState getState() {
        return state.get();
    }

    /**
     * State as reported to readers: OPEN past its cooldown shows as HALF_OPEN.
     */
    public HealthState snapshot(Instant now) {
        HealthState current = state.get();
        CircuitState effective = current.effectiveStatus(now);
        return effective == current.status() ? current : current.withStatus(effective);
    }

    public String getProviderId() {
        return providerId;
    }

    private Transition update(UnaryOperator<HealthState> transition) {
        while (true) {
            HealthState current = state.get();
            HealthState next = transition.apply(current);
            if (current == next || state.compareAndSet(current, next)) {
                return new Transition(current, next);
            }
        }
    }

    private record Transition(HealthState previous, HealthState next) {
    }

    @Override
    public String toString() {
        HealthState current = state.get();
        return "ProviderCircuitBreaker{" +
                "providerId='" + providerId + '\'' +
                ", state=" + current.status() +
                ", failures=" + current.consecutiveFailures() +
                ", trips=" + current.tripCount() +
                '}';
    }
}
