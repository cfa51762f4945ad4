package fr.lapetina.genrouter.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable health snapshot of one provider.
 * Instances are replaced wholesale by compare-and-swap, never mutated.
 *
 * @param status              circuit state as stored; an OPEN state whose cooldown has
 *                            passed is reported as HALF_OPEN by {@link #effectiveStatus(Instant)}
 * @param consecutiveFailures failures since the last success or reset
 * @param cooldownUntil       end of the current OPEN period, null unless tripped
 * @param tripCount           consecutive trips without recovery; drives the backoff
 * @param trialInFlight       whether the HALF_OPEN trial slot is held by a request
 */
public record HealthState(
        CircuitState status,
        int consecutiveFailures,
        Instant lastFailureAt,
        Instant lastSuccessAt,
        Instant cooldownUntil,
        int tripCount,
        boolean trialInFlight
) {
    public static final HealthState INITIAL =
            new HealthState(CircuitState.CLOSED, 0, null, null, null, 0, false);

    public HealthState {
        Objects.requireNonNull(status, "Status is required");
    }

    public CircuitState effectiveStatus(Instant now) {
        if (status == CircuitState.OPEN && cooldownElapsed(now)) {
            return CircuitState.HALF_OPEN;
        }
        return status;
    }

    public boolean cooldownElapsed(Instant now) {
        return cooldownUntil == null || !now.isBefore(cooldownUntil);
    }

    public HealthState withStatus(CircuitState newStatus) {
        return new HealthState(newStatus, consecutiveFailures, lastFailureAt, lastSuccessAt,
                cooldownUntil, tripCount, trialInFlight);
    }

    public HealthState withTrial(boolean inFlight) {
        return new HealthState(status, consecutiveFailures, lastFailureAt, lastSuccessAt,
                cooldownUntil, tripCount, inFlight);
    }

    /**
     * Success seen while CLOSED or OPEN: clears the failure counter, keeps the state.
     */
    public HealthState withSuccess(Instant now) {
        return new HealthState(status, 0, lastFailureAt, now, cooldownUntil, tripCount, trialInFlight);
    }

    /**
     * Failure seen without a state change.
     */
    public HealthState withFailure(Instant now) {
        return new HealthState(status, consecutiveFailures + 1, now, lastSuccessAt,
                cooldownUntil, tripCount, trialInFlight);
    }

    public HealthState closed(Instant now) {
        return new HealthState(CircuitState.CLOSED, 0, lastFailureAt, now, null, 0, false);
    }

    /**
     * Trips the circuit; {@code until} is computed by the caller from the new trip count.
     */
    public HealthState opened(Instant now, Instant until) {
        return new HealthState(CircuitState.OPEN, consecutiveFailures + 1, now, lastSuccessAt,
                until, tripCount + 1, false);
    }
}
