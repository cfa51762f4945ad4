package fr.lapetina.genrouter.domain.model;

/**
 * Circuit-breaker state of a provider.
 *
 * CLOSED: provider attempted normally
 * OPEN: provider excluded until its cooldown ends
 * HALF_OPEN: cooldown over, one trial attempt decides whether it recovers
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
