package fr.lapetina.genrouter.domain.model;

/**
 * Failure taxonomy for generation requests.
 *
 * Per-attempt kinds are recovered locally by falling through to the next
 * candidate and only ever reach the caller inside a terminal failure's
 * attempt list. Terminal kinds are what the caller sees.
 */
public enum FailureKind {
    /** Provider not configured or not usable for the request; never attempted */
    PROVIDER_UNAVAILABLE(false),

    /** Provider did not answer within its attempt timeout */
    PROVIDER_TIMEOUT(false),

    /** Provider signalled a rate limit or quota exhaustion */
    PROVIDER_RATE_LIMITED(false),

    /** Provider explicitly rejected the request or failed server-side */
    PROVIDER_ERROR(false),

    /** No provider qualified for the request; nothing was attempted */
    NO_ELIGIBLE_PROVIDER(true),

    /** Every candidate was attempted and failed */
    ALL_PROVIDERS_EXHAUSTED(true),

    /** Caller cancelled or its deadline passed; not held against any provider */
    CANCELLED(true),

    /** Request rejected by the submission pipeline before routing */
    INVALID_REQUEST(true),

    /** Submission pipeline at its in-flight limit */
    CAPACITY_EXCEEDED(true);

    private final boolean terminal;

    FailureKind(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Whether this kind, observed on an attempt, counts against the provider's health.
     */
    public boolean countsAgainstProvider() {
        return this == PROVIDER_TIMEOUT
                || this == PROVIDER_RATE_LIMITED
                || this == PROVIDER_ERROR;
    }
}
