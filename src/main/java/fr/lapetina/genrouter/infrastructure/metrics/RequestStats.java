package fr.lapetina.genrouter.infrastructure.metrics;

import fr.lapetina.genrouter.domain.model.FailureKind;

import java.util.Map;

/**
 * Request-level totals since the last clear: one entry per request returned to a caller,
 * whether it was generated, served from the idempotency cache or failed.
 *
 * @param fallbacks    successes served by a candidate other than the first
 * @param cacheHitRate cache hits over requests
 * @param fallbackRate fallbacks over requests
 */
public record RequestStats(
        long requests,
        long successes,
        long failures,
        Map<FailureKind, Long> failuresByKind,
        long cacheHits,
        long fallbacks,
        double cacheHitRate,
        double fallbackRate
) {
    public RequestStats {
        failuresByKind = failuresByKind != null ? Map.copyOf(failuresByKind) : Map.of();
    }

    public static RequestStats of(long requests, long successes, Map<FailureKind, Long> failuresByKind,
                                  long cacheHits, long fallbacks) {
        return new RequestStats(
                requests,
                successes,
                requests - successes,
                failuresByKind,
                cacheHits,
                fallbacks,
                rate(cacheHits, requests),
                rate(fallbacks, requests)
        );
    }

    private static double rate(long count, long requests) {
        return requests == 0 ? 0.0 : (double) count / requests;
    }
}
