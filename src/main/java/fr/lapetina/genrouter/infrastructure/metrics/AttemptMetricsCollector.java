package fr.lapetina.genrouter.infrastructure.metrics;

import fr.lapetina.genrouter.domain.model.AttemptRecord;
import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounded in-memory store of provider attempts.
 *
 * Appends are lock-free. Retention is both a record cap and a time window;
 * the oldest records are dropped on append and on read. Aggregation is a fold
 * over whatever is retained when {@link #getMetrics()} is called.
 * Every record is also forwarded to the Micrometer registry when one is wired.
 *
 * Request-level totals are plain counters kept since the last {@link #clear()}.
 */
public final class AttemptMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(AttemptMetricsCollector.class);

    public static final int DEFAULT_MAX_RECORDS = 10_000;
    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final ConcurrentLinkedDeque<AttemptRecord> records = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger(0);
    private final int maxRecords;
    private final Duration retention;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;

    private final LongAdder requests = new LongAdder();
    private final LongAdder successfulRequests = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder fallbacks = new LongAdder();
    private final Map<FailureKind, LongAdder> requestFailures = new ConcurrentHashMap<>();

    public AttemptMetricsCollector(int maxRecords, Duration retention, Clock clock, MetricsRegistry metricsRegistry) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be at least 1");
        }
        this.maxRecords = maxRecords;
        this.retention = retention;
        this.clock = clock;
        this.metricsRegistry = metricsRegistry;
    }

    public AttemptMetricsCollector(int maxRecords, Duration retention, Clock clock) {
        this(maxRecords, retention, clock, null);
    }

    public AttemptMetricsCollector() {
        this(DEFAULT_MAX_RECORDS, DEFAULT_RETENTION, Clock.systemUTC(), null);
    }

    public void record(AttemptRecord attempt) {
        records.addLast(attempt);
        size.incrementAndGet();
        while (size.get() > maxRecords && records.pollFirst() != null) {
            size.decrementAndGet();
        }
        pruneExpired();

        if (metricsRegistry != null) {
            metricsRegistry.recordAttempt(attempt);
        }
        log.debug("Attempt recorded: correlationId={}, provider={}, index={}, outcome={}, kind={}, latencyMs={}",
                attempt.correlationId(), attempt.providerId(), attempt.attemptIndex(),
                attempt.outcome(), attempt.failureKind(), attempt.latency().toMillis());
    }

    /**
     * Counts one request returned to its caller.
     *
     * @param servedByFallback whether the success came from a candidate other than the first
     */
    public void recordRequest(OrchestrationResult result, boolean servedByFallback) {
        requests.increment();
        if (result.isSuccess()) {
            successfulRequests.increment();
            if (result.fromCache()) {
                cacheHits.increment();
            } else if (servedByFallback) {
                fallbacks.increment();
            }
        } else {
            requestFailures.computeIfAbsent(result.failureKind(), k -> new LongAdder()).increment();
        }

        if (metricsRegistry != null) {
            metricsRegistry.recordRequest(result, servedByFallback);
        }
    }

    public RequestStats getRequestStats() {
        Map<FailureKind, Long> failuresByKind = new EnumMap<>(FailureKind.class);
        requestFailures.forEach((kind, count) -> failuresByKind.put(kind, count.sum()));
        return RequestStats.of(requests.sum(), successfulRequests.sum(), failuresByKind,
                cacheHits.sum(), fallbacks.sum());
    }

    public MetricsSummary getMetrics() {
        pruneAllExpired();
        Instant cutoff = clock.instant().minus(retention);
        List<AttemptRecord> retained = new ArrayList<>();
        for (AttemptRecord attempt : records) {
            if (!attempt.timestamp().isBefore(cutoff)) {
                retained.add(attempt);
            }
        }

        Map<String, List<AttemptRecord>> byProvider = new HashMap<>();
        Map<String, Long> byTier = new TreeMap<>();
        long fallbackSuccesses = 0;
        Instant windowStart = null;

        for (AttemptRecord attempt : retained) {
            byProvider.computeIfAbsent(attempt.providerId(), k -> new ArrayList<>()).add(attempt);
            if (attempt.tier() != null) {
                byTier.merge(attempt.tier(), 1L, Long::sum);
            }
            if (attempt.isSuccess() && attempt.isFallback()) {
                fallbackSuccesses++;
            }
            if (windowStart == null || attempt.timestamp().isBefore(windowStart)) {
                windowStart = attempt.timestamp();
            }
        }

        Map<String, ProviderStats> providerStats = new TreeMap<>();
        byProvider.forEach((id, attempts) -> providerStats.put(id, aggregate(id, attempts)));

        return new MetricsSummary(
                aggregate("total", retained),
                providerStats,
                byTier,
                fallbackSuccesses,
                windowStart,
                clock.instant(),
                getRequestStats()
        );
    }

    /**
     * Retained records, oldest first.
     */
    public List<AttemptRecord> getRecords() {
        pruneAllExpired();
        Instant cutoff = clock.instant().minus(retention);
        return records.stream()
                .filter(attempt -> !attempt.timestamp().isBefore(cutoff))
                .toList();
    }

    public void clear() {
        int cleared = 0;
        while (records.pollFirst() != null) {
            size.decrementAndGet();
            cleared++;
        }
        requests.reset();
        successfulRequests.reset();
        cacheHits.reset();
        fallbacks.reset();
        requestFailures.clear();
        log.info("Attempt metrics cleared: records={}", cleared);
    }

    public int size() {
        return Math.max(0, size.get());
    }

    private void pruneExpired() {
        Instant cutoff = clock.instant().minus(retention);
        AttemptRecord head;
        while ((head = records.peekFirst()) != null && head.timestamp().isBefore(cutoff)) {
            if (records.remove(head)) {
                size.decrementAndGet();
            }
        }
    }

    /**
     * Records are appended when an attempt ends but stamped when it starts, so the deque is
     * only roughly ordered and expired records can sit behind a newer head.
     */
    private void pruneAllExpired() {
        pruneExpired();
        Instant cutoff = clock.instant().minus(retention);
        for (AttemptRecord attempt : records) {
            if (attempt.timestamp().isBefore(cutoff) && records.remove(attempt)) {
                size.decrementAndGet();
            }
        }
    }

    private static ProviderStats aggregate(String id, List<AttemptRecord> attempts) {
        if (attempts.isEmpty()) {
            return ProviderStats.empty(id);
        }
        long successes = 0;
        long billedUnits = 0;
        long totalLatency = 0;
        Map<FailureKind, Long> failuresByKind = new EnumMap<>(FailureKind.class);
        long[] latencies = new long[attempts.size()];

        for (int i = 0; i < attempts.size(); i++) {
            AttemptRecord attempt = attempts.get(i);
            long latencyMs = attempt.latency().toMillis();
            latencies[i] = latencyMs;
            totalLatency += latencyMs;
            if (attempt.isSuccess()) {
                successes++;
                billedUnits += attempt.billedUnits();
            } else {
                failuresByKind.merge(attempt.failureKind(), 1L, Long::sum);
            }
        }
        Arrays.sort(latencies);

        return new ProviderStats(
                id,
                attempts.size(),
                successes,
                attempts.size() - successes,
                failuresByKind,
                (double) totalLatency / attempts.size(),
                nearestRank(latencies, 50),
                nearestRank(latencies, 95),
                nearestRank(latencies, 99),
                billedUnits
        );
    }

    static long nearestRank(long[] sorted, int percentile) {
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length, rank) - 1)];
    }
}
