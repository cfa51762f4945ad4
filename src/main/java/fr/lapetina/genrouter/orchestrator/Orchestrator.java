package fr.lapetina.genrouter.orchestrator;

import fr.lapetina.genrouter.domain.model.AttemptFailure;
import fr.lapetina.genrouter.domain.model.AttemptRecord;
import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.GenerationOutput;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.infrastructure.health.Admission;
import fr.lapetina.genrouter.infrastructure.health.HealthTracker;
import fr.lapetina.genrouter.infrastructure.metrics.AttemptMetricsCollector;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genrouter.infrastructure.provider.ProviderAdapter;
import fr.lapetina.genrouter.infrastructure.provider.ProviderException;
import fr.lapetina.genrouter.infrastructure.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes one generation request across its candidate providers.
 *
 * <p>Candidates come from the registry, filtered by provider health; they are attempted
 * one at a time, in order, each at most once and each under
 * {@code min(provider timeout, time left before the request deadline)}. The first success
 * ends the request. Every attempt is recorded in the metrics collector and reported to
 * the health tracker.
 *
 * <p>Interrupting the calling thread, cancelling the future returned by
 * {@link #executeAsync}, or reaching the request deadline ends the request as
 * {@link FailureKind#CANCELLED}: the in-flight provider call is cancelled, held trial
 * slots are released and nothing is held against any provider.
 *
 * <p>Requests sharing a correlation id, tier and modality are deduplicated through the
 * {@link IdempotencyCache}. Every request returned to a caller is counted once in the
 * collector's request totals.
 */
public final class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final ProviderRegistry registry;
    private final HealthTracker healthTracker;
    private final AttemptMetricsCollector metricsCollector;
    private final MetricsRegistry metricsRegistry;
    private final IdempotencyCache idempotencyCache;
    private final Clock clock;
    private final Map<String, ProviderAdapter> adapters = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    private record Candidate(ProviderDescriptor provider, ProviderAdapter adapter, Admission admission) {
    }

    private record Routed(OrchestrationResult result, boolean servedByFallback) {
    }

    private record AttemptOutcome(GenerationOutput output, FailureKind failureKind, String message) {
        static AttemptOutcome success(GenerationOutput output) {
            return new AttemptOutcome(output, null, null);
        }

        static AttemptOutcome failure(FailureKind kind, String message) {
            return new AttemptOutcome(null, kind, message);
        }

        static AttemptOutcome cancelled(String message) {
            return new AttemptOutcome(null, FailureKind.CANCELLED, message);
        }

        boolean isSuccess() {
            return output != null;
        }

        boolean isCancelled() {
            return failureKind == FailureKind.CANCELLED;
        }
    }

    public Orchestrator(
            ProviderRegistry registry,
            HealthTracker healthTracker,
            AttemptMetricsCollector metricsCollector,
            MetricsRegistry metricsRegistry,
            IdempotencyCache idempotencyCache,
            Clock clock
    ) {
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.metricsCollector = metricsCollector;
        this.metricsRegistry = metricsRegistry;
        this.idempotencyCache = idempotencyCache;
        this.clock = clock;

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "orchestrator-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void registerAdapter(ProviderAdapter adapter) {
        ProviderAdapter previous = adapters.put(adapter.providerId(), adapter);
        log.info("Provider adapter registered: providerId={}, replaced={}", adapter.providerId(), previous != null);
    }

    public ProviderAdapter removeAdapter(String providerId) {
        ProviderAdapter removed = adapters.remove(providerId);
        if (removed != null) {
            log.info("Provider adapter removed: providerId={}", providerId);
        }
        return removed;
    }

    public boolean hasAdapter(String providerId) {
        return adapters.containsKey(providerId);
    }

    /**
     * Executes the request on the calling thread and blocks until it ends.
     * Never throws for provider failures; they are reported in the result.
     */
    public OrchestrationResult execute(GenerationRequest request) {
        while (true) {
            CompletableFuture<OrchestrationResult> owner = new CompletableFuture<>();
            CompletableFuture<OrchestrationResult> existing = idempotencyCache.joinOrRegister(request, owner);
            if (existing == null) {
                return executeAsOwner(request, owner);
            }

            log.info("Joining request with same correlation id: requestId={}, correlationId={}",
                    request.requestId(), request.correlationId());
            OrchestrationResult joined;
            try {
                joined = await(request, existing);
            } catch (ExecutionException e) {
                // the owner's entry is already gone; this request proceeds on its own
                log.warn("Joined request failed unexpectedly, running again: requestId={}, correlationId={}",
                        request.requestId(), request.correlationId(), e.getCause());
                continue;
            }
            if (joined == null) {
                return completed(new Routed(cancelled(request, List.of(), Duration.ZERO), false));
            }
            if (joined.failureKind() != FailureKind.CANCELLED) {
                return completed(new Routed(joined.asCached(request.requestId()), false));
            }
            // the owner was cancelled by its own caller; this request proceeds on its own
        }
    }

    /**
     * Executes the request on an orchestrator worker thread.
     * Cancelling the returned future interrupts the worker and ends the request as CANCELLED.
     */
    public CompletableFuture<OrchestrationResult> executeAsync(GenerationRequest request) {
        CompletableFuture<OrchestrationResult> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    result.complete(execute(request));
                } catch (RuntimeException e) {
                    log.error("Orchestration failed unexpectedly: requestId={}", request.requestId(), e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Orchestrator is shut down", e));
            return result;
        }
        result.whenComplete((r, t) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    private OrchestrationResult executeAsOwner(GenerationRequest request, CompletableFuture<OrchestrationResult> owner) {
        Routed routed;
        try {
            routed = run(request);
        } catch (RuntimeException e) {
            idempotencyCache.complete(request, owner, null);
            owner.completeExceptionally(e);
            throw e;
        }
        idempotencyCache.complete(request, owner, routed.result());
        owner.complete(routed.result());
        return completed(routed);
    }

    private OrchestrationResult completed(Routed routed) {
        metricsCollector.recordRequest(routed.result(), routed.servedByFallback());
        return routed.result();
    }

    private OrchestrationResult await(GenerationRequest request, CompletableFuture<OrchestrationResult> existing)
            throws ExecutionException {
        try {
            Duration remaining = request.remaining(clock.instant());
            return remaining == null
                    ? existing.get()
                    : existing.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (TimeoutException e) {
            return null;
        }
    }

    private Routed run(GenerationRequest request) {
        long startNanos = System.nanoTime();
        MDC.put("correlationId", request.correlationId());
        MDC.put("tier", request.tier());
        MDC.put("modality", request.modality().configName());
        try {
            List<Candidate> candidates = buildCandidates(request);
            if (candidates.isEmpty()) {
                log.warn("No eligible provider: requestId={}, tier={}, modality={}",
                        request.requestId(), request.tier(), request.modality());
                return new Routed(terminal(request, OrchestrationResult.failure(request, FailureKind.NO_ELIGIBLE_PROVIDER,
                        "No eligible provider for tier " + request.tier() + " and modality " + request.modality().configName(),
                        List.of(), elapsed(startNanos))), false);
            }

            List<AttemptFailure> failures = new ArrayList<>();
            for (int index = 0; index < candidates.size(); index++) {
                Candidate candidate = candidates.get(index);
                String providerId = candidate.provider().getId();

                if (Thread.currentThread().isInterrupted() || deadlinePassed(request)) {
                    releaseTrials(candidates, index);
                    return new Routed(cancelled(request, failures, elapsed(startNanos)), false);
                }

                log.info("Attempting provider: requestId={}, providerId={}, attempt={}/{}, admission={}",
                        request.requestId(), providerId, index + 1, candidates.size(), candidate.admission());

                Instant attemptStart = clock.instant();
                long attemptStartNanos = System.nanoTime();
                AttemptOutcome outcome = attempt(request, candidate);
                Duration latency = elapsed(attemptStartNanos);

                if (outcome.isCancelled()) {
                    releaseTrials(candidates, index);
                    log.info("Request cancelled during attempt: requestId={}, providerId={}, reason={}",
                            request.requestId(), providerId, outcome.message());
                    return new Routed(cancelled(request, failures, elapsed(startNanos)), false);
                }

                if (outcome.isSuccess()) {
                    GenerationOutput output = outcome.output();
                    metricsCollector.record(AttemptRecord.success(
                            attemptStart, request, index, providerId, latency, output.billedUnits()));
                    healthTracker.recordOutcome(providerId, true, null);
                    releaseTrials(candidates, index + 1);

                    OrchestrationResult result = OrchestrationResult.success(
                            request, candidate.provider(), output, elapsed(startNanos));
                    log.info("Request succeeded: requestId={}, providerId={}, attempt={}, billedUnits={}, cost={}, latencyMs={}",
                            request.requestId(), providerId, index + 1, result.billedUnits(),
                            result.cost().toPlainString(), result.latency().toMillis());
                    return new Routed(result, index > 0);
                }

                FailureKind kind = outcome.failureKind();
                metricsCollector.record(AttemptRecord.failure(attemptStart, request, index, providerId, kind, latency));
                healthTracker.recordOutcome(providerId, false, kind);
                if (candidate.admission() == Admission.TRIAL && !kind.countsAgainstProvider()) {
                    healthTracker.releaseTrial(providerId);
                }
                failures.add(new AttemptFailure(providerId, kind, outcome.message()));

                if (index + 1 < candidates.size()) {
                    log.warn("Provider attempt failed, failing over: requestId={}, providerId={}, kind={}, next={}",
                            request.requestId(), providerId, kind, candidates.get(index + 1).provider().getId());
                }
            }

            log.warn("All providers exhausted: requestId={}, attempts={}", request.requestId(), failures);
            return new Routed(terminal(request, OrchestrationResult.failure(request, FailureKind.ALL_PROVIDERS_EXHAUSTED,
                    "All " + failures.size() + " candidate provider(s) failed", failures, elapsed(startNanos))), false);
        } finally {
            MDC.remove("correlationId");
            MDC.remove("tier");
            MDC.remove("modality");
        }
    }

    private List<Candidate> buildCandidates(GenerationRequest request) {
        Instant now = clock.instant();
        List<Candidate> candidates = new ArrayList<>();
        for (ProviderDescriptor provider : registry.candidatesFor(request.modality(), request.tier())) {
            ProviderAdapter adapter = adapters.get(provider.getId());
            if (adapter == null) {
                log.debug("Skipping provider without adapter: providerId={}", provider.getId());
                continue;
            }
            Admission admission = healthTracker.acquire(provider.getId(), now);
            if (!admission.isAdmitted()) {
                log.debug("Skipping provider with open circuit: providerId={}", provider.getId());
                continue;
            }
            candidates.add(new Candidate(provider, adapter, admission));
        }
        log.debug("Candidates built: requestId={}, candidates={}", request.requestId(),
                candidates.stream().map(c -> c.provider().getId()).toList());
        return candidates;
    }

    private AttemptOutcome attempt(GenerationRequest request, Candidate candidate) {
        Duration timeout = candidate.provider().getTimeout();
        boolean cutByDeadline = false;
        Duration remaining = request.remaining(clock.instant());
        if (remaining != null && remaining.compareTo(timeout) < 0) {
            timeout = remaining;
            cutByDeadline = true;
        }
        if (timeout.isZero()) {
            return AttemptOutcome.cancelled("Deadline reached before attempt");
        }

        CompletableFuture<GenerationOutput> future;
        try {
            future = candidate.adapter().invoke(request.payload(), timeout);
        } catch (RuntimeException e) {
            log.error("Adapter failed to start call: providerId={}", candidate.provider().getId(), e);
            return AttemptOutcome.failure(FailureKind.PROVIDER_ERROR, "Adapter failed: " + e.getClass().getSimpleName());
        }

        try {
            GenerationOutput output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                return AttemptOutcome.failure(FailureKind.PROVIDER_ERROR, "Provider returned no output");
            }
            return AttemptOutcome.success(output);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AttemptOutcome.cancelled("Interrupted");
        } catch (TimeoutException e) {
            future.cancel(true);
            if (cutByDeadline) {
                return AttemptOutcome.cancelled("Deadline reached");
            }
            return AttemptOutcome.failure(FailureKind.PROVIDER_TIMEOUT,
                    "No answer within " + timeout.toMillis() + "ms");
        } catch (CancellationException e) {
            return AttemptOutcome.cancelled("Provider call cancelled");
        } catch (ExecutionException e) {
            AttemptOutcome outcome = classify(e.getCause());
            if (cutByDeadline && !outcome.isCancelled()
                    && (outcome.failureKind() == FailureKind.PROVIDER_TIMEOUT || deadlinePassed(request))) {
                // the budget was the caller's deadline, not the provider's timeout
                return AttemptOutcome.cancelled("Deadline reached");
            }
            return outcome;
        }
    }

    private static AttemptOutcome classify(Throwable cause) {
        if (cause instanceof ProviderException) {
            ProviderException providerException = (ProviderException) cause;
            if (providerException.getKind() == FailureKind.CANCELLED) {
                return AttemptOutcome.cancelled(providerException.getMessage());
            }
            FailureKind kind = providerException.getKind().isTerminal()
                    ? FailureKind.PROVIDER_ERROR
                    : providerException.getKind();
            return AttemptOutcome.failure(kind, providerException.getMessage());
        }
        if (cause instanceof CancellationException) {
            return AttemptOutcome.cancelled("Provider call cancelled");
        }
        return AttemptOutcome.failure(FailureKind.PROVIDER_ERROR,
                "Adapter failed: " + (cause != null ? cause.getClass().getSimpleName() : "unknown"));
    }

    private void releaseTrials(List<Candidate> candidates, int fromIndex) {
        for (int i = fromIndex; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            if (candidate.admission() == Admission.TRIAL) {
                healthTracker.releaseTrial(candidate.provider().getId());
            }
        }
    }

    private boolean deadlinePassed(GenerationRequest request) {
        return request.hasDeadline() && !clock.instant().isBefore(request.deadline());
    }

    private OrchestrationResult cancelled(GenerationRequest request, List<AttemptFailure> failures, Duration latency) {
        return terminal(request, OrchestrationResult.failure(request, FailureKind.CANCELLED,
                "Request cancelled", failures, latency));
    }

    private OrchestrationResult terminal(GenerationRequest request, OrchestrationResult result) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementTerminalFailure(result.failureKind(), request.tier());
        }
        return result;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public IdempotencyCache getIdempotencyCache() {
        return idempotencyCache;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Orchestrator workers did not stop in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
