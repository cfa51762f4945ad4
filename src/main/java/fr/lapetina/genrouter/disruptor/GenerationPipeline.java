package fr.lapetina.genrouter.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.genrouter.disruptor.exception.BackpressureException;
import fr.lapetina.genrouter.disruptor.handlers.AdmissionHandler;
import fr.lapetina.genrouter.disruptor.handlers.CompletionHandler;
import fr.lapetina.genrouter.disruptor.handlers.DispatchHandler;
import fr.lapetina.genrouter.disruptor.handlers.MetricsHandler;
import fr.lapetina.genrouter.disruptor.handlers.ValidationHandler;
import fr.lapetina.genrouter.domain.event.GenerationRequestEvent;
import fr.lapetina.genrouter.domain.event.GenerationRequestEventFactory;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import fr.lapetina.genrouter.infrastructure.config.RouterConfig;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.genrouter.orchestrator.Orchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submission pipeline in front of the {@link Orchestrator}.
 *
 * Callers on any thread publish into a pre-allocated ring buffer (MULTI producer);
 * a full ring buffer is reported immediately as a {@link BackpressureException}
 * instead of queueing without bound. Events then flow through
 * validation, admission, dispatch, metrics and completion, in that order.
 *
 * Handlers never block on a provider: dispatch hands the request to the
 * orchestrator's workers and the caller's future completes from there.
 */
public final class GenerationPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);

    private final Disruptor<GenerationRequestEvent> disruptor;
    private final RingBuffer<GenerationRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final MetricsRegistry metricsRegistry;

    private final AdmissionHandler admissionHandler;

    private GenerationPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new GenerationRequestEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("pipeline-handler"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        ValidationHandler validationHandler = new ValidationHandler(builder.registry, builder.maxPromptLength);
        this.admissionHandler = new AdmissionHandler(builder.maxGlobalInFlight, builder.metricsRegistry);
        DispatchHandler dispatchHandler = new DispatchHandler(builder.orchestrator, admissionHandler);
        MetricsHandler metricsHandler = new MetricsHandler(builder.metricsRegistry);
        CompletionHandler completionHandler = new CompletionHandler();

        disruptor
                .handleEventsWith(validationHandler)
                .then(admissionHandler)
                .then(dispatchHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler(admissionHandler));

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("GenerationPipeline created: ringBufferSize={}, waitStrategy={}, maxGlobalInFlight={}",
                builder.ringBufferSize, builder.waitStrategy, builder.maxGlobalInFlight);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("GenerationPipeline started");
        }
    }

    /**
     * Submits a request for routing.
     *
     * @return future completing with the orchestration result; rejections by the
     *         pipeline itself complete it with an {@code INVALID_REQUEST} or
     *         {@code CAPACITY_EXCEEDED} result
     * @throws BackpressureException if the ring buffer is full
     */
    public CompletableFuture<OrchestrationResult> submit(GenerationRequest request) {
        Objects.requireNonNull(request, "Request is required");
        if (!running.get()) {
            CompletableFuture<OrchestrationResult> future = new CompletableFuture<>();
            future.completeExceptionally(new IllegalStateException("Pipeline not running"));
            return future;
        }

        CompletableFuture<OrchestrationResult> resultFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            ringBuffer.get(sequence).initialize(request, resultFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        }
        log.debug("Request submitted: requestId={}, sequence={}", request.requestId(), sequence);

        return resultFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getGlobalInFlight() {
        return admissionHandler.getGlobalInFlight();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops accepting requests and drains what is already in the ring buffer.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down GenerationPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("GenerationPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("GenerationPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Fails the caller's future when a handler throws, so no submitter waits forever.
     */
    private static class PipelineExceptionHandler implements ExceptionHandler<GenerationRequestEvent> {

        private final AdmissionHandler admissionHandler;

        PipelineExceptionHandler(AdmissionHandler admissionHandler) {
            this.admissionHandler = admissionHandler;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, GenerationRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            CompletableFuture<OrchestrationResult> future = event.getResultFuture();
            if (future != null && !future.isDone()) {
                future.completeExceptionally(ex);
                if (event.isSlotHeld() && event.getDispatchedAt() == null) {
                    admissionHandler.release();
                }
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during pipeline shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxGlobalInFlight = 1000;
        private int maxPromptLength = 100_000;
        private ProviderRegistry registry;
        private Orchestrator orchestrator;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxGlobalInFlight(int max) {
            this.maxGlobalInFlight = max;
            return this;
        }

        public Builder maxPromptLength(int maxLength) {
            this.maxPromptLength = maxLength;
            return this;
        }

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder orchestrator(Orchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder fromConfig(RouterConfig config) {
            RouterConfig.PipelineConfig pipeline = config.getPipeline();
            ringBufferSize(pipeline.getRingBufferSize());
            this.waitStrategy = pipeline.getWaitStrategy();
            this.maxGlobalInFlight = pipeline.getMaxGlobalInFlight();
            this.maxPromptLength = pipeline.getMaxPromptLength();
            return this;
        }

        public GenerationPipeline build() {
            if (registry == null) {
                throw new IllegalStateException("ProviderRegistry is required");
            }
            if (orchestrator == null) {
                throw new IllegalStateException("Orchestrator is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new GenerationPipeline(this);
        }
    }
}
