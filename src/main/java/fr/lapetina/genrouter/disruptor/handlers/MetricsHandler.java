package fr.lapetina.genrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.genrouter.domain.event.GenerationRequestEvent;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Fourth stage handler: records pipeline counters and stage latencies.
 *
 * Attempt-level metrics are recorded by the orchestrator; this stage only sees
 * what happened before dispatch.
 */
public final class MetricsHandler implements EventHandler<GenerationRequestEvent> {

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(GenerationRequestEvent event, long sequence, boolean endOfBatch) {
        GenerationRequest request = event.getRequest();
        if (request == null || event.getState() == null) {
            return;
        }

        MDC.put("correlationId", request.correlationId());
        MDC.put("tier", request.tier());
        try {
            metricsRegistry.incrementRequestCount(request.tier(), request.modality(), event.getState());
            recordStage("validation", event.getAcceptedAt(), event.getValidatedAt());
            recordStage("admission", event.getValidatedAt(), event.getAdmittedAt());
            recordStage("queue", event.getAcceptedAt(), event.getDispatchedAt());
        } finally {
            MDC.remove("correlationId");
            MDC.remove("tier");
        }
    }

    private void recordStage(String stage, Instant from, Instant to) {
        if (from != null && to != null) {
            metricsRegistry.recordStageLatency(stage, Duration.between(from, to));
        }
    }
}
