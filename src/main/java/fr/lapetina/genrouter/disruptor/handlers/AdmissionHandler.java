package fr.lapetina.genrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.genrouter.domain.event.EventState;
import fr.lapetina.genrouter.domain.event.GenerationRequestEvent;
import fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Second stage handler: bounds the number of requests being orchestrated at once.
 *
 * A slot is taken here and given back by {@link #release()} once the orchestration
 * future completes, whichever thread that happens on.
 */
public final class AdmissionHandler implements EventHandler<GenerationRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(AdmissionHandler.class);

    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    private final AtomicInteger globalInFlight = new AtomicInteger(0);
    private final int maxGlobalInFlight;
    private final MetricsRegistry metricsRegistry;
    private volatile boolean capacityWarningLogged = false;

    public AdmissionHandler(int maxGlobalInFlight, MetricsRegistry metricsRegistry) {
        if (maxGlobalInFlight < 1) {
            throw new IllegalArgumentException("maxGlobalInFlight must be at least 1");
        }
        this.maxGlobalInFlight = maxGlobalInFlight;
        this.metricsRegistry = metricsRegistry;
        log.info("AdmissionHandler initialized: maxGlobalInFlight={}", maxGlobalInFlight);
    }

    @Override
    public void onEvent(GenerationRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.VALIDATED) {
            return;
        }

        // Only this handler's thread increments, so check-then-increment cannot overshoot
        int current = globalInFlight.get();
        if (current >= maxGlobalInFlight) {
            event.markCapacityExceeded("Global in-flight limit reached: " + current + "/" + maxGlobalInFlight);
            log.warn("Capacity exceeded: requestId={}, tier={}, globalInFlight={}/{}",
                    event.getRequest().requestId(), event.getRequest().tier(), current, maxGlobalInFlight);
            return;
        }

        checkCapacityThreshold(current);

        int inFlight = globalInFlight.incrementAndGet();
        event.markAdmitted();
        publish(inFlight);

        log.debug("Request admitted: requestId={}, globalInFlight={}/{}",
                event.getRequest().requestId(), inFlight, maxGlobalInFlight);
    }

    private void checkCapacityThreshold(int current) {
        double utilization = (double) current / maxGlobalInFlight;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching global capacity threshold: globalInFlight={}/{} ({}%)",
                    current, maxGlobalInFlight, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            capacityWarningLogged = false;
        }
    }

    /**
     * Gives back one admission slot.
     */
    public void release() {
        int remaining = globalInFlight.updateAndGet(v -> Math.max(0, v - 1));
        publish(remaining);
        log.debug("Admission slot released: globalInFlight={}/{}", remaining, maxGlobalInFlight);
    }

    private void publish(int inFlight) {
        if (metricsRegistry != null) {
            metricsRegistry.setGlobalInFlight(inFlight);
        }
    }

    public int getGlobalInFlight() {
        return globalInFlight.get();
    }

    public int getMaxGlobalInFlight() {
        return maxGlobalInFlight;
    }
}
