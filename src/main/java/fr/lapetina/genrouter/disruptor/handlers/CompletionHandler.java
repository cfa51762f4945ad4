package fr.lapetina.genrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.genrouter.domain.event.EventState;
import fr.lapetina.genrouter.domain.event.GenerationRequestEvent;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: logs what the pipeline did with the request and recycles the event.
 */
public final class CompletionHandler implements EventHandler<GenerationRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(GenerationRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            logSummary(event);
        } finally {
            event.clear();
        }
    }

    private void logSummary(GenerationRequestEvent event) {
        GenerationRequest request = event.getRequest();
        if (request == null) {
            return;
        }
        if (event.getState() == EventState.DISPATCHED) {
            log.debug("Request handed off: requestId={}, tier={}, modality={}, sequence={}",
                    request.requestId(), request.tier(), request.modality(), event.getSequence());
        } else {
            log.info("Request rejected before routing: requestId={}, tier={}, kind={}, error={}",
                    request.requestId(), request.tier(), event.getFailureKind(), event.getErrorMessage());
        }
    }
}
