package fr.lapetina.genrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.genrouter.domain.event.EventState;
import fr.lapetina.genrouter.domain.event.GenerationRequestEvent;
import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import fr.lapetina.genrouter.orchestrator.Orchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Third stage handler: hands admitted requests to the orchestrator.
 *
 * The orchestration runs on the orchestrator's workers; this handler only wires
 * its future to the caller's. Requests stopped by an earlier stage are completed
 * here with a rejection result.
 */
public final class DispatchHandler implements EventHandler<GenerationRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final Orchestrator orchestrator;
    private final AdmissionHandler admissionHandler;

    public DispatchHandler(Orchestrator orchestrator, AdmissionHandler admissionHandler) {
        this.orchestrator = orchestrator;
        this.admissionHandler = admissionHandler;
    }

    @Override
    public void onEvent(GenerationRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.ADMITTED) {
            reject(event);
            return;
        }
        dispatch(event);
    }

    private void dispatch(GenerationRequestEvent event) {
        // The event is recycled by the last handler; callbacks only see these locals
        GenerationRequest request = event.getRequest();
        CompletableFuture<OrchestrationResult> callerFuture = event.getResultFuture();
        event.markDispatched();

        log.debug("Dispatching request: requestId={}, correlationId={}, tier={}, modality={}",
                request.requestId(), request.correlationId(), request.tier(), request.modality());

        CompletableFuture<OrchestrationResult> orchestration;
        try {
            orchestration = orchestrator.executeAsync(request);
        } catch (RuntimeException e) {
            admissionHandler.release();
            throw e;
        }

        orchestration.whenComplete((result, throwable) -> {
            admissionHandler.release();
            if (throwable instanceof CancellationException) {
                callerFuture.complete(OrchestrationResult.rejected(request, FailureKind.CANCELLED, "Request cancelled"));
            } else if (throwable != null) {
                callerFuture.completeExceptionally(throwable);
            } else {
                callerFuture.complete(result);
            }
        });

        // Caller gave up: stop the orchestration too
        callerFuture.whenComplete((result, throwable) -> {
            if (callerFuture.isCancelled()) {
                orchestration.cancel(true);
            }
        });
    }

    private void reject(GenerationRequestEvent event) {
        CompletableFuture<OrchestrationResult> future = event.getResultFuture();
        if (future == null) {
            return;
        }
        GenerationRequest request = event.getRequest();
        if (request == null) {
            future.completeExceptionally(new IllegalArgumentException("Request is null"));
            return;
        }

        if (event.isSlotHeld()) {
            admissionHandler.release();
        }

        if (event.getFailureKind() == null) {
            event.markRejected(FailureKind.INVALID_REQUEST, "Invalid state for dispatch: " + event.getState());
        }
        FailureKind kind = event.getFailureKind();
        String message = event.getErrorMessage();

        log.debug("Completing request before dispatch: requestId={}, kind={}, error={}",
                request.requestId(), kind, message);

        future.complete(OrchestrationResult.rejected(request, kind, message));
    }
}
