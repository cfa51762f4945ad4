package fr.lapetina.genrouter.domain.event;

import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 * The orchestration itself runs off the handler threads, so nothing that completes
 * asynchronously may keep a reference to the event: it is cleared by the last handler.
 */
public final class GenerationRequestEvent {

    private GenerationRequest request;

    private EventState state;
    private FailureKind failureKind;
    private String errorMessage;
    private boolean slotHeld;

    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant admittedAt;
    private Instant dispatchedAt;

    private CompletableFuture<OrchestrationResult> resultFuture;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.state = null;
        this.failureKind = null;
        this.errorMessage = null;
        this.slotHeld = false;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.admittedAt = null;
        this.dispatchedAt = null;
        this.resultFuture = null;
        this.sequence = -1;
    }

    public void initialize(GenerationRequest request, CompletableFuture<OrchestrationResult> resultFuture) {
        clear();
        this.request = request;
        this.resultFuture = resultFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public GenerationRequest getRequest() {
        return request;
    }

    public EventState getState() {
        return state;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isSlotHeld() {
        return slotHeld;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getAdmittedAt() {
        return admittedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public CompletableFuture<OrchestrationResult> getResultFuture() {
        return resultFuture;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markValidationFailed(String message) {
        this.state = EventState.VALIDATION_FAILED;
        this.failureKind = FailureKind.INVALID_REQUEST;
        this.errorMessage = message;
    }

    public void markAdmitted() {
        this.state = EventState.ADMITTED;
        this.slotHeld = true;
        this.admittedAt = Instant.now();
    }

    public void markCapacityExceeded(String message) {
        this.state = EventState.CAPACITY_EXCEEDED;
        this.failureKind = FailureKind.CAPACITY_EXCEEDED;
        this.errorMessage = message;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = Instant.now();
    }

    public void markRejected(FailureKind kind, String message) {
        this.state = EventState.REJECTED;
        this.failureKind = kind;
        this.errorMessage = message;
    }

    /**
     * Checks if processing should skip the remaining routing stages.
     */
    public boolean shouldSkip() {
        return state == EventState.VALIDATION_FAILED
                || state == EventState.CAPACITY_EXCEEDED
                || state == EventState.REJECTED;
    }

    @Override
    public String toString() {
        return "GenerationRequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", failureKind=" + failureKind +
                ", seq=" + sequence +
                '}';
    }
}
