package fr.lapetina.genrouter.domain.event;

/**
 * Lifecycle state of a generation request event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just created, awaiting validation */
    CREATED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed */
    VALIDATION_FAILED,

    /** Global in-flight slot taken */
    ADMITTED,

    /** Global in-flight limit reached */
    CAPACITY_EXCEEDED,

    /** Handed to the orchestrator */
    DISPATCHED,

    /** Completed without being dispatched */
    REJECTED
}
