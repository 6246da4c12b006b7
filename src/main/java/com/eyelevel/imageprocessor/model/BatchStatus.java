package com.eyelevel.imageprocessor.model;

/**
 * Lifecycle states of a batch as tracked in the record store.
 */
public enum BatchStatus {
    /**
     * The orchestrator has started the batch and is working through its stages.
     */
    PROCESSING,
    /**
     * Every stage finished. A package exists unless every image was rejected.
     */
    COMPLETED,
    /**
     * The source yielded no valid images; nothing was packaged.
     */
    EMPTY,
    /**
     * A stage failed and the batch was aborted.
     */
    FAILED
}
