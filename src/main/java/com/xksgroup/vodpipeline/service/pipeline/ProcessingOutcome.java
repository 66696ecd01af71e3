package com.xksgroup.vodpipeline.service.pipeline;

public enum ProcessingOutcome {
    COMPLETED,
    FAILED,
    // Redelivered entry whose asset was already completed; nothing was redone
    ALREADY_COMPLETED;

    /**
     * Whether the queue entry that produced this outcome may be acknowledged.
     */
    public boolean isAckable() {
        return this != FAILED;
    }
}
