package com.xksgroup.vodpipeline.exception;

/**
 * A queue entry that can never be decoded into a job.
 */
public class MalformedJobException extends Exception {

    private final String entryId;

    public MalformedJobException(String entryId, String message) {
        super(message);
        this.entryId = entryId;
    }

    public MalformedJobException(String entryId, String message, Throwable cause) {
        super(message, cause);
        this.entryId = entryId;
    }

    public String getEntryId() {
        return entryId;
    }
}
