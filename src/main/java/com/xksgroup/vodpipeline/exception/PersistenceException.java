package com.xksgroup.vodpipeline.exception;

/**
 * Metadata store write or read failed. The pipeline treats these as non-fatal.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
