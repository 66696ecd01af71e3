package com.xksgroup.vodpipeline.exception;

public class ObjectStoreException extends VideoProcessingException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
