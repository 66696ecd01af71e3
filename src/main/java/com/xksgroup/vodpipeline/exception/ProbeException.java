package com.xksgroup.vodpipeline.exception;

public class ProbeException extends VideoProcessingException {

    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
