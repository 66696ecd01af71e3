package com.xksgroup.vodpipeline.exception;

public class TranscodeException extends VideoProcessingException {

    public TranscodeException(String message) {
        super(message);
    }

    public TranscodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
