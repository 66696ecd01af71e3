package com.xksgroup.vodpipeline.exception;

/**
 * Job-level failure. The asset is marked failed and the queue entry stays pending.
 */
public class VideoProcessingException extends Exception {

    public VideoProcessingException(String message) {
        super(message);
    }

    public VideoProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
