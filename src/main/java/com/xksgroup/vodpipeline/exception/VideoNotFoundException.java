package com.xksgroup.vodpipeline.exception;

public class VideoNotFoundException extends RuntimeException {

    public VideoNotFoundException(String videoId) {
        super("Video not found: " + videoId);
    }
}
