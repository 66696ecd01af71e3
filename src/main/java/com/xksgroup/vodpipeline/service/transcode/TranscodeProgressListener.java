package com.xksgroup.vodpipeline.service.transcode;

/**
 * Raw progress ticks from a running transcode. Called from the transcoder's output reader thread.
 */
@FunctionalInterface
public interface TranscodeProgressListener {

    TranscodeProgressListener NONE = (percentage, currentTime, totalTime) -> { };

    void onProgress(int percentage, double currentTime, double totalTime);
}
