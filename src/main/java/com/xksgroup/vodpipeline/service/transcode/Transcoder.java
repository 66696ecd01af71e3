package com.xksgroup.vodpipeline.service.transcode;

import com.xksgroup.vodpipeline.exception.ProbeException;
import com.xksgroup.vodpipeline.exception.TranscodeException;

public interface Transcoder {

    MediaProbe probe(String sourceLocation) throws ProbeException, InterruptedException;

    /**
     * Produce one HLS rendition (variant playlist plus segments) for the source. Raw progress
     * is reported to {@code listener} while the transcode runs; a listener failure never fails
     * the transcode.
     */
    TranscodeOutput transcode(String jobId, String sourceLocation, RenditionSpec spec,
                              TranscodeProgressListener listener) throws TranscodeException, InterruptedException;
}
