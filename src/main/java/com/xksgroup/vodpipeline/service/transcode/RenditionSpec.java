package com.xksgroup.vodpipeline.service.transcode;

import lombok.Builder;
import lombok.Value;

/**
 * One rung of the ladder as handed to the transcoder.
 */
@Value
@Builder(toBuilder = true)
public class RenditionSpec {
    String label;
    int height;
    int width;
    int bandwidthEstimate;
    int audioBitrateKbps;
    boolean includeAudio;
}
