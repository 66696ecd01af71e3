package com.xksgroup.vodpipeline.service.transcode;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MediaProbe {
    int width;
    int height;
    double durationSeconds;
    long bitrate;
    boolean hasAudio;
}
