package com.xksgroup.vodpipeline.service.worker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class WorkerSettings {

    @Builder.Default
    String group = "video-workers";

    // Unique per process, defaults to the host name
    String consumerName;

    @Builder.Default
    Duration readBlock = Duration.ofSeconds(5);

    @Builder.Default
    Duration readErrorBackoff = Duration.ofSeconds(2);

    @Builder.Default
    Duration jobTimeout = Duration.ofHours(2);

    // How long a timed-out run gets to stop after it is interrupted
    @Builder.Default
    Duration cancelGrace = Duration.ofSeconds(30);

    // Zero claims everything pending at startup
    @Builder.Default
    Duration recoveryMinIdle = Duration.ZERO;

    @Builder.Default
    Duration shutdownGrace = Duration.ofMinutes(5);

    @Builder.Default
    boolean autoStartup = true;
}
