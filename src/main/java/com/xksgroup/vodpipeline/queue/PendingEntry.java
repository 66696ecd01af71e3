package com.xksgroup.vodpipeline.queue;

import lombok.Value;

import java.time.Duration;

/**
 * Delivered but unacknowledged entry, as seen by crash recovery.
 */
@Value
public class PendingEntry {
    String entryId;
    String consumerOwner;
    Duration idleTime;
    long deliveryCount;
}
