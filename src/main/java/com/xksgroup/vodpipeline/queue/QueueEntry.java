package com.xksgroup.vodpipeline.queue;

import lombok.Value;

import java.util.Map;

/**
 * One delivered log entry: its id plus the raw wire fields.
 */
@Value
public class QueueEntry {
    String entryId;
    Map<String, String> fields;
}
