package com.xksgroup.vodpipeline.model.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Queue payload. Immutable once enqueued.
 */
@Value
@Builder
@Jacksonized
public class VideoJob {

    @JsonProperty("job_id")
    String jobId;

    @JsonProperty("source_location")
    String sourceLocation;

    @JsonProperty("original_name")
    String originalName;
}
