package com.xksgroup.vodpipeline.model.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.xksgroup.vodpipeline.model.VideoStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEvent {

    @JsonProperty("job_id")
    String jobId;

    VideoStatus status;

    @JsonProperty("current_stage_index")
    Integer currentStageIndex;

    @JsonProperty("total_stages")
    Integer totalStages;

    // Height of the rendition being produced
    @JsonProperty("current_rendition")
    Integer currentRendition;

    int percent;

    String message;

    Instant timestamp;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
