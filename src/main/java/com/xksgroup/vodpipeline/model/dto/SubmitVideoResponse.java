package com.xksgroup.vodpipeline.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitVideoResponse {
    private String id;
    private String status;

    @JsonProperty("entry_id")
    private String entryId;
}
