package com.xksgroup.vodpipeline.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitVideoRequest {

    // Path or URL the transcoder can read
    @NotBlank
    @JsonProperty("source_location")
    private String sourceLocation;

    @Size(max = 512)
    @JsonProperty("original_name")
    private String originalName;

    @PositiveOrZero
    @JsonProperty("file_size")
    private Long fileSize;
}
