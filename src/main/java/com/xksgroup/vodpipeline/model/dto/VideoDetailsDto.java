package com.xksgroup.vodpipeline.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.xksgroup.vodpipeline.model.Rendition;
import com.xksgroup.vodpipeline.model.VideoAsset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Asset with its renditions, as returned by the API
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VideoDetailsDto {

    private String id;
    @JsonProperty("original_name")
    private String originalName;
    private String status;
    private Integer width;
    private Integer height;
    private Double duration;
    @JsonProperty("file_size")
    private Long fileSize;
    @JsonProperty("error_message")
    private String errorMessage;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;
    @JsonProperty("completed_at")
    private Instant completedAt;
    @JsonProperty("master_manifest_url")
    private String masterManifestUrl;

    private List<RenditionDto> renditions;

    public static VideoDetailsDto fromAsset(VideoAsset asset) {
        return fromAsset(asset, null);
    }

    public static VideoDetailsDto fromAsset(VideoAsset asset, List<Rendition> renditions) {
        return VideoDetailsDto.builder()
                .id(asset.getId())
                .originalName(asset.getOriginalName())
                .status(asset.getStatus() != null ? asset.getStatus().wireName() : null)
                .width(asset.getSourceWidth() > 0 ? asset.getSourceWidth() : null)
                .height(asset.getSourceHeight() > 0 ? asset.getSourceHeight() : null)
                .duration(asset.getDurationSeconds() > 0 ? asset.getDurationSeconds() : null)
                .fileSize(asset.getFileSize() > 0 ? asset.getFileSize() : null)
                .errorMessage(asset.getErrorMessage())
                .createdAt(asset.getCreatedAt())
                .updatedAt(asset.getUpdatedAt())
                .completedAt(asset.getCompletedAt())
                .masterManifestUrl(asset.getMasterManifestUrl())
                .renditions(renditions == null ? null : renditions.stream()
                        .map(RenditionDto::fromRendition)
                        .collect(Collectors.toList()))
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RenditionDto {
        private String label;
        private int width;
        private int height;
        private int bandwidth;
        @JsonProperty("segment_count")
        private int segmentCount;
        @JsonProperty("size_bytes")
        private long sizeBytes;
        @JsonProperty("playlist_url")
        private String playlistUrl;

        static RenditionDto fromRendition(Rendition rendition) {
            return RenditionDto.builder()
                    .label(rendition.getLabel())
                    .width(rendition.getWidth())
                    .height(rendition.getHeight())
                    .bandwidth(rendition.getBandwidthEstimate())
                    .segmentCount(rendition.getSegmentCount())
                    .sizeBytes(rendition.getSizeBytes())
                    .playlistUrl(rendition.getArtifactUrl())
                    .build();
        }
    }
}
