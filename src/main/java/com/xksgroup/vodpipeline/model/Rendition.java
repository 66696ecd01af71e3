package com.xksgroup.vodpipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "renditions")
public class Rendition {

    @Id
    private String id;

    @Indexed
    private String videoId;       // owning VideoAsset

    private String label;         // e.g. 720p
    private int height;
    private int width;

    private String artifactLocation;  // variant playlist key in object storage
    private String artifactUrl;       // presigned playlist URL

    private int segmentCount;
    private long sizeBytes;
    private int bandwidthEstimate;

    private Instant processedAt;

    /**
     * Renditions are keyed by owner and label so a redelivered job overwrites its earlier rows.
     */
    public static String idFor(String videoId, String label) {
        return videoId + ":" + label;
    }
}
