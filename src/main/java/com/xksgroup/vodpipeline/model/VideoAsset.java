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
@Document(collection = "videos")
public class VideoAsset {

    // Same value as the queue entry's job id
    @Id
    private String id;

    private String originalName;
    private String sourceLocation;

    @Indexed
    private VideoStatus status;

    // Probe results
    private int sourceWidth;
    private int sourceHeight;
    private double durationSeconds;
    private long fileSize;

    // Set only while FAILED
    private String errorMessage;

    @Indexed
    private Instant createdAt;
    private Instant updatedAt;
    // Set only once COMPLETED
    private Instant completedAt;

    private String masterManifestLocation;
    private String masterManifestUrl;
}
