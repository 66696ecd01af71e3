package com.xksgroup.vodpipeline.service;

import com.xksgroup.vodpipeline.exception.PersistenceException;
import com.xksgroup.vodpipeline.exception.QueueUnavailableException;
import com.xksgroup.vodpipeline.model.VideoStatus;
import com.xksgroup.vodpipeline.model.dto.SubmitVideoRequest;
import com.xksgroup.vodpipeline.model.dto.SubmitVideoResponse;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import com.xksgroup.vodpipeline.queue.JobQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Producer side: records the asset, then appends its job to the queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VideoSubmissionService {

    public static final String QUEUED = "queued";

    private final VideoMetadataStore metadataStore;
    private final JobQueue jobQueue;
    private final ProgressBus progressBus;
    private final Clock clock;

    public SubmitVideoResponse submit(SubmitVideoRequest request) {
        String jobId = UUID.randomUUID().toString();
        String originalName = request.getOriginalName() != null ? request.getOriginalName() : "";
        VideoJob job = VideoJob.builder()
                .jobId(jobId)
                .sourceLocation(request.getSourceLocation().trim())
                .originalName(originalName)
                .build();

        metadataStore.createAsset(job, request.getFileSize() != null ? request.getFileSize() : 0L);

        String entryId;
        try {
            entryId = jobQueue.append(job);
        } catch (QueueUnavailableException e) {
            log.error("Failed to enqueue job {}: {}", jobId, e.getMessage());
            try {
                metadataStore.markFailed(jobId, "Failed to enqueue job");
            } catch (PersistenceException | IllegalStateException pe) {
                log.warn("Could not mark asset {} failed: {}", jobId, pe.getMessage());
            }
            throw e;
        }

        progressBus.publish(ProgressEvent.builder()
                .jobId(jobId)
                .status(VideoStatus.WAITING)
                .percent(0)
                .message("Queued for processing")
                .timestamp(clock.instant())
                .build());

        log.info("Submitted job {} for '{}' as entry {}", jobId, originalName, entryId);
        return SubmitVideoResponse.builder()
                .id(jobId)
                .status(QUEUED)
                .entryId(entryId)
                .build();
    }
}
