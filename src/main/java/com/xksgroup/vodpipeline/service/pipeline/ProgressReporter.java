package com.xksgroup.vodpipeline.service.pipeline;

import com.xksgroup.vodpipeline.model.VideoStatus;
import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Publishes the progress of one job. Percent values never go down, whichever thread reports.
 */
@Slf4j
class ProgressReporter {

    private final String jobId;
    private final ProgressBus progressBus;
    private final Clock clock;

    private int lastPercent;
    private Integer stageIndex;
    private Integer totalStages;
    private Integer rendition;
    private String stageMessage;

    ProgressReporter(String jobId, ProgressBus progressBus, Clock clock) {
        this.jobId = jobId;
        this.progressBus = progressBus;
        this.clock = clock;
    }

    synchronized void processing(int percent, String message) {
        publish(VideoStatus.PROCESSING, percent, message);
    }

    synchronized void stage(int percent, Integer stageIndex, Integer totalStages, Integer rendition, String message) {
        this.stageIndex = stageIndex;
        this.totalStages = totalStages;
        this.rendition = rendition;
        this.stageMessage = message;
        publish(VideoStatus.PROCESSING, percent, message);
    }

    /**
     * Intermediate tick inside the current stage. Dropped unless it moves the percent forward.
     */
    synchronized void tick(int percent) {
        if (percent <= lastPercent) {
            return;
        }
        publish(VideoStatus.PROCESSING, percent, stageMessage);
    }

    synchronized void completed(String message) {
        publish(VideoStatus.COMPLETED, 100, message);
    }

    synchronized void failed(String message) {
        publish(VideoStatus.FAILED, lastPercent, message);
    }

    private void publish(VideoStatus status, int percent, String message) {
        lastPercent = Math.max(lastPercent, Math.min(100, percent));
        ProgressEvent event = ProgressEvent.builder()
                .jobId(jobId)
                .status(status)
                .currentStageIndex(stageIndex)
                .totalStages(totalStages)
                .currentRendition(rendition)
                .percent(lastPercent)
                .message(message)
                .timestamp(clock.instant())
                .build();
        try {
            progressBus.publish(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish progress for job {}: {}", jobId, e.getMessage());
        }
    }
}
