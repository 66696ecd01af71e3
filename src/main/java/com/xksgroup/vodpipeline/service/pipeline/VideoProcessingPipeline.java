package com.xksgroup.vodpipeline.service.pipeline;

import com.xksgroup.vodpipeline.exception.ObjectStoreException;
import com.xksgroup.vodpipeline.exception.PersistenceException;
import com.xksgroup.vodpipeline.exception.ProbeException;
import com.xksgroup.vodpipeline.exception.VideoProcessingException;
import com.xksgroup.vodpipeline.model.Rendition;
import com.xksgroup.vodpipeline.model.VideoAsset;
import com.xksgroup.vodpipeline.model.VideoStatus;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import com.xksgroup.vodpipeline.service.VideoMetadataStore;
import com.xksgroup.vodpipeline.service.helper.MasterManifestBuilder;
import com.xksgroup.vodpipeline.service.helper.ProgressForwarder;
import com.xksgroup.vodpipeline.service.helper.RenditionLadder;
import com.xksgroup.vodpipeline.service.storage.ObjectStore;
import com.xksgroup.vodpipeline.service.storage.StoredObject;
import com.xksgroup.vodpipeline.service.transcode.MediaProbe;
import com.xksgroup.vodpipeline.service.transcode.RenditionSpec;
import com.xksgroup.vodpipeline.service.transcode.TranscodeOutput;
import com.xksgroup.vodpipeline.service.transcode.Transcoder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Runs one job: probe, transcode every ladder rung to HLS, upload, write the master manifest.
 * Metadata writes are best-effort; a probe, transcode or upload failure fails the job.
 */
@Slf4j
public class VideoProcessingPipeline {

    public static final String PLAYLIST_CONTENT_TYPE = "application/vnd.apple.mpegurl";
    public static final String SEGMENT_CONTENT_TYPE = "video/mp2t";

    static final int LADDER_START_PERCENT = 5;
    static final int LADDER_SPAN_PERCENT = 90;

    private final Transcoder transcoder;
    private final ObjectStore objectStore;
    private final VideoMetadataStore metadataStore;
    private final ProgressBus progressBus;
    private final ExecutorService progressExecutor;
    private final Clock clock;
    private final Duration playbackUrlTtl;

    public VideoProcessingPipeline(Transcoder transcoder, ObjectStore objectStore, VideoMetadataStore metadataStore,
                                   ProgressBus progressBus, ExecutorService progressExecutor, Clock clock,
                                   Duration playbackUrlTtl) {
        this.transcoder = transcoder;
        this.objectStore = objectStore;
        this.metadataStore = metadataStore;
        this.progressBus = progressBus;
        this.progressExecutor = progressExecutor;
        this.clock = clock;
        this.playbackUrlTtl = playbackUrlTtl;
    }

    public ProcessingResult process(VideoJob job) throws InterruptedException {
        String jobId = job.getJobId();
        List<NonFatalFailure> nonFatal = new ArrayList<>();
        ProgressReporter progress = new ProgressReporter(jobId, progressBus, clock);

        if (isAlreadyCompleted(jobId, nonFatal)) {
            log.info("Job {} is already completed, skipping", jobId);
            progress.completed("Processing completed successfully!");
            return ProcessingResult.alreadyCompleted(jobId, nonFatal);
        }

        log.info("Processing job {} from {}", jobId, job.getSourceLocation());
        bestEffort("mark processing", nonFatal, () -> metadataStore.markProcessing(job));
        progress.processing(0, "Starting video processing...");

        MediaProbe probe;
        try {
            probe = transcoder.probe(job.getSourceLocation());
        } catch (ProbeException e) {
            return fail(jobId, progress, "Failed to read video metadata: " + e.getMessage(), nonFatal);
        }
        bestEffort("store probe", nonFatal, () -> metadataStore.updateProbe(jobId, probe));

        List<Integer> ladder = RenditionLadder.select(probe.getHeight());
        int total = ladder.size();
        progress.stage(LADDER_START_PERCENT, null, total, null, "Processing " + total + " resolutions...");

        List<Rendition> renditions = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            checkCancelled(jobId);
            int height = ladder.get(i);
            RenditionSpec spec = specFor(height, probe);
            int stageStart = stagePercent(i, total);
            int stageEnd = stagePercent(i + 1, total);

            progress.stage(stageStart, i + 1, total, height,
                    "Processing " + spec.getLabel() + " (" + (i + 1) + "/" + total + ")...");
            try {
                renditions.add(produceRendition(job, spec, progress, stageStart, stageEnd, nonFatal));
            } catch (VideoProcessingException e) {
                return fail(jobId, progress, "failed to transcode " + spec.getLabel() + ": " + e.getMessage(), nonFatal);
            }
        }

        checkCancelled(jobId);
        String masterKey = jobId + "/processed/master.m3u8";
        String masterUrl;
        try {
            String manifest = MasterManifestBuilder.build(renditions);
            objectStore.put(manifest, masterKey, PLAYLIST_CONTENT_TYPE);
            masterUrl = presign(masterKey, nonFatal);
        } catch (ObjectStoreException e) {
            return fail(jobId, progress, "failed to upload master manifest: " + e.getMessage(), nonFatal);
        }

        bestEffort("store master manifest", nonFatal, () -> metadataStore.updateMasterManifest(jobId, masterKey, masterUrl));
        checkCancelled(jobId);
        bestEffort("mark completed", nonFatal, () -> metadataStore.markCompleted(jobId));
        progress.completed("Processing completed successfully!");

        log.info("Job {} completed with {} renditions ({} non-fatal failures)", jobId, renditions.size(), nonFatal.size());
        return ProcessingResult.completed(jobId, renditions.size(), nonFatal);
    }

    /**
     * Record a job that ran past its time ceiling. The worker calls this once the cancelled run has stopped.
     */
    public ProcessingResult failTimedOut(VideoJob job, Duration ceiling) {
        return failAbnormally(job, "Processing timed out after " + ceiling.toMinutes() + " minutes");
    }

    /**
     * Record a run that ended with an unexpected exception.
     */
    public ProcessingResult failCrashed(VideoJob job, Throwable cause) {
        return failAbnormally(job, "Unexpected processing error: " + cause.getMessage());
    }

    private ProcessingResult failAbnormally(VideoJob job, String message) {
        List<NonFatalFailure> nonFatal = new ArrayList<>();
        ProgressReporter progress = new ProgressReporter(job.getJobId(), progressBus, clock);
        progressBus.getSnapshot(job.getJobId())
                .map(ProgressEvent::getPercent)
                .ifPresent(percent -> progress.processing(percent, "Cancelling..."));
        return fail(job.getJobId(), progress, message, nonFatal);
    }

    static int stagePercent(int index, int total) {
        return LADDER_START_PERCENT + (index * LADDER_SPAN_PERCENT) / total;
    }

    private Rendition produceRendition(VideoJob job, RenditionSpec spec, ProgressReporter progress,
                                       int stageStart, int stageEnd, List<NonFatalFailure> nonFatal)
            throws VideoProcessingException, InterruptedException {
        String jobId = job.getJobId();
        String prefix = jobId + "/processed/" + spec.getLabel() + "/";
        int span = Math.max(0, stageEnd - stageStart - 1);

        try (ProgressForwarder forwarder = new ProgressForwarder(progressExecutor,
                tick -> progress.tick(stageStart + (Math.max(0, Math.min(100, tick)) * span) / 100))) {

            try (TranscodeOutput output = transcoder.transcode(jobId, job.getSourceLocation(), spec, forwarder)) {
                checkCancelled(jobId);
                long sizeBytes = 0;
                for (Path segment : output.getSegments()) {
                    StoredObject stored = objectStore.put(segment, prefix + segment.getFileName(), SEGMENT_CONTENT_TYPE);
                    sizeBytes += stored.getSizeBytes();
                }
                String playlistKey = prefix + MasterManifestBuilder.VARIANT_PLAYLIST_NAME;
                sizeBytes += objectStore.put(output.getPlaylist(), playlistKey, PLAYLIST_CONTENT_TYPE).getSizeBytes();
                String playlistUrl = presign(playlistKey, nonFatal);

                Rendition rendition = Rendition.builder()
                        .id(Rendition.idFor(jobId, spec.getLabel()))
                        .videoId(jobId)
                        .label(spec.getLabel())
                        .height(spec.getHeight())
                        .width(spec.getWidth())
                        .artifactLocation(playlistKey)
                        .artifactUrl(playlistUrl)
                        .segmentCount(output.getSegments().size())
                        .sizeBytes(sizeBytes)
                        .bandwidthEstimate(spec.getBandwidthEstimate())
                        .processedAt(clock.instant())
                        .build();
                bestEffort("save rendition " + spec.getLabel(), nonFatal, () -> metadataStore.saveRendition(rendition));

                log.info("Job {}: {} done ({} segments, {} bytes)", jobId, spec.getLabel(),
                        output.getSegments().size(), sizeBytes);
                return rendition;
            }
        }
    }

    // Stops a cancelled run at the next step boundary, before anything terminal is written
    private static void checkCancelled(String jobId) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Job " + jobId + " was cancelled");
        }
    }

    private RenditionSpec specFor(int height, MediaProbe probe) {
        return RenditionSpec.builder()
                .label(RenditionLadder.labelFor(height))
                .height(height)
                .width(RenditionLadder.widthFor(height, probe.getWidth(), probe.getHeight()))
                .bandwidthEstimate(RenditionLadder.bandwidthFor(height))
                .audioBitrateKbps(RenditionLadder.audioBitrateFor(height))
                .includeAudio(probe.isHasAudio())
                .build();
    }

    private boolean isAlreadyCompleted(String jobId, List<NonFatalFailure> nonFatal) {
        try {
            Optional<VideoAsset> asset = metadataStore.findAsset(jobId);
            return asset.map(a -> a.getStatus() == VideoStatus.COMPLETED).orElse(false);
        } catch (PersistenceException e) {
            record("read asset", e, nonFatal);
            return false;
        }
    }

    // Presign failures leave the URL empty; the key is still recorded
    private String presign(String key, List<NonFatalFailure> nonFatal) {
        try {
            return objectStore.presign(key, playbackUrlTtl);
        } catch (ObjectStoreException e) {
            log.warn("Failed to presign {}: {}", key, e.getMessage());
            nonFatal.add(new NonFatalFailure("presign " + key, e.getMessage()));
            return null;
        }
    }

    private ProcessingResult fail(String jobId, ProgressReporter progress, String message, List<NonFatalFailure> nonFatal) {
        log.error("Job {} failed: {}", jobId, message);
        bestEffort("mark failed", nonFatal, () -> metadataStore.markFailed(jobId, message));
        progress.failed(message);
        return ProcessingResult.failed(jobId, message, nonFatal);
    }

    private static void bestEffort(String operation, List<NonFatalFailure> nonFatal, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            // PersistenceException, or the asset vanished or moved state between steps
            record(operation, e, nonFatal);
        }
    }

    private static void record(String operation, RuntimeException e, List<NonFatalFailure> nonFatal) {
        log.warn("Non-fatal failure during {}: {}", operation, e.getMessage());
        nonFatal.add(new NonFatalFailure(operation, e.getMessage()));
    }
}
