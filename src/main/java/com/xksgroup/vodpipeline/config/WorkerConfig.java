package com.xksgroup.vodpipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import com.xksgroup.vodpipeline.queue.JobQueue;
import com.xksgroup.vodpipeline.queue.VideoJobCodec;
import com.xksgroup.vodpipeline.service.VideoMetadataStore;
import com.xksgroup.vodpipeline.service.helper.ProcessHelper;
import com.xksgroup.vodpipeline.service.pipeline.VideoProcessingPipeline;
import com.xksgroup.vodpipeline.service.storage.ObjectStore;
import com.xksgroup.vodpipeline.service.transcode.FFmpegTranscoder;
import com.xksgroup.vodpipeline.service.transcode.FfprobeParser;
import com.xksgroup.vodpipeline.service.transcode.Transcoder;
import com.xksgroup.vodpipeline.service.worker.TranscodeWorker;
import com.xksgroup.vodpipeline.service.worker.WorkerSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class WorkerConfig {

    @Bean(destroyMethod = "shutdown")
    public ProcessHelper processHelper() {
        return new ProcessHelper();
    }

    @Bean
    public Transcoder transcoder(
            ProcessHelper processHelper,
            ObjectMapper objectMapper,
            @Value("${video.transcode.work-dir:${java.io.tmpdir}/vod-pipeline}") String workDir,
            @Value("${video.transcode.ffmpeg:ffmpeg}") String ffmpeg,
            @Value("${video.transcode.ffprobe:ffprobe}") String ffprobe,
            @Value("${video.transcode.preset:ultrafast}") String preset,
            @Value("${video.transcode.crf:23}") int crf,
            @Value("${video.transcode.segment-seconds:10}") int segmentSeconds
    ) {
        return new FFmpegTranscoder(processHelper, new FfprobeParser(objectMapper), Path.of(workDir),
                ffmpeg, ffprobe, preset, crf, segmentSeconds);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService progressForwardingExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "progress-forwarder");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public VideoProcessingPipeline videoProcessingPipeline(
            Transcoder transcoder,
            ObjectStore objectStore,
            VideoMetadataStore metadataStore,
            ProgressBus progressBus,
            ExecutorService progressForwardingExecutor,
            Clock clock,
            @Value("${video.storage.playback-url-ttl:7d}") Duration playbackUrlTtl
    ) {
        return new VideoProcessingPipeline(transcoder, objectStore, metadataStore, progressBus,
                progressForwardingExecutor, clock, playbackUrlTtl);
    }

    @Bean
    public TranscodeWorker transcodeWorker(
            JobQueue jobQueue,
            VideoJobCodec codec,
            VideoProcessingPipeline pipeline,
            @Value("${video.worker.enabled:true}") boolean enabled,
            @Value("${video.worker.group:video-workers}") String group,
            @Value("${video.worker.consumer-name:${HOSTNAME:worker-1}}") String consumerName,
            @Value("${video.worker.read-block:5s}") Duration readBlock,
            @Value("${video.worker.read-error-backoff:2s}") Duration readErrorBackoff,
            @Value("${video.worker.job-timeout:2h}") Duration jobTimeout,
            @Value("${video.worker.recovery-min-idle:0s}") Duration recoveryMinIdle,
            @Value("${video.worker.shutdown-grace:5m}") Duration shutdownGrace,
            @Value("${video.worker.cancel-grace:30s}") Duration cancelGrace
    ) {
        WorkerSettings settings = WorkerSettings.builder()
                .group(group)
                .consumerName(consumerName)
                .readBlock(readBlock)
                .readErrorBackoff(readErrorBackoff)
                .jobTimeout(jobTimeout)
                .recoveryMinIdle(recoveryMinIdle)
                .shutdownGrace(shutdownGrace)
                .cancelGrace(cancelGrace)
                .autoStartup(enabled)
                .build();
        return new TranscodeWorker(jobQueue, codec, pipeline, settings);
    }
}
