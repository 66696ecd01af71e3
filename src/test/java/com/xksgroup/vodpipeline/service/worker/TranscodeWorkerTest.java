package com.xksgroup.vodpipeline.service.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import com.xksgroup.vodpipeline.queue.InMemoryJobQueue;
import com.xksgroup.vodpipeline.queue.JobQueue;
import com.xksgroup.vodpipeline.queue.PendingEntry;
import com.xksgroup.vodpipeline.queue.QueueEntry;
import com.xksgroup.vodpipeline.queue.VideoJobCodec;
import com.xksgroup.vodpipeline.service.pipeline.ProcessingResult;
import com.xksgroup.vodpipeline.service.pipeline.VideoProcessingPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscodeWorkerTest {

    private static final String GROUP = "video-workers";

    private final VideoJobCodec codec = new VideoJobCodec(new ObjectMapper());
    private InMemoryJobQueue queue;
    private VideoProcessingPipeline pipeline;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue(codec, Clock.systemUTC(), 10);
        queue.ensureGroup(GROUP);
        pipeline = mock(VideoProcessingPipeline.class);
    }

    @Test
    void completedJobIsAcknowledged() throws Exception {
        when(pipeline.process(any(VideoJob.class))).thenAnswer(inv ->
                ProcessingResult.completed(inv.<VideoJob>getArgument(0).getJobId(), 6, List.of()));
        TranscodeWorker worker = worker(settings("worker-1").build());

        QueueEntry entry = deliver(job("job-1"), "worker-1");
        worker.handle(entry);

        verify(pipeline).process(job("job-1"));
        assertThat(queue.listPending(GROUP)).isEmpty();
    }

    @Test
    void alreadyCompletedJobIsAcknowledged() throws Exception {
        when(pipeline.process(any(VideoJob.class))).thenReturn(ProcessingResult.alreadyCompleted("job-1", List.of()));
        TranscodeWorker worker = worker(settings("worker-1").build());

        worker.handle(deliver(job("job-1"), "worker-1"));

        assertThat(queue.listPending(GROUP)).isEmpty();
    }

    @Test
    void failedJobStaysPending() throws Exception {
        when(pipeline.process(any(VideoJob.class)))
                .thenReturn(ProcessingResult.failed("job-1", "failed to transcode 480p: boom", List.of()));
        TranscodeWorker worker = worker(settings("worker-1").build());

        QueueEntry entry = deliver(job("job-1"), "worker-1");
        worker.handle(entry);

        assertThat(queue.listPending(GROUP)).extracting(PendingEntry::getEntryId).containsExactly(entry.getEntryId());
    }

    @Test
    void malformedEntryIsAcknowledgedWithoutProcessing() throws Exception {
        JobQueue mockQueue = mock(JobQueue.class);
        TranscodeWorker worker = new TranscodeWorker(mockQueue, codec, pipeline, settings("worker-1").build());

        worker.handle(new QueueEntry("1700000000000-0", Map.of("payload", "{not json")));
        worker.handle(new QueueEntry("1700000000000-1", Map.of("job_id", "job-2")));

        verify(mockQueue).ack(GROUP, "1700000000000-0");
        verify(mockQueue).ack(GROUP, "1700000000000-1");
        verify(pipeline, never()).process(any(VideoJob.class));
    }

    @Test
    void recoveryClaimsEntriesOfDeadConsumer() throws Exception {
        when(pipeline.process(any(VideoJob.class))).thenAnswer(inv ->
                ProcessingResult.completed(inv.<VideoJob>getArgument(0).getJobId(), 1, List.of()));
        deliver(job("job-1"), "worker-gone");
        deliver(job("job-2"), "worker-gone");
        TranscodeWorker worker = worker(settings("worker-1").build());

        worker.start();
        try {
            assertThat(queue.awaitDrained(GROUP, 5, TimeUnit.SECONDS)).isTrue();
        } finally {
            worker.stop();
        }

        verify(pipeline).process(job("job-1"));
        verify(pipeline).process(job("job-2"));
    }

    @Test
    void timedOutJobIsRecordedAndLeftPending() throws Exception {
        when(pipeline.process(any(VideoJob.class))).thenAnswer(inv -> {
            Thread.sleep(10_000);
            return ProcessingResult.completed("job-1", 6, List.of());
        });
        when(pipeline.failTimedOut(any(VideoJob.class), any(Duration.class)))
                .thenReturn(ProcessingResult.failed("job-1", "Processing timed out after 0 minutes", List.of()));
        TranscodeWorker worker = worker(settings("worker-1").jobTimeout(Duration.ofMillis(100)).build());

        QueueEntry entry = deliver(job("job-1"), "worker-1");
        worker.handle(entry);

        verify(pipeline).failTimedOut(job("job-1"), Duration.ofMillis(100));
        assertThat(queue.listPending(GROUP)).extracting(PendingEntry::getEntryId).containsExactly(entry.getEntryId());
    }

    @Test
    void cancelledRunIsAwaitedBeforeTimeoutIsRecorded() throws Exception {
        AtomicLong runEnded = new AtomicLong();
        AtomicLong timeoutRecorded = new AtomicLong();
        when(pipeline.process(any(VideoJob.class))).thenAnswer(inv -> {
            // ignores the interrupt until its next step boundary
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(400);
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            runEnded.set(System.nanoTime());
            throw new InterruptedException("Job job-1 was cancelled");
        });
        when(pipeline.failTimedOut(any(VideoJob.class), any(Duration.class))).thenAnswer(inv -> {
            timeoutRecorded.set(System.nanoTime());
            return ProcessingResult.failed("job-1", "Processing timed out after 0 minutes", List.of());
        });
        TranscodeWorker worker = worker(settings("worker-1").jobTimeout(Duration.ofMillis(100)).build());

        worker.handle(deliver(job("job-1"), "worker-1"));

        assertThat(runEnded.get()).isPositive();
        assertThat(timeoutRecorded.get()).isGreaterThanOrEqualTo(runEnded.get());
    }

    @Test
    void runFinishingPastDeadlineKeepsItsOwnOutcome() throws Exception {
        when(pipeline.process(any(VideoJob.class))).thenAnswer(inv -> {
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            return ProcessingResult.failed("job-1", "failed to transcode 144p: boom", List.of());
        });
        TranscodeWorker worker = worker(settings("worker-1").jobTimeout(Duration.ofMillis(100)).build());

        QueueEntry entry = deliver(job("job-1"), "worker-1");
        worker.handle(entry);

        verify(pipeline, never()).failTimedOut(any(VideoJob.class), any(Duration.class));
        assertThat(queue.listPending(GROUP)).extracting(PendingEntry::getEntryId).containsExactly(entry.getEntryId());
    }

    @Test
    void crashedRunIsRecordedThroughPipeline() throws Exception {
        IllegalStateException crash = new IllegalStateException("scratch directory vanished");
        when(pipeline.process(any(VideoJob.class))).thenThrow(crash);
        when(pipeline.failCrashed(any(VideoJob.class), any(Throwable.class)))
                .thenReturn(ProcessingResult.failed("job-1", "Unexpected processing error: scratch directory vanished", List.of()));
        TranscodeWorker worker = worker(settings("worker-1").build());

        QueueEntry entry = deliver(job("job-1"), "worker-1");
        worker.handle(entry);

        verify(pipeline).failCrashed(job("job-1"), crash);
        assertThat(queue.listPending(GROUP)).extracting(PendingEntry::getEntryId).containsExactly(entry.getEntryId());
    }

    @Test
    void workerCanBeStartedAgainAfterStop() throws Exception {
        when(pipeline.process(any(VideoJob.class))).thenAnswer(inv ->
                ProcessingResult.completed(inv.<VideoJob>getArgument(0).getJobId(), 6, List.of()));
        TranscodeWorker worker = worker(settings("worker-1").build());

        worker.start();
        queue.append(job("job-1"));
        assertThat(queue.awaitDrained(GROUP, 5, TimeUnit.SECONDS)).isTrue();
        worker.stop();

        worker.start();
        try {
            queue.append(job("job-2"));
            verify(pipeline, timeout(5000)).process(job("job-2"));
            assertThat(queue.awaitDrained(GROUP, 5, TimeUnit.SECONDS)).isTrue();
            assertThat(worker.getState()).isEqualTo(WorkerState.CONSUMING);
        } finally {
            worker.stop();
        }
    }

    @Test
    void lifecycleConsumesUntilStopped() throws Exception {
        when(pipeline.process(any(VideoJob.class))).thenAnswer(inv ->
                ProcessingResult.completed(inv.<VideoJob>getArgument(0).getJobId(), 6, List.of()));
        TranscodeWorker worker = worker(settings("worker-1").readBlock(Duration.ofMillis(50)).build());
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);

        worker.start();
        queue.append(job("job-1"));
        queue.append(job("job-2"));

        assertThat(queue.awaitDrained(GROUP, 5, TimeUnit.SECONDS)).isTrue();
        verify(pipeline, timeout(1000)).process(job("job-2"));
        assertThat(worker.isRunning()).isTrue();
        assertThat(worker.getState()).isEqualTo(WorkerState.CONSUMING);

        worker.stop();

        assertThat(worker.isRunning()).isFalse();
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void failedJobIsRetriedOnNextRecovery() throws Exception {
        when(pipeline.process(any(VideoJob.class)))
                .thenReturn(ProcessingResult.failed("job-1", "source unreachable", List.of()))
                .thenReturn(ProcessingResult.completed("job-1", 6, List.of()));
        TranscodeWorker worker = worker(settings("worker-1").build());
        worker.handle(deliver(job("job-1"), "worker-1"));
        assertThat(queue.listPending(GROUP)).hasSize(1);

        worker.start();
        try {
            assertThat(queue.awaitDrained(GROUP, 5, TimeUnit.SECONDS)).isTrue();
        } finally {
            worker.stop();
        }

        verify(pipeline, times(2)).process(job("job-1"));
    }

    private TranscodeWorker worker(WorkerSettings settings) {
        return new TranscodeWorker(queue, codec, pipeline, settings);
    }

    private static WorkerSettings.WorkerSettingsBuilder settings(String consumer) {
        return WorkerSettings.builder()
                .group(GROUP)
                .consumerName(consumer)
                .readBlock(Duration.ofMillis(50))
                .readErrorBackoff(Duration.ofMillis(10))
                .shutdownGrace(Duration.ofSeconds(5));
    }

    private QueueEntry deliver(VideoJob job, String consumer) {
        queue.append(job);
        List<QueueEntry> entries = queue.readAsGroup(GROUP, consumer, Duration.ZERO);
        assertThat(entries).hasSize(1);
        return entries.get(0);
    }

    private static VideoJob job(String id) {
        return VideoJob.builder()
                .jobId(id)
                .sourceLocation("/uploads/" + id + ".mp4")
                .originalName(id + ".mp4")
                .build();
    }
}
