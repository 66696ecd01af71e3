package com.xksgroup.vodpipeline.service.worker;

import com.xksgroup.vodpipeline.exception.MalformedJobException;
import com.xksgroup.vodpipeline.exception.QueueUnavailableException;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import com.xksgroup.vodpipeline.queue.JobQueue;
import com.xksgroup.vodpipeline.queue.PendingEntry;
import com.xksgroup.vodpipeline.queue.QueueEntry;
import com.xksgroup.vodpipeline.queue.VideoJobCodec;
import com.xksgroup.vodpipeline.service.pipeline.ProcessingResult;
import com.xksgroup.vodpipeline.service.pipeline.VideoProcessingPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Consumer-group member that turns queue entries into pipeline runs, one job at a time.
 *
 * <p>On start it claims whatever the group left pending, then reads new entries. An entry is
 * acknowledged when its job completes (or was already completed) and when it cannot be decoded.
 * A failed job stays pending so that the next recovery pass picks it up again.</p>
 */
@Slf4j
public class TranscodeWorker implements SmartLifecycle {

    private final JobQueue queue;
    private final VideoJobCodec codec;
    private final VideoProcessingPipeline pipeline;
    private final WorkerSettings settings;

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.STOPPED);
    private volatile ExecutorService jobExecutor;
    private volatile boolean running;
    private Thread loopThread;

    public TranscodeWorker(JobQueue queue, VideoJobCodec codec, VideoProcessingPipeline pipeline,
                           WorkerSettings settings) {
        this.queue = queue;
        this.codec = codec;
        this.pipeline = pipeline;
        this.settings = settings;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        state.set(WorkerState.STARTUP);
        loopThread = new Thread(this::runLoop, "transcode-worker-" + settings.getConsumerName());
        loopThread.start();
        log.info("Transcode worker {} started (group={})", settings.getConsumerName(), settings.getGroup());
    }

    /**
     * Stop reading new entries and wait for the job in flight to finish.
     */
    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            state.set(WorkerState.SHUTTING_DOWN);
            thread = loopThread;
        }
        log.info("Shutting down transcode worker {}", settings.getConsumerName());
        try {
            thread.join(settings.getShutdownGrace().toMillis());
            if (thread.isAlive()) {
                log.warn("Worker {} still busy after {}, leaving its entry pending",
                        settings.getConsumerName(), settings.getShutdownGrace());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        ExecutorService executor = jobExecutor;
        if (executor != null) {
            executor.shutdownNow();
        }
        state.set(WorkerState.STOPPED);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isAutoStartup();
    }

    public WorkerState getState() {
        return state.get();
    }

    void runLoop() {
        try {
            if (!ensureGroup()) {
                return;
            }
            state.set(WorkerState.RECOVERING);
            recoverPending();

            if (running) {
                state.set(WorkerState.CONSUMING);
            }
            while (running) {
                List<QueueEntry> entries;
                try {
                    entries = queue.readAsGroup(settings.getGroup(), settings.getConsumerName(), settings.getReadBlock());
                } catch (QueueUnavailableException e) {
                    log.error("Error reading from queue: {}", e.getMessage());
                    if (!pause(settings.getReadErrorBackoff())) {
                        break;
                    }
                    continue;
                }
                for (QueueEntry entry : entries) {
                    handle(entry);
                }
            }
        } finally {
            state.compareAndSet(WorkerState.SHUTTING_DOWN, WorkerState.STOPPED);
            log.info("Transcode worker {} loop exited", settings.getConsumerName());
        }
    }

    /**
     * Claim every entry pending in the group, whoever owned it, and process it here.
     */
    void recoverPending() {
        List<PendingEntry> pending;
        try {
            pending = queue.listPending(settings.getGroup());
        } catch (QueueUnavailableException e) {
            log.warn("Could not list pending entries, skipping recovery: {}", e.getMessage());
            return;
        }
        if (pending.isEmpty()) {
            log.info("No pending entries to recover");
            return;
        }

        List<String> ids = pending.stream().map(PendingEntry::getEntryId).collect(Collectors.toList());
        log.info("Recovering {} pending entries: {}", ids.size(), ids);

        List<QueueEntry> claimed;
        try {
            claimed = queue.claim(settings.getGroup(), settings.getConsumerName(), settings.getRecoveryMinIdle(), ids);
        } catch (QueueUnavailableException e) {
            log.warn("Could not claim pending entries: {}", e.getMessage());
            return;
        }
        for (QueueEntry entry : claimed) {
            if (!running) {
                break;
            }
            handle(entry);
        }
    }

    void handle(QueueEntry entry) {
        VideoJob job;
        try {
            job = codec.decode(entry);
        } catch (MalformedJobException e) {
            log.error("Discarding malformed entry {}: {}", e.getEntryId(), e.getMessage());
            ack(entry.getEntryId());
            return;
        }

        log.info("Processing job {} (entry {})", job.getJobId(), entry.getEntryId());
        ProcessingResult result = runWithCeiling(job);

        if (result.getOutcome().isAckable()) {
            ack(entry.getEntryId());
        } else {
            log.warn("Job {} failed, entry {} left pending: {}", job.getJobId(), entry.getEntryId(), result.getErrorMessage());
        }
    }

    private ProcessingResult runWithCeiling(VideoJob job) {
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<ProcessingResult> ownResult = new AtomicReference<>();
        Future<ProcessingResult> run = jobExecutor().submit(() -> {
            try {
                ProcessingResult result = pipeline.process(job);
                ownResult.set(result);
                return result;
            } finally {
                finished.countDown();
            }
        });
        try {
            return run.get(settings.getJobTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Job {} exceeded {}, cancelling", job.getJobId(), settings.getJobTimeout());
            run.cancel(true);
            awaitStopped(job, finished);
            // A run that reached its own terminal state before noticing the cancel keeps it
            ProcessingResult own = ownResult.get();
            if (own != null) {
                log.warn("Job {} finished as {} after its deadline", job.getJobId(), own.getOutcome());
                return own;
            }
            return pipeline.failTimedOut(job, settings.getJobTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Job {} crashed: {}", job.getJobId(), cause.getMessage(), cause);
            return pipeline.failCrashed(job, cause);
        } catch (InterruptedException e) {
            run.cancel(true);
            Thread.currentThread().interrupt();
            return ProcessingResult.failed(job.getJobId(), "Worker interrupted", List.of());
        }
    }

    // The timeout is recorded only after the run stopped, so it cannot publish after the failure
    private void awaitStopped(VideoJob job, CountDownLatch finished) {
        try {
            if (!finished.await(settings.getCancelGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Job {} still running {} after cancellation", job.getJobId(), settings.getCancelGrace());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // Recreated after stop() so the worker can be started again
    private synchronized ExecutorService jobExecutor() {
        if (jobExecutor == null || jobExecutor.isShutdown()) {
            jobExecutor = Executors.newSingleThreadExecutor(r -> new Thread(r, "transcode-job-" + settings.getConsumerName()));
        }
        return jobExecutor;
    }

    private void ack(String entryId) {
        try {
            queue.ack(settings.getGroup(), entryId);
        } catch (QueueUnavailableException e) {
            // Stays pending; recovery will see it again
            log.error("Failed to acknowledge entry {}: {}", entryId, e.getMessage());
        }
    }

    private boolean ensureGroup() {
        while (running) {
            try {
                queue.ensureGroup(settings.getGroup());
                return true;
            } catch (QueueUnavailableException e) {
                log.error("Failed to create consumer group {}: {}", settings.getGroup(), e.getMessage());
                if (!pause(settings.getReadErrorBackoff())) {
                    return false;
                }
            }
        }
        return false;
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
