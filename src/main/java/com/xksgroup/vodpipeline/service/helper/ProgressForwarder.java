package com.xksgroup.vodpipeline.service.helper;

import com.xksgroup.vodpipeline.service.transcode.TranscodeProgressListener;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;

/**
 * Moves transcoder ticks off the output reader thread onto a publishing task. Ticks that pile up
 * are coalesced to the latest one. Closing drains what is left and stops the task.
 */
@Slf4j
public class ProgressForwarder implements TranscodeProgressListener, AutoCloseable {

    private static final long POLL_MILLIS = 100;
    private static final long CLOSE_TIMEOUT_MILLIS = 2_000;

    private final BlockingQueue<Integer> ticks = new LinkedBlockingQueue<>();
    private final IntConsumer sink;
    private final Future<?> task;
    private volatile boolean closed;

    public ProgressForwarder(ExecutorService executor, IntConsumer sink) {
        this.sink = sink;
        this.task = executor.submit(this::drain);
    }

    @Override
    public void onProgress(int percentage, double currentTime, double totalTime) {
        if (!closed) {
            ticks.offer(percentage);
        }
    }

    @Override
    public void close() {
        closed = true;
        if (awaitDrained()) {
            // A cancelled caller still waits, so no tick is published after it moves on
            awaitDrained();
            Thread.currentThread().interrupt();
        }
    }

    // True when the wait was cut short by an interrupt
    private boolean awaitDrained() {
        try {
            task.get(CLOSE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Progress forwarder did not drain in time, cancelling");
            task.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Progress forwarder failed: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            return true;
        }
        return false;
    }

    private void drain() {
        try {
            while (!closed || !ticks.isEmpty()) {
                Integer tick = ticks.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (tick == null) {
                    continue;
                }
                Integer newer;
                while ((newer = ticks.poll()) != null) {
                    tick = newer;
                }
                try {
                    sink.accept(tick);
                } catch (RuntimeException e) {
                    log.debug("Dropping progress tick {}: {}", tick, e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
