package com.xksgroup.vodpipeline.progress;

import com.xksgroup.vodpipeline.model.progress.ProgressEvent;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Live stream of progress events for one topic. Only events published after the subscription
 * was opened are delivered. The holder must {@link #close()} it.
 */
public class ProgressSubscription implements AutoCloseable {

    private final String topic;
    private final BlockingQueue<ProgressEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<ProgressSubscription> onClose;

    public ProgressSubscription(String topic, Consumer<ProgressSubscription> onClose) {
        this.topic = topic;
        this.onClose = onClose;
    }

    public String getTopic() {
        return topic;
    }

    void deliver(ProgressEvent event) {
        if (!closed.get()) {
            events.offer(event);
        }
    }

    /**
     * Next event, or {@code null} if none arrived within the timeout or the subscription is closed.
     */
    public ProgressEvent next(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            return events.poll();
        }
        return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.accept(this);
        }
    }
}
