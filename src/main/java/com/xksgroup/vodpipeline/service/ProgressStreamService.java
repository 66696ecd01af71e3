package com.xksgroup.vodpipeline.service;

import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import com.xksgroup.vodpipeline.progress.ProgressSubscription;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Relays progress events to SSE clients, one relay task per connection.
 */
@Slf4j
@Service
public class ProgressStreamService {

    public static final String PROGRESS_EVENT = "progress";
    public static final String HEARTBEAT_EVENT = "heartbeat";

    private final ProgressBus progressBus;
    private final Duration heartbeatInterval;
    private final ExecutorService relayExecutor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "progress-sse-relay");
        thread.setDaemon(true);
        return thread;
    });

    public ProgressStreamService(ProgressBus progressBus,
                                 @Value("${video.progress.sse-heartbeat:15s}") Duration heartbeatInterval) {
        this.progressBus = progressBus;
        this.heartbeatInterval = heartbeatInterval;
    }

    /**
     * Stream one job. The latest snapshot goes first; the stream completes after a terminal event.
     */
    public SseEmitter streamJob(String jobId) {
        SseEmitter emitter = createEmitter();
        ProgressSubscription subscription = progressBus.subscribe(jobId);
        bindLifecycle(emitter, subscription);

        Optional<ProgressEvent> snapshot = progressBus.getSnapshot(jobId);
        if (snapshot.isPresent()) {
            if (!safeSend(emitter, subscription, PROGRESS_EVENT, snapshot.get())) {
                return emitter;
            }
            if (snapshot.get().isTerminal()) {
                subscription.close();
                emitter.complete();
                return emitter;
            }
        }

        relayExecutor.submit(() -> relay(emitter, subscription, true));
        return emitter;
    }

    /**
     * Stream every job's events until the client goes away.
     */
    public SseEmitter streamAll() {
        SseEmitter emitter = createEmitter();
        ProgressSubscription subscription = progressBus.subscribeAll();
        bindLifecycle(emitter, subscription);
        relayExecutor.submit(() -> relay(emitter, subscription, false));
        return emitter;
    }

    SseEmitter createEmitter() {
        return new SseEmitter(0L);
    }

    void relay(SseEmitter emitter, ProgressSubscription subscription, boolean completeOnTerminal) {
        try {
            while (!subscription.isClosed()) {
                ProgressEvent event = subscription.next(heartbeatInterval);
                if (event == null) {
                    if (!subscription.isClosed()) {
                        safeSend(emitter, subscription, HEARTBEAT_EVENT, Map.of("ts", System.currentTimeMillis()));
                    }
                    continue;
                }
                if (!safeSend(emitter, subscription, PROGRESS_EVENT, event)) {
                    return;
                }
                if (completeOnTerminal && event.isTerminal()) {
                    emitter.complete();
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            subscription.close();
        }
    }

    private void bindLifecycle(SseEmitter emitter, ProgressSubscription subscription) {
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(t -> subscription.close());
    }

    /**
     * Safely sends an SSE event, closing the subscription when the client is gone.
     */
    private boolean safeSend(SseEmitter emitter, ProgressSubscription subscription, String eventName, Object data) {
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name(eventName)
                    .data(data)
                    .reconnectTime(3000));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client on {} disconnected: {}", subscription.getTopic(), e.getMessage());
            subscription.close();
            emitter.completeWithError(e);
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        relayExecutor.shutdownNow();
    }
}
