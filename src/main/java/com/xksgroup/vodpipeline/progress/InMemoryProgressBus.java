package com.xksgroup.vodpipeline.progress;

import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Single-process progress bus. Snapshots expire {@code snapshotTtl} after their last publish.
 */
@Slf4j
public class InMemoryProgressBus implements ProgressBus {

    private static final String ALL_TOPIC = "*";
    private static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;
    private final Duration snapshotTtl;

    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, Set<ProgressSubscription>> jobSubscribers = new ConcurrentHashMap<>();
    private final Set<ProgressSubscription> allSubscribers = new CopyOnWriteArraySet<>();
    private volatile Instant nextSweep = Instant.MIN;

    public InMemoryProgressBus(Clock clock, Duration snapshotTtl) {
        this.clock = clock;
        this.snapshotTtl = snapshotTtl;
    }

    @Override
    public void publish(ProgressEvent event) {
        Instant now = clock.instant();
        snapshots.put(event.getJobId(), new Snapshot(event, now.plus(snapshotTtl)));
        sweepExpired(now);

        Set<ProgressSubscription> subscribers = jobSubscribers.get(event.getJobId());
        if (subscribers != null) {
            subscribers.forEach(s -> s.deliver(event));
        }
        allSubscribers.forEach(s -> s.deliver(event));

        log.debug("Published {}% ({}) for job {}", event.getPercent(), event.getStatus(), event.getJobId());
    }

    @Override
    public Optional<ProgressEvent> getSnapshot(String jobId) {
        Snapshot snapshot = snapshots.get(jobId);
        if (snapshot == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(snapshot.expiresAt)) {
            snapshots.remove(jobId, snapshot);
            return Optional.empty();
        }
        return Optional.of(snapshot.event);
    }

    @Override
    public ProgressSubscription subscribe(String jobId) {
        ProgressSubscription subscription = new ProgressSubscription(jobId, s ->
                jobSubscribers.computeIfPresent(jobId, (id, subscribers) -> {
                    subscribers.remove(s);
                    return subscribers.isEmpty() ? null : subscribers;
                }));
        jobSubscribers.compute(jobId, (id, subscribers) -> {
            Set<ProgressSubscription> target = subscribers != null ? subscribers : new CopyOnWriteArraySet<>();
            target.add(subscription);
            return target;
        });
        return subscription;
    }

    @Override
    public ProgressSubscription subscribeAll() {
        ProgressSubscription subscription = new ProgressSubscription(ALL_TOPIC, allSubscribers::remove);
        allSubscribers.add(subscription);
        return subscription;
    }

    // Snapshots nobody reads again would otherwise stay until the process exits
    private void sweepExpired(Instant now) {
        if (now.isBefore(nextSweep)) {
            return;
        }
        nextSweep = now.plus(SWEEP_INTERVAL);
        snapshots.values().removeIf(snapshot -> !now.isBefore(snapshot.expiresAt));
    }

    int subscribedJobCount() {
        return jobSubscribers.size();
    }

    int snapshotCount() {
        return snapshots.size();
    }

    int subscriberCount(String jobId) {
        Set<ProgressSubscription> subscribers = jobSubscribers.get(jobId);
        return subscribers != null ? subscribers.size() : 0;
    }

    private static final class Snapshot {
        private final ProgressEvent event;
        private final Instant expiresAt;

        private Snapshot(ProgressEvent event, Instant expiresAt) {
            this.event = event;
            this.expiresAt = expiresAt;
        }
    }
}
