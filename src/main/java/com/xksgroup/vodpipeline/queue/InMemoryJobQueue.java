package com.xksgroup.vodpipeline.queue;

import com.xksgroup.vodpipeline.model.job.VideoJob;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local job log with the same group semantics as the Redis stream backend.
 * Entries do not survive a restart; meant for local runs and tests.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private final VideoJobCodec codec;
    private final Clock clock;
    private final int batchSize;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();

    private final List<QueueEntry> entries = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private final Map<String, GroupState> groups = new HashMap<>();
    private long lastMillis;
    private long sequence;

    public InMemoryJobQueue(VideoJobCodec codec, Clock clock, int batchSize) {
        this.codec = codec;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public void ensureGroup(String group) {
        lock.lock();
        try {
            groups.computeIfAbsent(group, g -> new GroupState());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String append(VideoJob job) {
        Map<String, String> fields = codec.encode(job, clock.instant());
        lock.lock();
        try {
            String entryId = nextEntryId();
            positions.put(entryId, entries.size());
            entries.add(new QueueEntry(entryId, Map.copyOf(fields)));
            appended.signalAll();
            log.debug("Appended entry {} for job {}", entryId, job.getJobId());
            return entryId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueueEntry> readAsGroup(String group, String consumer, Duration maxWait) {
        long remainingNanos = maxWait != null ? maxWait.toNanos() : 0L;
        lock.lock();
        try {
            GroupState state = groups.computeIfAbsent(group, g -> new GroupState());
            while (state.cursor >= entries.size()) {
                if (remainingNanos <= 0L) {
                    return List.of();
                }
                try {
                    remainingNanos = appended.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return List.of();
                }
            }

            List<QueueEntry> delivered = new ArrayList<>();
            Instant now = clock.instant();
            while (state.cursor < entries.size() && delivered.size() < batchSize) {
                QueueEntry entry = entries.get(state.cursor++);
                state.pending.put(entry.getEntryId(), new PendingState(consumer, now, 1));
                delivered.add(entry);
            }
            return delivered;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PendingEntry> listPending(String group) {
        lock.lock();
        try {
            GroupState state = groups.get(group);
            if (state == null) {
                return List.of();
            }
            Instant now = clock.instant();
            List<PendingEntry> result = new ArrayList<>();
            state.pending.forEach((entryId, pending) -> result.add(new PendingEntry(
                    entryId, pending.owner, Duration.between(pending.lastDelivery, now), pending.deliveryCount)));
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueueEntry> claim(String group, String consumer, Duration minIdle, List<String> entryIds) {
        lock.lock();
        try {
            GroupState state = groups.get(group);
            if (state == null) {
                return List.of();
            }
            Instant now = clock.instant();
            List<QueueEntry> claimed = new ArrayList<>();
            for (String entryId : entryIds) {
                PendingState pending = state.pending.get(entryId);
                if (pending == null) {
                    continue;
                }
                Duration idle = Duration.between(pending.lastDelivery, now);
                if (minIdle != null && idle.compareTo(minIdle) < 0) {
                    continue;
                }
                state.pending.put(entryId, new PendingState(consumer, now, pending.deliveryCount + 1));
                claimed.add(entries.get(positions.get(entryId)));
            }
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ack(String group, String entryId) {
        lock.lock();
        try {
            GroupState state = groups.get(group);
            if (state != null && state.pending.remove(entryId) != null) {
                log.debug("Acknowledged entry {} for group {}", entryId, group);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the group has delivered every entry and nothing is pending, or the timeout runs out.
     */
    public boolean awaitDrained(String group, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            lock.lock();
            try {
                GroupState state = groups.get(group);
                if (state != null && state.cursor >= entries.size() && state.pending.isEmpty()) {
                    return true;
                }
            } finally {
                lock.unlock();
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
        return false;
    }

    // Redis-style "<millis>-<seq>" ids, strictly increasing
    private String nextEntryId() {
        long millis = clock.millis();
        if (millis <= lastMillis) {
            millis = lastMillis;
            sequence++;
        } else {
            lastMillis = millis;
            sequence = 0;
        }
        return millis + "-" + sequence;
    }

    private static final class GroupState {
        private int cursor;
        private final Map<String, PendingState> pending = new LinkedHashMap<>();
    }

    private static final class PendingState {
        private final String owner;
        private final Instant lastDelivery;
        private final long deliveryCount;

        private PendingState(String owner, Instant lastDelivery, long deliveryCount) {
            this.owner = owner;
            this.lastDelivery = lastDelivery;
            this.deliveryCount = deliveryCount;
        }
    }
}
