package com.xksgroup.vodpipeline.queue;

import com.xksgroup.vodpipeline.model.job.VideoJob;

import java.time.Duration;
import java.util.List;

/**
 * Append-only job log with consumer-group delivery.
 *
 * <p>Within one group every entry is, at any instant, either unseen, pending under exactly one
 * consumer, or acknowledged. Delivery is at-least-once: an entry whose consumer dies before
 * {@link #ack} stays pending until some member claims it.</p>
 */
public interface JobQueue {

    /**
     * Create the group if it does not exist yet. Calling it for an existing group is a no-op.
     */
    void ensureGroup(String group);

    /**
     * Append a job and return the entry id. Never waits for consumers.
     *
     * @throws com.xksgroup.vodpipeline.exception.QueueUnavailableException when the log cannot be reached
     */
    String append(VideoJob job);

    /**
     * Entries never delivered to any member of {@code group}, blocking up to {@code maxWait}
     * when there are none. Returned entries become pending for {@code consumer}.
     */
    List<QueueEntry> readAsGroup(String group, String consumer, Duration maxWait);

    /**
     * All pending entries of the group, including those owned by consumers that are gone.
     */
    List<PendingEntry> listPending(String group);

    /**
     * Move ownership of the given pending entries to {@code consumer}. Entries idle for less than
     * {@code minIdle}, or no longer pending, are skipped.
     */
    List<QueueEntry> claim(String group, String consumer, Duration minIdle, List<String> entryIds);

    /**
     * Mark the entry processed for the group. Unknown or already acknowledged ids are ignored.
     */
    void ack(String group, String entryId);
}
