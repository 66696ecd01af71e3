package com.xksgroup.vodpipeline.progress;

import com.xksgroup.vodpipeline.model.progress.ProgressEvent;

import java.util.Optional;

/**
 * Fan-out of job progress: one topic per job, one global topic, and a TTL'd latest-event
 * snapshot per job so late observers can see current state.
 */
public interface ProgressBus {

    /**
     * Deliver to the job topic and the global topic and replace the job's snapshot.
     * Never waits for subscribers and never throws.
     */
    void publish(ProgressEvent event);

    Optional<ProgressEvent> getSnapshot(String jobId);

    ProgressSubscription subscribe(String jobId);

    ProgressSubscription subscribeAll();
}
