package com.xksgroup.vodpipeline.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobQueueTest {

    private static final String GROUP = "video-workers";

    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue(new VideoJobCodec(new ObjectMapper()), Clock.systemUTC(), 1);
        queue.ensureGroup(GROUP);
    }

    @Test
    void entryIdsAreIncreasing() {
        String first = queue.append(job("a"));
        String second = queue.append(job("b"));

        long[] a = parse(first);
        long[] b = parse(second);
        assertThat(a[0] < b[0] || (a[0] == b[0] && a[1] < b[1])).isTrue();
    }

    @Test
    void readMakesEntryPendingForReader() {
        String entryId = queue.append(job("a"));

        List<QueueEntry> read = queue.readAsGroup(GROUP, "w1", Duration.ZERO);

        assertThat(read).extracting(QueueEntry::getEntryId).containsExactly(entryId);
        assertThat(queue.listPending(GROUP))
                .singleElement()
                .satisfies(p -> {
                    assertThat(p.getEntryId()).isEqualTo(entryId);
                    assertThat(p.getConsumerOwner()).isEqualTo("w1");
                    assertThat(p.getDeliveryCount()).isEqualTo(1);
                });
        assertThat(queue.readAsGroup(GROUP, "w2", Duration.ZERO)).isEmpty();
    }

    @Test
    void ackIsIdempotent() {
        String entryId = queue.append(job("a"));
        queue.readAsGroup(GROUP, "w1", Duration.ZERO);

        queue.ack(GROUP, entryId);
        queue.ack(GROUP, entryId);
        queue.ack(GROUP, "999-0");

        assertThat(queue.listPending(GROUP)).isEmpty();
    }

    @Test
    void readWaitsForAppend() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<List<QueueEntry>> pendingRead = executor.submit(() -> queue.readAsGroup(GROUP, "w1", Duration.ofSeconds(5)));
            Thread.sleep(100);
            String entryId = queue.append(job("late"));

            assertThat(pendingRead.get(5, TimeUnit.SECONDS))
                    .extracting(QueueEntry::getEntryId)
                    .containsExactly(entryId);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void emptyReadTimesOut() {
        assertThat(queue.readAsGroup(GROUP, "w1", Duration.ofMillis(50))).isEmpty();
    }

    @Test
    void claimMovesOwnershipOfDeadConsumersEntries() {
        String entryId = queue.append(job("a"));
        queue.readAsGroup(GROUP, "dead-worker", Duration.ZERO);

        List<QueueEntry> claimed = queue.claim(GROUP, "w2", Duration.ZERO, List.of(entryId, "404-0"));

        assertThat(claimed).extracting(QueueEntry::getEntryId).containsExactly(entryId);
        PendingEntry pending = queue.listPending(GROUP).get(0);
        assertThat(pending.getConsumerOwner()).isEqualTo("w2");
        assertThat(pending.getDeliveryCount()).isEqualTo(2);
    }

    @Test
    void claimSkipsEntriesNotIdleLongEnough() {
        String entryId = queue.append(job("a"));
        queue.readAsGroup(GROUP, "w1", Duration.ZERO);

        assertThat(queue.claim(GROUP, "w2", Duration.ofHours(1), List.of(entryId))).isEmpty();
        assertThat(queue.listPending(GROUP).get(0).getConsumerOwner()).isEqualTo("w1");
    }

    @Test
    void groupsConsumeIndependently() {
        queue.append(job("a"));
        queue.ensureGroup("audit");

        assertThat(queue.readAsGroup(GROUP, "w1", Duration.ZERO)).hasSize(1);
        assertThat(queue.readAsGroup("audit", "a1", Duration.ZERO)).hasSize(1);
    }

    @Test
    void concurrentConsumersNeverShareAnEntry() throws Exception {
        int jobs = 200;
        int consumers = 4;
        for (int i = 0; i < jobs; i++) {
            queue.append(job("job-" + i));
        }

        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(consumers);
        ExecutorService executor = Executors.newFixedThreadPool(consumers);
        for (int c = 0; c < consumers; c++) {
            String consumer = "w" + c;
            executor.submit(() -> {
                try {
                    List<QueueEntry> batch;
                    while (!(batch = queue.readAsGroup(GROUP, consumer, Duration.ofMillis(50))).isEmpty()) {
                        for (QueueEntry entry : batch) {
                            delivered.add(entry.getEntryId());
                            queue.ack(GROUP, entry.getEntryId());
                        }
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();

        Set<String> unique = new HashSet<>(delivered);
        assertThat(delivered).hasSize(jobs);
        assertThat(unique).hasSize(jobs);
        assertThat(queue.awaitDrained(GROUP, 1, TimeUnit.SECONDS)).isTrue();
    }

    private static long[] parse(String entryId) {
        String[] parts = entryId.split("-");
        return new long[]{Long.parseLong(parts[0]), Long.parseLong(parts[1])};
    }

    private static VideoJob job(String id) {
        return VideoJob.builder().jobId(id).sourceLocation("/in/" + id + ".mp4").originalName(id + ".mp4").build();
    }
}
