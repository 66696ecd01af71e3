package com.xksgroup.vodpipeline.queue;

import com.xksgroup.vodpipeline.exception.QueueUnavailableException;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisStreamCommands.XClaimOptions;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Job log on a Redis stream (XADD / XREADGROUP / XPENDING / XCLAIM / XACK).
 */
@Slf4j
public class RedisStreamJobQueue implements JobQueue {

    private final StringRedisTemplate redis;
    private final VideoJobCodec codec;
    private final Clock clock;
    private final String streamKey;
    private final int batchSize;
    private final int pendingScanLimit;

    public RedisStreamJobQueue(StringRedisTemplate redis, VideoJobCodec codec, Clock clock,
                               String streamKey, int batchSize, int pendingScanLimit) {
        this.redis = redis;
        this.codec = codec;
        this.clock = clock;
        this.streamKey = streamKey;
        this.batchSize = Math.max(1, batchSize);
        this.pendingScanLimit = Math.max(1, pendingScanLimit);
    }

    @Override
    public void ensureGroup(String group) {
        byte[] rawKey = streamKey.getBytes(StandardCharsets.UTF_8);
        try {
            redis.execute((RedisCallback<String>) connection ->
                    connection.streamCommands().xGroupCreate(rawKey, group, ReadOffset.from("0"), true));
            log.info("Created consumer group {} on stream {}", group, streamKey);
        } catch (DataAccessException e) {
            if (isBusyGroup(e)) {
                log.debug("Consumer group {} already exists on stream {}", group, streamKey);
                return;
            }
            throw new QueueUnavailableException("Failed to create consumer group " + group, e);
        }
    }

    @Override
    public String append(VideoJob job) {
        Map<String, String> fields = codec.encode(job, clock.instant());
        MapRecord<String, String, String> record = StreamRecords.newRecord()
                .in(streamKey)
                .ofMap(fields);
        try {
            RecordId recordId = stream().add(record);
            if (recordId == null) {
                throw new QueueUnavailableException("XADD returned no id for job " + job.getJobId(), null);
            }
            log.info("Job enqueued: job_id={}, entry_id={}", job.getJobId(), recordId.getValue());
            return recordId.getValue();
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to add job " + job.getJobId() + " to stream", e);
        }
    }

    @Override
    public List<QueueEntry> readAsGroup(String group, String consumer, Duration maxWait) {
        StreamReadOptions options = StreamReadOptions.empty().count(batchSize);
        if (maxWait != null && !maxWait.isZero() && !maxWait.isNegative()) {
            options = options.block(maxWait);
        }
        try {
            List<MapRecord<String, Object, Object>> records = stream().read(
                    Consumer.from(group, consumer),
                    options,
                    StreamOffset.create(streamKey, ReadOffset.lastConsumed()));
            return toEntries(records);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to read from stream " + streamKey, e);
        }
    }

    @Override
    public List<PendingEntry> listPending(String group) {
        try {
            PendingMessages pending = stream().pending(streamKey, group, Range.unbounded(), pendingScanLimit);
            List<PendingEntry> result = new ArrayList<>();
            if (pending == null) {
                return result;
            }
            for (PendingMessage message : pending) {
                result.add(new PendingEntry(
                        message.getIdAsString(),
                        message.getConsumerName(),
                        message.getElapsedTimeSinceLastDelivery(),
                        message.getTotalDeliveryCount()));
            }
            return result;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to list pending entries of group " + group, e);
        }
    }

    @Override
    public List<QueueEntry> claim(String group, String consumer, Duration minIdle, List<String> entryIds) {
        if (entryIds.isEmpty()) {
            return List.of();
        }
        XClaimOptions options = XClaimOptions
                .minIdle(minIdle != null ? minIdle : Duration.ZERO)
                .ids(entryIds.toArray(new String[0]));
        try {
            return toEntries(stream().claim(streamKey, group, consumer, options));
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to claim entries " + entryIds, e);
        }
    }

    @Override
    public void ack(String group, String entryId) {
        try {
            Long acked = stream().acknowledge(streamKey, group, entryId);
            if (acked == null || acked == 0L) {
                log.debug("Entry {} was not pending in group {}, ack ignored", entryId, group);
            }
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to acknowledge entry " + entryId, e);
        }
    }

    private StreamOperations<String, Object, Object> stream() {
        return redis.opsForStream();
    }

    private static List<QueueEntry> toEntries(List<MapRecord<String, Object, Object>> records) {
        List<QueueEntry> entries = new ArrayList<>();
        if (records == null) {
            return entries;
        }
        for (MapRecord<String, Object, Object> record : records) {
            Map<String, String> fields = new LinkedHashMap<>();
            record.getValue().forEach((k, v) -> fields.put(String.valueOf(k), v != null ? String.valueOf(v) : null));
            entries.add(new QueueEntry(record.getId().getValue(), fields));
        }
        return entries;
    }

    private static boolean isBusyGroup(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current.getMessage() != null && current.getMessage().contains("BUSYGROUP")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
