package com.xksgroup.vodpipeline.progress;

import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Progress bus on Redis pub/sub. Channels are {@code video:progress:{jobId}} and
 * {@code video:progress:all}; snapshots live under {@code progress:{jobId}}.
 */
@Slf4j
public class RedisProgressBus implements ProgressBus {

    public static final String PROGRESS_CHANNEL_PREFIX = "video:progress:";
    public static final String PROGRESS_ALL_CHANNEL = "video:progress:all";
    public static final String SNAPSHOT_KEY_PREFIX = "progress:";

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer listenerContainer;
    private final ProgressEventCodec codec;
    private final Duration snapshotTtl;

    public RedisProgressBus(StringRedisTemplate redis, RedisMessageListenerContainer listenerContainer,
                            ProgressEventCodec codec, Duration snapshotTtl) {
        this.redis = redis;
        this.listenerContainer = listenerContainer;
        this.codec = codec;
        this.snapshotTtl = snapshotTtl;
    }

    @Override
    public void publish(ProgressEvent event) {
        String payload = codec.encode(event);

        // Snapshot first so a subscriber that misses the message still reads this state
        try {
            redis.opsForValue().set(SNAPSHOT_KEY_PREFIX + event.getJobId(), payload, snapshotTtl);
        } catch (DataAccessException e) {
            log.warn("Failed to store progress snapshot for job {}: {}", event.getJobId(), e.getMessage());
        }

        try {
            redis.convertAndSend(PROGRESS_CHANNEL_PREFIX + event.getJobId(), payload);
            redis.convertAndSend(PROGRESS_ALL_CHANNEL, payload);
        } catch (DataAccessException e) {
            log.warn("Failed to publish progress for job {}: {}", event.getJobId(), e.getMessage());
        }
    }

    @Override
    public Optional<ProgressEvent> getSnapshot(String jobId) {
        String payload = redis.opsForValue().get(SNAPSHOT_KEY_PREFIX + jobId);
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(payload));
        } catch (IllegalArgumentException e) {
            log.warn("Discarding unreadable progress snapshot for job {}: {}", jobId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public ProgressSubscription subscribe(String jobId) {
        return listen(PROGRESS_CHANNEL_PREFIX + jobId);
    }

    @Override
    public ProgressSubscription subscribeAll() {
        return listen(PROGRESS_ALL_CHANNEL);
    }

    private ProgressSubscription listen(String channel) {
        ChannelTopic topic = new ChannelTopic(channel);
        ListenerHolder holder = new ListenerHolder();
        ProgressSubscription subscription = new ProgressSubscription(channel,
                s -> listenerContainer.removeMessageListener(holder.listener, topic));

        holder.listener = (message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            try {
                subscription.deliver(codec.decode(body));
            } catch (IllegalArgumentException e) {
                log.warn("Error unmarshaling progress on {}: {}", channel, e.getMessage());
            }
        };
        listenerContainer.addMessageListener(holder.listener, topic);
        log.debug("Subscribed to {}", channel);
        return subscription;
    }

    private static final class ListenerHolder {
        private MessageListener listener;
    }
}
