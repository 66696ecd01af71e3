package com.xksgroup.vodpipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.progress.InMemoryProgressBus;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import com.xksgroup.vodpipeline.progress.ProgressEventCodec;
import com.xksgroup.vodpipeline.progress.RedisProgressBus;
import com.xksgroup.vodpipeline.queue.InMemoryJobQueue;
import com.xksgroup.vodpipeline.queue.JobQueue;
import com.xksgroup.vodpipeline.queue.RedisStreamJobQueue;
import com.xksgroup.vodpipeline.queue.VideoJobCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Clock;
import java.time.Duration;

/**
 * Job queue and progress bus. Each is backed by Redis unless its backend property is {@code memory}.
 */
@Configuration
public class QueueConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VideoJobCodec videoJobCodec(ObjectMapper objectMapper) {
        return new VideoJobCodec(objectMapper);
    }

    @Bean
    public ProgressEventCodec progressEventCodec(ObjectMapper objectMapper) {
        return new ProgressEventCodec(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "video.queue.backend", havingValue = "redis", matchIfMissing = true)
    public JobQueue redisJobQueue(
            StringRedisTemplate redisTemplate,
            VideoJobCodec codec,
            Clock clock,
            @Value("${video.queue.stream-key:video:jobs}") String streamKey,
            @Value("${video.queue.batch-size:1}") int batchSize,
            @Value("${video.queue.pending-scan-limit:100}") int pendingScanLimit
    ) {
        return new RedisStreamJobQueue(redisTemplate, codec, clock, streamKey, batchSize, pendingScanLimit);
    }

    @Bean
    @ConditionalOnProperty(name = "video.queue.backend", havingValue = "memory")
    public JobQueue inMemoryJobQueue(
            VideoJobCodec codec,
            Clock clock,
            @Value("${video.queue.batch-size:1}") int batchSize
    ) {
        return new InMemoryJobQueue(codec, clock, batchSize);
    }

    @Bean
    @ConditionalOnProperty(name = "video.progress.backend", havingValue = "redis", matchIfMissing = true)
    public RedisMessageListenerContainer progressListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    @Bean
    @ConditionalOnProperty(name = "video.progress.backend", havingValue = "redis", matchIfMissing = true)
    public ProgressBus redisProgressBus(
            StringRedisTemplate redisTemplate,
            RedisMessageListenerContainer progressListenerContainer,
            ProgressEventCodec codec,
            @Value("${video.progress.snapshot-ttl:24h}") Duration snapshotTtl
    ) {
        return new RedisProgressBus(redisTemplate, progressListenerContainer, codec, snapshotTtl);
    }

    @Bean
    @ConditionalOnProperty(name = "video.progress.backend", havingValue = "memory")
    public ProgressBus inMemoryProgressBus(
            Clock clock,
            @Value("${video.progress.snapshot-ttl:24h}") Duration snapshotTtl
    ) {
        return new InMemoryProgressBus(clock, snapshotTtl);
    }
}
