package com.xksgroup.vodpipeline.controller;

import com.xksgroup.vodpipeline.repo.VideoAssetRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private VideoAssetRepository videoAssetRepository;

    @Mock
    private ObjectProvider<StringRedisTemplate> redisProvider;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Test
    @SuppressWarnings("unchecked")
    void healthyWhenRedisAndDatabaseRespond() {
        when(redisProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");
        when(videoAssetRepository.count()).thenReturn(3L);

        ResponseEntity<Map<String, Object>> response =
                new HealthController(videoAssetRepository, redisProvider, "redis", "redis").healthCheck();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("status", "healthy")
                .containsEntry("service", "vod-pipeline")
                .containsEntry("redis", "connected")
                .containsEntry("database", "connected");
    }

    @Test
    @SuppressWarnings("unchecked")
    void unhealthyWhenRedisIsDown() {
        when(redisProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        when(videoAssetRepository.count()).thenReturn(0L);

        ResponseEntity<Map<String, Object>> response =
                new HealthController(videoAssetRepository, redisProvider, "redis", "memory").healthCheck();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("redis", "disconnected");
    }

    @Test
    void memoryBackendsSkipRedis() {
        when(videoAssetRepository.count()).thenThrow(new DataAccessResourceFailureException("mongo down"));

        ResponseEntity<Map<String, Object>> response =
                new HealthController(videoAssetRepository, redisProvider, "memory", "memory").healthCheck();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody())
                .containsEntry("redis", "not used")
                .containsEntry("database", "disconnected");
    }
}
