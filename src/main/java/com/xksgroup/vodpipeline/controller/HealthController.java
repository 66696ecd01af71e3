package com.xksgroup.vodpipeline.controller;

import com.xksgroup.vodpipeline.repo.VideoAssetRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("api/v1/health")
@Tag(name = "Santé", description = "Vérifications de santé du service")
public class HealthController {

    static final String SERVICE_NAME = "vod-pipeline";

    private final VideoAssetRepository videoAssetRepository;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;
    private final boolean redisInUse;

    public HealthController(VideoAssetRepository videoAssetRepository,
                            ObjectProvider<StringRedisTemplate> redisTemplate,
                            @Value("${video.queue.backend:redis}") String queueBackend,
                            @Value("${video.progress.backend:redis}") String progressBackend) {
        this.videoAssetRepository = videoAssetRepository;
        this.redisTemplate = redisTemplate;
        this.redisInUse = "redis".equalsIgnoreCase(queueBackend) || "redis".equalsIgnoreCase(progressBackend);
    }

    @GetMapping
    @Operation(
        summary = "Vérification de santé du système",
        description = "Vérifie la connectivité à Redis et à la base de données."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Le système est en bonne santé",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Système sain",
                    value = """
                    {
                        "status": "healthy",
                        "service": "vod-pipeline",
                        "redis": "connected",
                        "database": "connected",
                        "timestamp": "2024-01-01T12:00:00Z"
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "503", description = "Une dépendance est injoignable")
    })
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        String redis = checkRedis();
        String database = checkDatabase();
        boolean healthy = !"disconnected".equals(redis) && !"disconnected".equals(database);

        health.put("status", healthy ? "healthy" : "unhealthy");
        health.put("service", SERVICE_NAME);
        health.put("redis", redis);
        health.put("database", database);
        health.put("timestamp", Instant.now());

        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    private String checkRedis() {
        if (!redisInUse) {
            return "not used";
        }
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null) {
            return "disconnected";
        }
        try {
            String pong = template.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong) ? "connected" : "disconnected";
        } catch (RuntimeException e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            return "disconnected";
        }
    }

    private String checkDatabase() {
        try {
            videoAssetRepository.count();
            return "connected";
        } catch (RuntimeException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return "disconnected";
        }
    }
}
