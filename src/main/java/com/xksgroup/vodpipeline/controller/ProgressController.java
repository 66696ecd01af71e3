package com.xksgroup.vodpipeline.controller;

import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import com.xksgroup.vodpipeline.service.ProgressStreamService;
import com.xksgroup.vodpipeline.service.VideoCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("api/v1")
@RequiredArgsConstructor
@Tag(name = "Progression", description = "Suivi en temps réel du transcodage")
public class ProgressController {

    private final VideoCatalogService catalogService;
    private final ProgressStreamService progressStreamService;

    @GetMapping("/videos/{id}/progress")
    @Operation(summary = "Dernière progression connue", description = "Instantané conservé 24 heures après le dernier événement.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Instantané trouvé"),
        @ApiResponse(responseCode = "404", description = "Aucune progression connue")
    })
    public ResponseEntity<ProgressEvent> progress(@PathVariable String id) {
        return ResponseEntity.ok(catalogService.progress(id));
    }

    @GetMapping(path = "/videos/{id}/progress/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Flux SSE d'une vidéo", description = "Envoie l'instantané puis chaque événement; se termine après completed ou failed.")
    public SseEmitter streamVideo(@PathVariable String id) {
        return progressStreamService.streamJob(id);
    }

    @GetMapping(path = "/progress/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Flux SSE global", description = "Événements de progression de toutes les vidéos.")
    public SseEmitter streamAll() {
        return progressStreamService.streamAll();
    }
}
