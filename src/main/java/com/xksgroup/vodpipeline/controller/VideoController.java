package com.xksgroup.vodpipeline.controller;

import com.xksgroup.vodpipeline.model.dto.SubmitVideoRequest;
import com.xksgroup.vodpipeline.model.dto.SubmitVideoResponse;
import com.xksgroup.vodpipeline.model.dto.VideoDetailsDto;
import com.xksgroup.vodpipeline.service.VideoCatalogService;
import com.xksgroup.vodpipeline.service.VideoSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("api/v1/videos")
@RequiredArgsConstructor
@Tag(name = "Vidéos", description = "Soumettre des vidéos au transcodage et consulter leurs rendus")
public class VideoController {

    private final VideoSubmissionService submissionService;
    private final VideoCatalogService catalogService;

    @PostMapping
    @Operation(
        summary = "Soumettre une vidéo",
        description = "Enregistre la vidéo et place un job de transcodage dans la file. Le traitement est asynchrone."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "202",
            description = "Job accepté",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Job en file",
                    value = """
                    {
                        "id": "3f2c8a4e-1d7b-4f0e-9a61-5b2d8c7e4a10",
                        "status": "queued",
                        "entry_id": "1718000000000-0"
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "Requête invalide"),
        @ApiResponse(responseCode = "503", description = "File de jobs indisponible")
    })
    public ResponseEntity<SubmitVideoResponse> submit(@Valid @RequestBody SubmitVideoRequest request) {
        SubmitVideoResponse response = submissionService.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping
    @Operation(summary = "Lister les vidéos", description = "Liste paginée, les plus récentes en premier.")
    public ResponseEntity<Page<VideoDetailsDto>> list(
            @Parameter(description = "Numéro de page (0..N)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Taille de page (1..100)") @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(catalogService.list(page, size));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Détails d'une vidéo", description = "La vidéo et ses rendus, du débit le plus élevé au plus faible.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Vidéo trouvée"),
        @ApiResponse(responseCode = "404", description = "Vidéo introuvable")
    })
    public ResponseEntity<VideoDetailsDto> get(@PathVariable String id) {
        return ResponseEntity.ok(catalogService.get(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Supprimer une vidéo", description = "Supprime la vidéo et ses rendus. Les fichiers stockés sont conservés.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Vidéo supprimée"),
        @ApiResponse(responseCode = "404", description = "Vidéo introuvable")
    })
    public ResponseEntity<Void> delete(@PathVariable String id) {
        catalogService.delete(id);
        log.info("Deleted video {}", id);
        return ResponseEntity.noContent().build();
    }
}
