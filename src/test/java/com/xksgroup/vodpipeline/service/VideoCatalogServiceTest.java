package com.xksgroup.vodpipeline.service;

import com.xksgroup.vodpipeline.exception.VideoNotFoundException;
import com.xksgroup.vodpipeline.model.Rendition;
import com.xksgroup.vodpipeline.model.VideoAsset;
import com.xksgroup.vodpipeline.model.VideoStatus;
import com.xksgroup.vodpipeline.model.dto.VideoDetailsDto;
import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VideoCatalogServiceTest {

    @Mock
    private VideoMetadataStore metadataStore;

    @Mock
    private ProgressBus progressBus;

    private VideoCatalogService service;

    @BeforeEach
    void setUp() {
        service = new VideoCatalogService(metadataStore, progressBus);
    }

    @Test
    void listMapsAssetsWithoutRenditions() {
        VideoAsset asset = VideoAsset.builder().id("v1").status(VideoStatus.PROCESSING).sourceHeight(720).build();
        when(metadataStore.listAssets(0, 20)).thenReturn(new PageImpl<>(List.of(asset), PageRequest.of(0, 20), 1));

        Page<VideoDetailsDto> page = service.list(0, 20);

        assertThat(page.getTotalElements()).isEqualTo(1);
        VideoDetailsDto dto = page.getContent().get(0);
        assertThat(dto.getStatus()).isEqualTo("processing");
        assertThat(dto.getHeight()).isEqualTo(720);
        assertThat(dto.getWidth()).isNull();
        assertThat(dto.getRenditions()).isNull();
    }

    @Test
    void listRejectsBadPaging() {
        assertThatThrownBy(() -> service.list(-1, 20)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.list(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.list(0, 101)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getIncludesRenditions() {
        when(metadataStore.getAsset("v1")).thenReturn(VideoAsset.builder()
                .id("v1")
                .status(VideoStatus.COMPLETED)
                .masterManifestUrl("https://cdn.example.com/v1/processed/master.m3u8")
                .build());
        when(metadataStore.listRenditions("v1")).thenReturn(List.of(
                Rendition.builder().label("720p").width(1280).height(720).bandwidthEstimate(2_800_000)
                        .artifactUrl("https://cdn.example.com/v1/processed/720p/playlist.m3u8").build(),
                Rendition.builder().label("480p").width(854).height(480).bandwidthEstimate(1_400_000).build()));

        VideoDetailsDto dto = service.get("v1");

        assertThat(dto.getStatus()).isEqualTo("completed");
        assertThat(dto.getMasterManifestUrl()).endsWith("master.m3u8");
        assertThat(dto.getRenditions()).extracting(VideoDetailsDto.RenditionDto::getLabel).containsExactly("720p", "480p");
        assertThat(dto.getRenditions().get(0).getPlaylistUrl()).endsWith("720p/playlist.m3u8");
    }

    @Test
    void getUnknownVideoThrows() {
        when(metadataStore.getAsset("missing")).thenThrow(new VideoNotFoundException("missing"));

        assertThatThrownBy(() -> service.get("missing")).isInstanceOf(VideoNotFoundException.class);
    }

    @Test
    void deleteDelegatesToStore() {
        service.delete("v1");

        verify(metadataStore).deleteAsset("v1");
    }

    @Test
    void progressReturnsSnapshot() {
        ProgressEvent event = ProgressEvent.builder().jobId("v1").status(VideoStatus.PROCESSING).percent(42).build();
        when(progressBus.getSnapshot("v1")).thenReturn(Optional.of(event));

        assertThat(service.progress("v1")).isSameAs(event);
    }

    @Test
    void progressWithoutSnapshotIsNotFound() {
        when(progressBus.getSnapshot("v1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.progress("v1")).isInstanceOf(VideoNotFoundException.class);
    }
}
