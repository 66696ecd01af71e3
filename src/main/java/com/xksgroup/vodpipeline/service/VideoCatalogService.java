package com.xksgroup.vodpipeline.service;

import com.xksgroup.vodpipeline.exception.VideoNotFoundException;
import com.xksgroup.vodpipeline.model.Rendition;
import com.xksgroup.vodpipeline.model.VideoAsset;
import com.xksgroup.vodpipeline.model.dto.VideoDetailsDto;
import com.xksgroup.vodpipeline.model.progress.ProgressEvent;
import com.xksgroup.vodpipeline.progress.ProgressBus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class VideoCatalogService {

    static final int MAX_PAGE_SIZE = 100;

    private final VideoMetadataStore metadataStore;
    private final ProgressBus progressBus;

    public Page<VideoDetailsDto> list(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return metadataStore.listAssets(page, size).map(VideoDetailsDto::fromAsset);
    }

    public VideoDetailsDto get(String videoId) {
        VideoAsset asset = metadataStore.getAsset(videoId);
        List<Rendition> renditions = metadataStore.listRenditions(videoId);
        return VideoDetailsDto.fromAsset(asset, renditions);
    }

    public void delete(String videoId) {
        metadataStore.deleteAsset(videoId);
    }

    /**
     * Latest progress snapshot; unknown once it has expired.
     */
    public ProgressEvent progress(String videoId) {
        Optional<ProgressEvent> snapshot = progressBus.getSnapshot(videoId);
        if (snapshot.isPresent()) {
            return snapshot.get();
        }
        throw new VideoNotFoundException(videoId);
    }
}
