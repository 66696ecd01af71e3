package com.xksgroup.vodpipeline.service;

import com.xksgroup.vodpipeline.exception.PersistenceException;
import com.xksgroup.vodpipeline.exception.VideoNotFoundException;
import com.xksgroup.vodpipeline.model.Rendition;
import com.xksgroup.vodpipeline.model.VideoAsset;
import com.xksgroup.vodpipeline.model.VideoStatus;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import com.xksgroup.vodpipeline.repo.RenditionRepository;
import com.xksgroup.vodpipeline.repo.VideoAssetRepository;
import com.xksgroup.vodpipeline.service.transcode.MediaProbe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * VideoAsset and Rendition records. Every storage failure surfaces as {@link PersistenceException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VideoMetadataStore {

    private final VideoAssetRepository videoAssetRepository;
    private final RenditionRepository renditionRepository;
    private final Clock clock;

    public VideoAsset createAsset(VideoJob job, long fileSize) {
        Instant now = clock.instant();
        VideoAsset asset = VideoAsset.builder()
                .id(job.getJobId())
                .originalName(job.getOriginalName())
                .sourceLocation(job.getSourceLocation())
                .status(VideoStatus.WAITING)
                .fileSize(fileSize)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return guarded("create asset " + job.getJobId(), () -> videoAssetRepository.save(asset));
    }

    public Optional<VideoAsset> findAsset(String videoId) {
        return guarded("read asset " + videoId, () -> videoAssetRepository.findById(videoId));
    }

    public VideoAsset getAsset(String videoId) {
        return findAsset(videoId).orElseThrow(() -> new VideoNotFoundException(videoId));
    }

    public Page<VideoAsset> listAssets(int page, int size) {
        return guarded("list assets", () ->
                videoAssetRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(page, size)));
    }

    /**
     * Move the asset to PROCESSING, creating it from the job when the producer's record is missing.
     * Clears any error and completion stamp left by an earlier attempt.
     */
    public VideoAsset markProcessing(VideoJob job) {
        return guarded("mark processing " + job.getJobId(), () -> {
            Instant now = clock.instant();
            VideoAsset asset = videoAssetRepository.findById(job.getJobId()).orElseGet(() -> VideoAsset.builder()
                    .id(job.getJobId())
                    .originalName(job.getOriginalName())
                    .sourceLocation(job.getSourceLocation())
                    .status(VideoStatus.WAITING)
                    .createdAt(now)
                    .build());

            asset.setStatus(asset.getStatus().transitionTo(VideoStatus.PROCESSING));
            asset.setErrorMessage(null);
            asset.setCompletedAt(null);
            asset.setUpdatedAt(now);
            return videoAssetRepository.save(asset);
        });
    }

    public void updateProbe(String videoId, MediaProbe probe) {
        update(videoId, "store probe", asset -> {
            asset.setSourceWidth(probe.getWidth());
            asset.setSourceHeight(probe.getHeight());
            asset.setDurationSeconds(probe.getDurationSeconds());
        });
    }

    public void updateMasterManifest(String videoId, String location, String url) {
        update(videoId, "store master manifest", asset -> {
            asset.setMasterManifestLocation(location);
            asset.setMasterManifestUrl(url);
        });
    }

    public void markCompleted(String videoId) {
        update(videoId, "mark completed", asset -> {
            asset.setStatus(asset.getStatus().transitionTo(VideoStatus.COMPLETED));
            asset.setErrorMessage(null);
            asset.setCompletedAt(clock.instant());
        });
    }

    public void markFailed(String videoId, String errorMessage) {
        update(videoId, "mark failed", asset -> {
            if (asset.getStatus() == VideoStatus.COMPLETED) {
                log.warn("Asset {} is already completed, not marking it failed", videoId);
                return;
            }
            asset.setStatus(asset.getStatus().transitionTo(VideoStatus.FAILED));
            asset.setErrorMessage(errorMessage);
        });
    }

    /**
     * Upsert keyed by {@link Rendition#idFor}, so reprocessing never duplicates rows.
     */
    public Rendition saveRendition(Rendition rendition) {
        rendition.setId(Rendition.idFor(rendition.getVideoId(), rendition.getLabel()));
        return guarded("save rendition " + rendition.getId(), () -> renditionRepository.save(rendition));
    }

    public List<Rendition> listRenditions(String videoId) {
        return guarded("list renditions " + videoId, () ->
                renditionRepository.findByVideoIdOrderByBandwidthEstimateDesc(videoId));
    }

    /**
     * Delete the asset and its renditions. Stored artifacts are left in place.
     */
    public void deleteAsset(String videoId) {
        guarded("delete asset " + videoId, () -> {
            if (!videoAssetRepository.existsById(videoId)) {
                throw new VideoNotFoundException(videoId);
            }
            long removed = renditionRepository.deleteByVideoId(videoId);
            videoAssetRepository.deleteById(videoId);
            log.info("Deleted asset {} and {} renditions", videoId, removed);
            return null;
        });
    }

    private void update(String videoId, String operation, AssetMutation mutation) {
        guarded(operation + " " + videoId, () -> {
            VideoAsset asset = videoAssetRepository.findById(videoId)
                    .orElseThrow(() -> new VideoNotFoundException(videoId));
            mutation.apply(asset);
            asset.setUpdatedAt(clock.instant());
            return videoAssetRepository.save(asset);
        });
    }

    private static <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to " + operation, e);
        }
    }

    @FunctionalInterface
    private interface AssetMutation {
        void apply(VideoAsset asset);
    }
}
