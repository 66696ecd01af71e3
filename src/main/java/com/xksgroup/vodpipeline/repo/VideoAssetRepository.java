package com.xksgroup.vodpipeline.repo;

import com.xksgroup.vodpipeline.model.VideoAsset;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VideoAssetRepository extends MongoRepository<VideoAsset, String> {

    Page<VideoAsset> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
