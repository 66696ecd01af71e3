package com.xksgroup.vodpipeline.repo;

import com.xksgroup.vodpipeline.model.Rendition;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RenditionRepository extends MongoRepository<Rendition, String> {

    List<Rendition> findByVideoIdOrderByBandwidthEstimateDesc(String videoId);

    long deleteByVideoId(String videoId);
}
