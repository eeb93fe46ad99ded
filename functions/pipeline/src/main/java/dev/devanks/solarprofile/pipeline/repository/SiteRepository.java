package dev.devanks.solarprofile.pipeline.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.solarprofile.pipeline.entity.PipelineStage;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface SiteRepository extends FirestoreReactiveRepository<SiteEntity> {

    Flux<SiteEntity> findByStage(PipelineStage stage);
}
