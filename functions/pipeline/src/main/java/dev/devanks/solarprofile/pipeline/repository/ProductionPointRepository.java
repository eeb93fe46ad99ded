package dev.devanks.solarprofile.pipeline.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.solarprofile.pipeline.entity.ProductionPointEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ProductionPointRepository extends FirestoreReactiveRepository<ProductionPointEntity> {

    Flux<ProductionPointEntity> findBySiteId(Long siteId);
}
