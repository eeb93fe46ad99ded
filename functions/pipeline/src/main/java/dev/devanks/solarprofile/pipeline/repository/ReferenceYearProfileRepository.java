package dev.devanks.solarprofile.pipeline.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.solarprofile.pipeline.entity.ReferenceYearProfileEntity;

public interface ReferenceYearProfileRepository extends FirestoreReactiveRepository<ReferenceYearProfileEntity> {
}
