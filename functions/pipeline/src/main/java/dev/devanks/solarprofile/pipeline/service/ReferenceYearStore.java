package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.entity.ReferenceYearProfileEntity;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearPoint;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearProfile;
import dev.devanks.solarprofile.pipeline.repository.ReferenceYearProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceYearStore {

    private final ReferenceYearProfileRepository referenceYearRepository;

    /**
     * Replaces the site's whole reference year with {@code profile} in one document write.
     */
    public Mono<ReferenceYearProfileEntity> replaceAll(long siteId, ReferenceYearProfile profile, Instant computedOn) {
        var entity = ReferenceYearProfileEntity.builder()
                .id(SiteEntity.documentId(siteId))
                .siteId(siteId)
                .bucketMinutes(ProfileNormalizer.BUCKET_MINUTES)
                .leapDayPolicy(ProfileNormalizer.LEAP_DAY_POLICY)
                .perKwGeneration(profile.getPoints().stream()
                        .map(ReferenceYearPoint::getPerKwGeneration)
                        .toList())
                .observationCount(profile.getObservationCount())
                .yearsObserved(profile.getYearsObserved())
                .computedOn(computedOn)
                .build();
        return referenceYearRepository.save(entity)
                .doOnSuccess(saved -> log.info("Stored reference year of site {} ({} buckets).",
                        siteId, entity.getPerKwGeneration().size()))
                .doOnError(e -> log.error("Failed to store reference year of site {}: {}", siteId, e.getMessage(), e));
    }
}
