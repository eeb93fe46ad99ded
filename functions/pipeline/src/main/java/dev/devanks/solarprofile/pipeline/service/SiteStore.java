package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.entity.PipelineStage;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.model.SiteUpsertResult;
import dev.devanks.solarprofile.pipeline.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Predicate;

@Service
@RequiredArgsConstructor
@Slf4j
public class SiteStore {

    private final SiteRepository siteRepository;

    /**
     * Inserts the site at {@link PipelineStage#DISCOVERED} when it is new, otherwise refreshes the
     * stored site's API-owned fields and keeps its stage markers.
     *
     * @param fresh site as just mapped from the monitoring API
     * @return the stored site and whether it was created
     */
    public Mono<SiteUpsertResult> upsert(SiteEntity fresh) {
        return siteRepository.findById(fresh.getId())
                .map(existing -> {
                    existing.refreshFrom(fresh);
                    return new SiteUpsertResult(existing, false);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    fresh.setStage(PipelineStage.DISCOVERED);
                    return new SiteUpsertResult(fresh, true);
                }))
                .flatMap(result -> siteRepository.save(result.getSite())
                        .map(saved -> new SiteUpsertResult(saved, result.isCreated())))
                .doOnSuccess(result -> log.debug("Upserted site {} (created: {})", fresh.getId(), result.isCreated()))
                .doOnError(e -> log.error("Failed to upsert site {}: {}", fresh.getId(), e.getMessage(), e));
    }

    public Flux<SiteEntity> getAll(Predicate<SiteEntity> filter) {
        return siteRepository.findAll()
                .filter(filter)
                .doOnError(e -> log.error("Error reading sites: {}", e.getMessage(), e));
    }

    public Flux<SiteEntity> getByStage(PipelineStage stage) {
        return siteRepository.findByStage(stage)
                .doOnComplete(() -> log.debug("Completed fetching sites at stage {}", stage))
                .doOnError(e -> log.error("Error fetching sites at stage {}: {}", stage, e.getMessage(), e));
    }

    public Mono<SiteEntity> getById(long siteId) {
        return siteRepository.findById(SiteEntity.documentId(siteId));
    }

    public Mono<SiteEntity> save(SiteEntity site) {
        return siteRepository.save(site)
                .doOnSuccess(saved -> log.debug("Saved site {} at stage {}", site.getId(), site.getStage()))
                .doOnError(e -> log.error("Failed to save site {}: {}", site.getId(), e.getMessage(), e));
    }
}
