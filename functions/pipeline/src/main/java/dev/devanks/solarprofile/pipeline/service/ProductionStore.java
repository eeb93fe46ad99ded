package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.entity.ProductionPointEntity;
import dev.devanks.solarprofile.pipeline.repository.ProductionPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static java.util.stream.Collectors.toSet;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductionStore {

    private final ProductionPointRepository productionRepository;

    /**
     * Timestamps already stored for the site, read once per CSV file.
     */
    public Mono<Set<Instant>> existingTimestamps(long siteId) {
        return productionRepository.findBySiteId(siteId)
                .map(ProductionPointEntity::getTimestamp)
                .collect(toSet())
                .doOnSuccess(timestamps -> log.debug("Site {} already has {} production point(s).", siteId, timestamps.size()));
    }

    public Mono<Void> insertBatch(long siteId, List<ProductionPointEntity> points) {
        if (points == null || points.isEmpty()) {
            log.debug("No production points to insert for site {}.", siteId);
            return Mono.empty();
        }
        log.debug("Inserting {} production point(s) for site {}.", points.size(), siteId);
        return productionRepository.saveAll(points)
                .then()
                .doOnSuccess(v -> log.debug("Inserted {} production point(s) for site {}.", points.size(), siteId))
                .doOnError(e -> log.error("Failed to insert {} production point(s) for site {}: {}",
                        points.size(), siteId, e.getMessage(), e));
    }

    public Flux<ProductionPointEntity> history(long siteId) {
        return productionRepository.findBySiteId(siteId)
                .doOnError(e -> log.error("Error reading production history of site {}: {}", siteId, e.getMessage(), e));
    }
}
