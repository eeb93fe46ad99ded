package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.entity.PipelineStage;
import dev.devanks.solarprofile.pipeline.entity.ProductionPointEntity;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.exception.PipelineException;
import dev.devanks.solarprofile.pipeline.model.ItemError;
import dev.devanks.solarprofile.pipeline.model.ProfileSummary;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class YearlyProfileService {

    private final SiteStore siteStore;
    private final ProductionStore productionStore;
    private final ReferenceYearStore referenceYearStore;
    private final ProfileNormalizer profileNormalizer;
    private final Clock clock;

    /**
     * Computes the reference year of every uploaded site that has no profile yet.
     */
    public ProfileSummary calculateAll() {
        log.info("Starting yearly profile calculation for uploaded sites.");
        List<SiteEntity> sites = siteStore.getByStage(PipelineStage.UPLOADED).collectList().block();
        return calculate(sites == null ? List.of() : sites);
    }

    /**
     * Computes (or recomputes) the reference year of one uploaded site.
     */
    public ProfileSummary calculateSite(long siteId) {
        SiteEntity site = siteStore.getById(siteId).block();
        if (site == null) {
            throw new PipelineException("Unknown site " + siteId);
        }
        if (!site.hasReached(PipelineStage.UPLOADED)) {
            throw new PipelineException(String.format("Site %d has no uploaded production data (stage %s)", siteId, site.getStage()));
        }
        return calculate(List.of(site));
    }

    private ProfileSummary calculate(List<SiteEntity> sites) {
        var summary = ProfileSummary.builder();
        int profiled = 0;
        int failed = 0;
        for (SiteEntity site : sites) {
            try {
                List<ProductionPointEntity> history = productionStore.history(site.getSiteId()).collectList().block();
                ReferenceYearProfile profile = profileNormalizer.compute(site, history);
                Instant now = clock.instant();
                referenceYearStore.replaceAll(site.getSiteId(), profile, now).block();
                site.markProfiled(now);
                siteStore.save(site).block();
                profiled++;
            } catch (RuntimeException e) {
                log.warn("Site {}: no reference year computed: {}", site.getSiteId(), e.getMessage());
                failed++;
                summary.error(new ItemError("site " + site.getSiteId(), e.getMessage()));
            }
        }
        ProfileSummary result = summary.sitesProcessed(sites.size())
                .profiled(profiled)
                .failed(failed)
                .build();
        log.info(result.describe());
        return result;
    }
}
