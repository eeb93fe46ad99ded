package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.entity.PipelineStage;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.exception.CsvIngestException;
import dev.devanks.solarprofile.pipeline.exception.PipelineException;
import dev.devanks.solarprofile.pipeline.model.IngestSummary;
import dev.devanks.solarprofile.pipeline.model.ItemError;
import dev.devanks.solarprofile.pipeline.model.UploadSummary;
import dev.devanks.solarprofile.pipeline.service.io.CsvResourceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Uploads the downloaded CSV of every site at {@link PipelineStage#CSV_DOWNLOADED} and moves the
 * site to {@link PipelineStage#UPLOADED} once its whole file is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductionUploadService {

    private final SiteStore siteStore;
    private final CsvIngestService csvIngestService;
    private final CsvResourceProvider resourceProvider;
    private final Clock clock;

    public UploadSummary uploadAll() {
        log.info("Starting production upload for sites with a downloaded CSV.");
        List<SiteEntity> sites = siteStore.getByStage(PipelineStage.CSV_DOWNLOADED).collectList().block();
        if (sites == null || sites.isEmpty()) {
            log.info("No sites waiting for production upload.");
            return UploadSummary.builder().build();
        }
        return upload(sites);
    }

    /**
     * Uploads a single site's CSV. The site must have its CSV downloaded; re-uploading an
     * uploaded site only adds rows that are not stored yet.
     */
    public UploadSummary uploadSite(long siteId) {
        SiteEntity site = siteStore.getById(siteId).block();
        if (site == null) {
            throw new PipelineException("Unknown site " + siteId);
        }
        if (!site.hasReached(PipelineStage.CSV_DOWNLOADED)) {
            throw new PipelineException(String.format("Site %d has no downloaded CSV (stage %s)", siteId, site.getStage()));
        }
        return upload(List.of(site));
    }

    private UploadSummary upload(List<SiteEntity> sites) {
        var summary = UploadSummary.builder();
        int uploaded = 0;
        int failed = 0;
        long rowsInserted = 0;
        long rowsSkipped = 0;

        for (SiteEntity site : sites) {
            String item = "site " + site.getSiteId();
            if (site.getCsvLocation() == null || site.getCsvLocation().isBlank()) {
                log.warn("Site {} has no CSV location, leaving it at {}.", site.getSiteId(), site.getStage());
                failed++;
                summary.error(new ItemError(item, "no CSV location"));
                continue;
            }
            Resource csv = resourceProvider.readableResource(site.getCsvLocation());
            if (!csv.exists()) {
                log.warn("CSV {} of site {} does not exist, leaving it at {}.", site.getCsvLocation(), site.getSiteId(), site.getStage());
                failed++;
                summary.error(new ItemError(item, "CSV not found: " + site.getCsvLocation()));
                continue;
            }
            try {
                IngestSummary ingested = csvIngestService.ingest(site, csv);
                rowsInserted += ingested.getRowsInserted();
                rowsSkipped += ingested.getRowsSkipped();
                site.markUploaded(clock.instant());
                siteStore.save(site).block();
                uploaded++;
            } catch (CsvIngestException e) {
                log.error("Upload of site {} failed, it stays eligible: {}", site.getSiteId(), e.getMessage());
                if (e.getPartialSummary() != null) {
                    rowsInserted += e.getPartialSummary().getRowsInserted();
                    rowsSkipped += e.getPartialSummary().getRowsSkipped();
                }
                failed++;
                summary.error(new ItemError(item, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Upload of site {} failed: {}", site.getSiteId(), e.getMessage(), e);
                failed++;
                summary.error(new ItemError(item, e.getMessage()));
            }
        }

        UploadSummary result = summary.sitesProcessed(sites.size())
                .sitesUploaded(uploaded)
                .sitesFailed(failed)
                .rowsInserted(rowsInserted)
                .rowsSkipped(rowsSkipped)
                .build();
        log.info(result.describe());
        return result;
    }
}
