package dev.devanks.solarprofile.pipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devanks.solarprofile.pipeline.config.PipelineProperties;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.exception.FetchException;
import dev.devanks.solarprofile.pipeline.mapper.SiteRecordMapper;
import dev.devanks.solarprofile.pipeline.model.ImportSummary;
import dev.devanks.solarprofile.pipeline.model.ItemError;
import dev.devanks.solarprofile.pipeline.model.SitePage;
import dev.devanks.solarprofile.pipeline.model.SiteUpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Walks the paginated site listing and upserts every site it returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteImportService {

    private final MonitoringApiService apiService;
    private final SiteRecordMapper siteRecordMapper;
    private final SiteStore siteStore;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Imports sites page by page until a page comes back empty, {@code limit} records were
     * fetched or the reported total is reached. A page that cannot be fetched ends the run;
     * whatever was stored before stays stored.
     *
     * @param limit maximum number of records to fetch, {@code null} for all of them
     * @return counts of the run, {@code aborted} set when a page fetch failed
     */
    public ImportSummary run(Integer limit) {
        Instant start = clock.instant();
        int pageSize = properties.getApi().getPageSize();
        log.info("Starting site import (page size {}, limit {}).", pageSize, limit == null ? "none" : limit);

        var summary = ImportSummary.builder();
        int offset = 0;
        int pages = 0;
        int fetched = 0;
        int created = 0;
        int updated = 0;
        int skipped = 0;

        while (limit == null || fetched < limit) {
            int requested = limit == null ? pageSize : Math.min(pageSize, limit - fetched);
            SitePage page;
            try {
                page = apiService.fetchPage(offset, requested).block();
            } catch (FetchException e) {
                log.error("Site import aborted at offset {} after {} attempt(s): {}", offset, e.getAttempts(), e.getMessage(), e);
                summary.aborted(true).failure(e.getMessage());
                break;
            }
            pages++;
            if (page == null || page.getRecords().isEmpty()) {
                log.info("Empty page at offset {}, listing exhausted.", offset);
                break;
            }

            List<JsonNode> records = page.getRecords();
            int usable = limit == null ? records.size() : Math.min(records.size(), limit - fetched);
            for (JsonNode rawRecord : records.subList(0, usable)) {
                fetched++;
                try {
                    Optional<SiteEntity> site = siteRecordMapper.toEntity(rawRecord, start);
                    if (site.isEmpty()) {
                        skipped++;
                        continue;
                    }
                    SiteUpsertResult result = siteStore.upsert(site.get()).block();
                    if (result != null && result.isCreated()) {
                        created++;
                    } else {
                        updated++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Skipping site record at offset {}: {}", offset, e.getMessage());
                    skipped++;
                    summary.error(new ItemError(describe(rawRecord), e.getMessage()));
                }
            }
            offset += records.size();

            if (page.isTotalKnown() && offset >= page.getTotalCount()) {
                log.info("Reached reported total of {} record(s).", page.getTotalCount());
                break;
            }
            if (limit != null && fetched >= limit) {
                break;
            }
            if (!pauseBetweenPages()) {
                summary.aborted(true).failure("Interrupted between pages");
                break;
            }
        }

        ImportSummary result = summary.pagesFetched(pages)
                .fetched(fetched)
                .created(created)
                .updated(updated)
                .skipped(skipped)
                .build();
        long duration = ChronoUnit.MILLIS.between(start, clock.instant());
        log.info("{} Took {} ms.", result.describe(), duration);
        return result;
    }

    private boolean pauseBetweenPages() {
        Duration delay = properties.getApi().getPageDelay();
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            log.warn("Site import interrupted while pausing between pages.");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(JsonNode rawRecord) {
        JsonNode id = rawRecord.path("id");
        return id.isMissingNode() || id.isNull() ? "site record" : "site " + id.asText();
    }
}
