package dev.devanks.solarprofile.pipeline.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarprofile.pipeline.config.PipelineProperties;
import dev.devanks.solarprofile.pipeline.entity.PipelineStage;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.model.DownloadSummary;
import dev.devanks.solarprofile.pipeline.model.ItemError;
import dev.devanks.solarprofile.pipeline.service.io.CsvResourceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Downloads the production CSV export of every discovered site in the configured countries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteCsvDownloadService {

    private final SiteStore siteStore;
    private final MonitoringApiService apiService;
    private final CsvResourceProvider resourceProvider;
    private final PipelineProperties properties;
    private final Clock clock;

    public DownloadSummary downloadAll() {
        List<String> countries = properties.getDownload().getCountries();
        log.info("Starting CSV download for discovered sites (countries: {}).", countries.isEmpty() ? "all" : countries);

        List<SiteEntity> sites = siteStore.getByStage(PipelineStage.DISCOVERED)
                .filter(site -> isInScope(site, countries))
                .collectList()
                .block();

        var summary = DownloadSummary.builder();
        int downloaded = 0;
        int skipped = 0;
        int failed = 0;
        for (SiteEntity site : sites == null ? List.<SiteEntity>of() : sites) {
            Instant start = site.getCsvDownloadedOn() != null ? site.getCsvDownloadedOn() : site.getInstallationDate();
            Instant end = site.getLastReportingTime();
            if (start == null || end == null) {
                log.warn("Site {}: skipping, cannot determine the download window (start {}, end {}).", site.getSiteId(), start, end);
                skipped++;
                continue;
            }
            if (end.isBefore(start)) {
                log.info("Site {}: skipping, last reporting time {} is before {}. No new data to fetch.", site.getSiteId(), end, start);
                skipped++;
                continue;
            }
            try {
                downloadSite(site, start, end);
                downloaded++;
            } catch (IOException | RuntimeException e) {
                log.error("Site {}: CSV download failed: {}", site.getSiteId(), e.getMessage(), e);
                failed++;
                summary.error(new ItemError("site " + site.getSiteId(), e.getMessage()));
            }
        }

        DownloadSummary result = summary.sitesConsidered(sites == null ? 0 : sites.size())
                .downloaded(downloaded)
                .skipped(skipped)
                .failed(failed)
                .build();
        log.info(result.describe());
        return result;
    }

    private void downloadSite(SiteEntity site, Instant start, Instant end) throws IOException {
        String location = csvLocation(site);
        byte[] csv = apiService.downloadSiteCsv(site.getSiteId(), start, end).block();
        if (csv == null) {
            throw new IOException("Empty CSV export response");
        }
        WritableResource resource = resourceProvider.writableResource(location);
        try (OutputStream out = resource.getOutputStream()) {
            out.write(csv);
        }
        log.info("Site {}: wrote {} byte(s) of CSV to {}", site.getSiteId(), csv.length, location);

        site.markCsvDownloaded(location, clock.instant());
        siteStore.save(site).block();
    }

    @VisibleForTesting
    String csvLocation(SiteEntity site) {
        String base = properties.getDownload().getBaseLocation();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return String.format("%s/%s/%s/%s/%d_%s.csv", base,
                sanitize(site.getCountry()), sanitize(site.getState()), sanitize(site.getCity()),
                site.getSiteId(), sanitize(site.getName()));
    }

    static String sanitize(String part) {
        if (part == null) {
            return "unknown";
        }
        String cleaned = part.replaceAll("[^\\w\\s-]", "").trim().replaceAll("[-\\s]+", "-");
        return cleaned.isEmpty() ? "unknown" : cleaned;
    }

    private static boolean isInScope(SiteEntity site, List<String> countries) {
        return countries.isEmpty() || (site.getCountry() != null
                && countries.stream().anyMatch(country -> country.equalsIgnoreCase(site.getCountry().trim())));
    }
}
