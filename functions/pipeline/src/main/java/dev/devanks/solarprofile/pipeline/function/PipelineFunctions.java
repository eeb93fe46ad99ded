package dev.devanks.solarprofile.pipeline.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarprofile.pipeline.service.ProductionUploadService;
import dev.devanks.solarprofile.pipeline.service.SiteCsvDownloadService;
import dev.devanks.solarprofile.pipeline.service.SiteImportService;
import dev.devanks.solarprofile.pipeline.service.YearlyProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One function bean per pipeline stage. Each returns the stage's summary line and never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineFunctions {

    static final String LIMIT = "limit";
    static final String SITE_ID = "siteId";

    private final SiteImportService siteImportService;
    private final SiteCsvDownloadService siteCsvDownloadService;
    private final ProductionUploadService productionUploadService;
    private final YearlyProfileService yearlyProfileService;

    /**
     * Imports sites from the monitoring API. Optional payload key {@code limit} caps the number of records.
     */
    @Bean
    public Function<HashMap<String, Object>, String> importSites() {
        return payload -> {
            log.info("importSites function triggered with payload: {}", payload);
            return run("Site import", () -> {
                Long limit = numberFrom(payload, LIMIT);
                return siteImportService.run(limit == null ? null : Math.toIntExact(limit)).describe();
            });
        };
    }

    @Bean
    public Function<HashMap<String, Object>, String> downloadSiteCsvs() {
        return payload -> {
            log.info("downloadSiteCsvs function triggered with payload: {}", payload);
            return run("CSV download", () -> siteCsvDownloadService.downloadAll().describe());
        };
    }

    /**
     * Uploads downloaded CSVs. Optional payload key {@code siteId} restricts the run to one site.
     */
    @Bean
    public Function<HashMap<String, Object>, String> uploadProductionData() {
        return payload -> {
            log.info("uploadProductionData function triggered with payload: {}", payload);
            return run("Production upload", () -> {
                Long siteId = numberFrom(payload, SITE_ID);
                return siteId == null
                        ? productionUploadService.uploadAll().describe()
                        : productionUploadService.uploadSite(siteId).describe();
            });
        };
    }

    /**
     * Calculates reference years. Optional payload key {@code siteId} recomputes one site.
     */
    @Bean
    public Function<HashMap<String, Object>, String> calculateProfiles() {
        return payload -> {
            log.info("calculateProfiles function triggered with payload: {}", payload);
            return run("Yearly profile calculation", () -> {
                Long siteId = numberFrom(payload, SITE_ID);
                return siteId == null
                        ? yearlyProfileService.calculateAll().describe()
                        : yearlyProfileService.calculateSite(siteId).describe();
            });
        };
    }

    private String run(String stage, Supplier<String> work) {
        try {
            return work.get();
        } catch (Exception e) {
            log.error("{} failed: {}", stage, e.getMessage(), e);
            return stage + " failed: " + e.getMessage();
        }
    }

    @VisibleForTesting
    static Long numberFrom(Map<String, Object> payload, String key) {
        if (payload == null || payload.get(key) == null) {
            return null;
        }
        Object value = payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid '%s' in payload: %s", key, value), e);
        }
    }
}
