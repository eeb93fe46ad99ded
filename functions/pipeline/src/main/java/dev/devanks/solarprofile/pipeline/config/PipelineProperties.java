package dev.devanks.solarprofile.pipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @Data
    @Validated
    public static class Api {
        @NotEmpty
        @URL
        private String baseUrl;

        /** Path of the paginated site listing, relative to the base URL. */
        @NotEmpty
        private String sitesPath = "/solaredge-web/p/publicSystems";

        /** Path of the per-site chart export, {@code {siteId}} is expanded. */
        @NotEmpty
        private String exportPath = "/solaredge-web/p/charts/{siteId}/chartExport";

        @Min(1)
        private int pageSize = 100;

        /** Total attempts per request, including the first one. */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(2);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(30);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.5;

        /** Pause between two page requests of one import run. */
        @NotNull
        private Duration pageDelay = Duration.ofSeconds(1);

        /** Static headers sent with every request. */
        private Map<String, String> headers = new LinkedHashMap<>();

        /** Fixed query parameters of the site listing besides start/limit. */
        private Map<String, String> listParams = new LinkedHashMap<>();

        /** Fixed query parameters of the chart export besides st/et/fid. */
        private Map<String, String> exportParams = new LinkedHashMap<>();
    }

    @Data
    @Validated
    public static class Download {
        /** Countries whose sites get their CSV downloaded. Empty means every country. */
        private List<String> countries = new ArrayList<>();

        /** Spring resource location CSV files are written under, e.g. file:./csv_data or gs://bucket/csv. */
        @NotEmpty
        private String baseLocation = "file:./csv_data";
    }

    @Data
    @Validated
    public static class Csv {
        @NotEmpty
        private List<String> timestampColumns = new ArrayList<>(List.of("Time", "Timestamp", "timestamp"));

        @NotEmpty
        private List<String> productionColumns = new ArrayList<>(
                List.of("System Production (W)", "Production (W)", "production"));

        @Min(1)
        private int batchSize = 500;

        /** Zone local CSV timestamps are read in when neither the site nor its country declares one. */
        @NotNull
        private ZoneId defaultZone = ZoneOffset.UTC;

        /** Zone per country name, e.g. India=Asia/Kolkata. */
        private Map<String, ZoneId> countryZones = new LinkedHashMap<>();
    }

    @Data
    @Validated
    public static class Profile {
        /** Drop whole days whose production sums to zero before averaging. */
        private boolean excludeZeroProductionDays = true;

        @Min(1)
        private int minimumMonths = 12;
    }

    @NotNull
    @Valid
    private Api api = new Api();

    @NotNull
    @Valid
    private Download download = new Download();

    @NotNull
    @Valid
    private Csv csv = new Csv();

    @NotNull
    @Valid
    private Profile profile = new Profile();

    /**
     * Zone a site's local timestamps are expressed in: the site's declared zone,
     * else the zone configured for its country, else the CSV default.
     */
    public ZoneId resolveZone(String declaredZone, String country) {
        if (declaredZone != null && !declaredZone.isBlank()) {
            return ZoneId.of(declaredZone.trim());
        }
        if (country != null) {
            return csv.getCountryZones().entrySet().stream()
                    .filter(entry -> entry.getKey().equalsIgnoreCase(country.trim()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(csv.getDefaultZone());
        }
        return csv.getDefaultZone();
    }
}
