package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.config.PipelineProperties;
import dev.devanks.solarprofile.pipeline.entity.ProductionPointEntity;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.exception.InsufficientDataException;
import dev.devanks.solarprofile.pipeline.exception.ProfileConfigurationException;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearPoint;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProfileNormalizerTest {

    private static final long SITE_ID = 42L;

    private PipelineProperties properties;
    private ProfileNormalizer normalizer;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        normalizer = new ProfileNormalizer(properties);
    }

    @Test
    @DisplayName("compute - constant production gives a flat curve of production per kW")
    void compute_flatProduction() {
        // Arrange
        List<ProductionPointEntity> history = new ArrayList<>();
        hourly(history, LocalDate.of(2021, 1, 1), LocalDate.of(2023, 1, 1), time -> 2000.0);

        // Act
        ReferenceYearProfile profile = normalizer.compute(site(4.0), history);

        // Assert
        assertThat(profile.getPoints()).hasSize(ProfileNormalizer.BUCKETS_PER_YEAR);
        assertThat(profile.getPoints()).extracting(ReferenceYearPoint::getPerKwGeneration)
                .allSatisfy(value -> assertThat(value).isCloseTo(500.0, within(1e-9)));
        assertThat(profile.getPoints().get(0).getBucket()).isZero();
        assertThat(profile.getPoints().get(35039).getBucket()).isEqualTo(35039);
        assertThat(profile.getObservationCount()).isEqualTo(history.size());
        assertThat(profile.getYearsObserved()).containsExactly(2021, 2022);
    }

    @Test
    @DisplayName("compute - unobserved quarter hours are interpolated between their neighbours")
    void compute_interpolatesBetweenHours() {
        // Arrange
        List<ProductionPointEntity> history = new ArrayList<>();
        hourly(history, LocalDate.of(2021, 1, 1), LocalDate.of(2022, 1, 1), time -> time.getHour() == 12 ? 1000.0 : 0.0);

        // Act
        ReferenceYearProfile profile = normalizer.compute(site(2.0), history);

        // Assert
        List<ReferenceYearPoint> points = profile.getPoints();
        assertThat(points.get(48).getPerKwGeneration()).isEqualTo(500.0);
        assertThat(points.get(49).getPerKwGeneration()).isCloseTo(375.0, within(1e-9));
        assertThat(points.get(51).getPerKwGeneration()).isCloseTo(125.0, within(1e-9));
        assertThat(points.get(52).getPerKwGeneration()).isZero();
        assertThat(points.get(ProfileNormalizer.BUCKETS_PER_DAY + 48).getPerKwGeneration()).isEqualTo(500.0);
    }

    @Test
    @DisplayName("compute - days without any production are left out of the mean")
    void compute_excludesZeroProductionDays() {
        // Arrange
        List<ProductionPointEntity> history = new ArrayList<>();
        hourly(history, LocalDate.of(2021, 1, 1), LocalDate.of(2022, 1, 1), time -> 800.0);
        hourly(history, LocalDate.of(2022, 1, 1), LocalDate.of(2022, 2, 1), time -> 0.0);

        // Act
        ReferenceYearProfile profile = normalizer.compute(site(1.0), history);

        // Assert
        assertThat(profile.getPoints().get(40).getPerKwGeneration()).isEqualTo(800.0);
        assertThat(profile.getYearsObserved()).containsExactly(2021);
    }

    @Test
    @DisplayName("compute - zero production days count when exclusion is disabled")
    void compute_keepsZeroProductionDaysWhenConfigured() {
        // Arrange
        properties.getProfile().setExcludeZeroProductionDays(false);
        List<ProductionPointEntity> history = new ArrayList<>();
        hourly(history, LocalDate.of(2021, 1, 1), LocalDate.of(2022, 1, 1), time -> 800.0);
        hourly(history, LocalDate.of(2022, 1, 1), LocalDate.of(2022, 2, 1), time -> 0.0);

        // Act
        ReferenceYearProfile profile = normalizer.compute(site(1.0), history);

        // Assert
        assertThat(profile.getPoints().get(40).getPerKwGeneration()).isEqualTo(400.0);
        assertThat(profile.getYearsObserved()).containsExactly(2021, 2022);
    }

    @Test
    @DisplayName("compute - local days follow the site's zone")
    void compute_usesSiteZone() {
        // Arrange
        properties.getCsv().getCountryZones().put("India", ZoneId.of("Asia/Kolkata"));
        List<ProductionPointEntity> history = new ArrayList<>();
        hourly(history, LocalDate.of(2021, 1, 1), LocalDate.of(2022, 1, 1), time -> time.getHour() == 6 ? 100.0 : 0.0);
        SiteEntity site = site(1.0);
        site.setCountry("India");

        // Act
        ReferenceYearProfile profile = normalizer.compute(site, history);

        // Assert: 06:00 UTC is 11:30 in Kolkata
        assertThat(profile.getPoints().get(46).getPerKwGeneration()).isEqualTo(100.0);
        assertThat(profile.getPoints().get(24).getPerKwGeneration()).isZero();
    }

    @Test
    @DisplayName("compute - a site without capacity is rejected")
    void compute_rejectsZeroCapacity() {
        List<ProductionPointEntity> history = new ArrayList<>();
        hourly(history, LocalDate.of(2021, 1, 1), LocalDate.of(2022, 1, 1), time -> 1.0);

        assertThatThrownBy(() -> normalizer.compute(site(0.0), history))
                .isInstanceOf(ProfileConfigurationException.class)
                .hasMessageContaining("no usable installed capacity");
    }

    @Test
    @DisplayName("compute - history must cover every calendar month")
    void compute_rejectsMissingMonths() {
        // Arrange
        List<ProductionPointEntity> history = new ArrayList<>();
        hourly(history, LocalDate.of(2021, 1, 1), LocalDate.of(2021, 7, 1), time -> 1.0);

        // Act & Assert
        assertThatThrownBy(() -> normalizer.compute(site(1.0), history))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessage("Site 42 has data for 6 of 12 required months");
    }

    @Test
    @DisplayName("compute - an empty history is rejected")
    void compute_rejectsEmptyHistory() {
        assertThatThrownBy(() -> normalizer.compute(site(1.0), List.of()))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("no production history");
    }

    @Test
    @DisplayName("bucketOf - Feb 29 shares the buckets of Feb 28")
    void bucketOf_foldsLeapDay() {
        assertThat(ProfileNormalizer.bucketOf(LocalDateTime.of(2024, 2, 29, 10, 0)))
                .isEqualTo(ProfileNormalizer.bucketOf(LocalDateTime.of(2023, 2, 28, 10, 0)));
        assertThat(ProfileNormalizer.bucketOf(LocalDateTime.of(2024, 3, 1, 0, 0)))
                .isEqualTo(ProfileNormalizer.bucketOf(LocalDateTime.of(2023, 3, 1, 0, 0)))
                .isEqualTo(59 * ProfileNormalizer.BUCKETS_PER_DAY);
    }

    @Test
    @DisplayName("bucketOf - first and last slot of the year")
    void bucketOf_bounds() {
        assertThat(ProfileNormalizer.bucketOf(LocalDateTime.of(2022, 1, 1, 0, 14))).isZero();
        assertThat(ProfileNormalizer.bucketOf(LocalDateTime.of(2022, 1, 1, 0, 15))).isEqualTo(1);
        assertThat(ProfileNormalizer.bucketOf(LocalDateTime.of(2022, 12, 31, 23, 59)))
                .isEqualTo(ProfileNormalizer.BUCKETS_PER_YEAR - 1);
    }

    @Test
    @DisplayName("interpolateGaps - linear between neighbours, wrapping around the end")
    void interpolateGaps_wrapsAround() {
        double[] values = ProfileNormalizer.interpolateGaps(
                new double[]{4, 0, 0, 10, 0},
                new int[]{1, 0, 0, 2, 0});

        assertThat(values).containsExactly(new double[]{4, 13.0 / 3, 14.0 / 3, 5, 4.5}, within(1e-9));
    }

    @Test
    @DisplayName("interpolateGaps - a single observation fills every bucket")
    void interpolateGaps_singleObservation() {
        double[] values = ProfileNormalizer.interpolateGaps(new double[]{0, 0, 12, 0}, new int[]{0, 0, 2, 0});

        assertThat(values).containsExactly(6, 6, 6, 6);
    }

    @Test
    @DisplayName("interpolateGaps - nothing observed stays zero")
    void interpolateGaps_nothingObserved() {
        assertThat(ProfileNormalizer.interpolateGaps(new double[3], new int[3])).containsExactly(0, 0, 0);
    }

    private static SiteEntity site(double capacityKw) {
        return SiteEntity.builder()
                .id(SiteEntity.documentId(SITE_ID))
                .siteId(SITE_ID)
                .peakPowerKw(capacityKw)
                .build();
    }

    private static void hourly(List<ProductionPointEntity> history, LocalDate from, LocalDate until,
                               ToDoubleFunction<LocalDateTime> production) {
        for (LocalDateTime time = from.atStartOfDay(); time.isBefore(until.atStartOfDay()); time = time.plusHours(1)) {
            var timestamp = time.toInstant(ZoneOffset.UTC);
            history.add(ProductionPointEntity.builder()
                    .id(ProductionPointEntity.documentId(SITE_ID, timestamp))
                    .siteId(SITE_ID)
                    .timestamp(timestamp)
                    .productionW(production.applyAsDouble(time))
                    .build());
        }
    }
}
