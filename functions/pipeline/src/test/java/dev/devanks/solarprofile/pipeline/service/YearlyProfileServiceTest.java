package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.entity.PipelineStage;
import dev.devanks.solarprofile.pipeline.entity.ProductionPointEntity;
import dev.devanks.solarprofile.pipeline.entity.ReferenceYearProfileEntity;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.exception.InsufficientDataException;
import dev.devanks.solarprofile.pipeline.exception.PipelineException;
import dev.devanks.solarprofile.pipeline.model.ProfileSummary;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class YearlyProfileServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-03T06:00:00Z");

    @Mock
    private SiteStore mockSiteStore;
    @Mock
    private ProductionStore mockProductionStore;
    @Mock
    private ReferenceYearStore mockReferenceYearStore;
    @Mock
    private ProfileNormalizer mockNormalizer;

    private YearlyProfileService profileService;

    @BeforeEach
    void setUp() {
        profileService = new YearlyProfileService(mockSiteStore, mockProductionStore, mockReferenceYearStore,
                mockNormalizer, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("calculateAll - stores the profile and moves the site to PROFILED")
    void calculateAll_success() {
        // Arrange
        SiteEntity site = uploadedSite(3L);
        List<ProductionPointEntity> history = List.of(ProductionPointEntity.builder().siteId(3L).timestamp(NOW).build());
        ReferenceYearProfile profile = ReferenceYearProfile.builder().siteId(3L).points(List.of()).build();
        when(mockSiteStore.getByStage(PipelineStage.UPLOADED)).thenReturn(Flux.just(site));
        when(mockProductionStore.history(3L)).thenReturn(Flux.fromIterable(history));
        when(mockNormalizer.compute(site, history)).thenReturn(profile);
        when(mockReferenceYearStore.replaceAll(3L, profile, NOW)).thenReturn(Mono.just(new ReferenceYearProfileEntity()));
        when(mockSiteStore.save(site)).thenReturn(Mono.just(site));

        // Act
        ProfileSummary summary = profileService.calculateAll();

        // Assert
        assertThat(summary.getProfiled()).isEqualTo(1);
        assertThat(summary.getFailed()).isZero();
        assertThat(site.getStage()).isEqualTo(PipelineStage.PROFILED);
        assertThat(site.getProfileUpdatedOn()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("calculateAll - a site with too little data fails alone")
    void calculateAll_insufficientData() {
        // Arrange
        SiteEntity sparse = uploadedSite(3L);
        SiteEntity complete = uploadedSite(4L);
        ReferenceYearProfile profile = ReferenceYearProfile.builder().siteId(4L).points(List.of()).build();
        when(mockSiteStore.getByStage(PipelineStage.UPLOADED)).thenReturn(Flux.just(sparse, complete));
        when(mockProductionStore.history(anyLong())).thenReturn(Flux.empty());
        when(mockNormalizer.compute(sparse, List.of()))
                .thenThrow(new InsufficientDataException("Site 3 has data for 4 of 12 required months"));
        when(mockNormalizer.compute(complete, List.of())).thenReturn(profile);
        when(mockReferenceYearStore.replaceAll(4L, profile, NOW)).thenReturn(Mono.just(new ReferenceYearProfileEntity()));
        when(mockSiteStore.save(complete)).thenReturn(Mono.just(complete));

        // Act
        ProfileSummary summary = profileService.calculateAll();

        // Assert
        assertThat(summary.getSitesProcessed()).isEqualTo(2);
        assertThat(summary.getProfiled()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getErrors().get(0).getItem()).isEqualTo("site 3");
        assertThat(sparse.getStage()).isEqualTo(PipelineStage.UPLOADED);
        verify(mockSiteStore, never()).save(sparse);
    }

    @Test
    @DisplayName("calculateAll - a failed profile write leaves the stage unchanged")
    void calculateAll_storeFailure() {
        // Arrange
        SiteEntity site = uploadedSite(3L);
        ReferenceYearProfile profile = ReferenceYearProfile.builder().siteId(3L).points(List.of()).build();
        when(mockSiteStore.getByStage(PipelineStage.UPLOADED)).thenReturn(Flux.just(site));
        when(mockProductionStore.history(3L)).thenReturn(Flux.empty());
        when(mockNormalizer.compute(site, List.of())).thenReturn(profile);
        when(mockReferenceYearStore.replaceAll(3L, profile, NOW))
                .thenReturn(Mono.error(new IllegalStateException("Firestore unavailable")));

        // Act
        ProfileSummary summary = profileService.calculateAll();

        // Assert
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(site.getStage()).isEqualTo(PipelineStage.UPLOADED);
        verify(mockSiteStore, never()).save(any());
    }

    @Test
    @DisplayName("calculateSite - recomputes a profiled site")
    void calculateSite_recompute() {
        // Arrange
        SiteEntity site = uploadedSite(3L);
        site.markProfiled(Instant.parse("2024-01-01T00:00:00Z"));
        ReferenceYearProfile profile = ReferenceYearProfile.builder().siteId(3L).points(List.of()).build();
        when(mockSiteStore.getById(3L)).thenReturn(Mono.just(site));
        when(mockProductionStore.history(3L)).thenReturn(Flux.empty());
        when(mockNormalizer.compute(site, List.of())).thenReturn(profile);
        when(mockReferenceYearStore.replaceAll(3L, profile, NOW)).thenReturn(Mono.just(new ReferenceYearProfileEntity()));
        when(mockSiteStore.save(site)).thenReturn(Mono.just(site));

        // Act
        ProfileSummary summary = profileService.calculateSite(3L);

        // Assert
        assertThat(summary.getProfiled()).isEqualTo(1);
        assertThat(site.getProfileUpdatedOn()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("calculateSite - rejects sites without uploaded data")
    void calculateSite_rejectsIneligible() {
        // Arrange
        when(mockSiteStore.getById(5L)).thenReturn(Mono.just(SiteEntity.builder().siteId(5L).build()));
        when(mockSiteStore.getById(6L)).thenReturn(Mono.empty());

        // Act & Assert
        assertThatThrownBy(() -> profileService.calculateSite(5L))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("no uploaded production data");
        assertThatThrownBy(() -> profileService.calculateSite(6L))
                .isInstanceOf(PipelineException.class)
                .hasMessage("Unknown site 6");
    }

    private static SiteEntity uploadedSite(long siteId) {
        SiteEntity site = SiteEntity.builder().id(SiteEntity.documentId(siteId)).siteId(siteId).peakPowerKw(5).build();
        site.markCsvDownloaded("file:./csv_data/" + siteId + ".csv", Instant.parse("2024-04-01T00:00:00Z"));
        site.markUploaded(Instant.parse("2024-04-02T00:00:00Z"));
        return site;
    }
}
