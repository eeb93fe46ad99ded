package dev.devanks.solarprofile.pipeline.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

import static dev.devanks.solarprofile.pipeline.entity.PipelineStage.CSV_DOWNLOADED;
import static dev.devanks.solarprofile.pipeline.entity.PipelineStage.DISCOVERED;
import static dev.devanks.solarprofile.pipeline.entity.PipelineStage.PROFILED;
import static dev.devanks.solarprofile.pipeline.entity.PipelineStage.UPLOADED;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "solar_sites")
public class SiteEntity {

    @DocumentId
    private String id; // site id as text

    private Long siteId;
    private String name;
    private String type;
    private String status;

    private String country;
    private String state;
    private String city;
    private String address;
    private String secondaryAddress;
    private String zipCode;
    private String location;
    private Double latitude;
    private Double longitude;
    private String timeZone; // IANA id, optional

    private double peakPowerKw;
    private Instant installationDate;
    private Instant lastReportingTime;
    private Instant updatedOn;

    @Builder.Default
    private PipelineStage stage = DISCOVERED;
    private Instant csvDownloadedOn;
    private Instant uploadedOn;
    private Instant profileUpdatedOn;
    private String csvLocation;

    public static String documentId(long siteId) {
        return Long.toString(siteId);
    }

    public boolean hasReached(PipelineStage target) {
        return stage != null && stage.isAtLeast(target);
    }

    public void markCsvDownloaded(String location, Instant at) {
        advanceTo(CSV_DOWNLOADED);
        this.csvLocation = location;
        this.csvDownloadedOn = at;
    }

    public void markUploaded(Instant at) {
        advanceTo(UPLOADED);
        this.uploadedOn = at;
    }

    public void markProfiled(Instant at) {
        advanceTo(PROFILED);
        this.profileUpdatedOn = at;
    }

    /**
     * Copies the fields the monitoring API owns. Stage markers, CSV location and declared
     * time zone stay as they are.
     */
    public void refreshFrom(SiteEntity fresh) {
        this.name = fresh.getName();
        this.type = fresh.getType();
        this.status = fresh.getStatus();
        this.country = fresh.getCountry();
        this.state = fresh.getState();
        this.city = fresh.getCity();
        this.address = fresh.getAddress();
        this.secondaryAddress = fresh.getSecondaryAddress();
        this.zipCode = fresh.getZipCode();
        this.location = fresh.getLocation();
        this.latitude = fresh.getLatitude();
        this.longitude = fresh.getLongitude();
        this.peakPowerKw = fresh.getPeakPowerKw();
        this.installationDate = fresh.getInstallationDate();
        this.lastReportingTime = fresh.getLastReportingTime();
        this.updatedOn = fresh.getUpdatedOn();
        if (fresh.getTimeZone() != null) {
            this.timeZone = fresh.getTimeZone();
        }
    }

    private void advanceTo(PipelineStage target) {
        PipelineStage current = stage == null ? DISCOVERED : stage;
        if (!current.isAtLeast(target.previous())) {
            throw new IllegalStateException(String.format(
                    "Site %s cannot move to %s from %s", siteId, target, current));
        }
        if (!current.isAtLeast(target)) {
            this.stage = target;
        }
    }
}
