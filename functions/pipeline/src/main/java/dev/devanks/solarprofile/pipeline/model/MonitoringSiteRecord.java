package dev.devanks.solarprofile.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the {@code records} array of the public site listing.
 * Dates and peak power arrive in several textual shapes and are parsed by the mapper.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitoringSiteRecord {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("urlName")
    private String urlName;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("status")
    private String status;

    @JsonProperty("lastReportingTime")
    private String lastReportingTime;

    @JsonProperty("installationDate")
    private String installationDate;

    @JsonProperty("country")
    private String country;

    @JsonProperty("state")
    private String state;

    @JsonProperty("city")
    private String city;

    @JsonProperty("address")
    private String address;

    @JsonProperty("secondaryAddress")
    private String secondaryAddress;

    @JsonProperty("zip")
    private String zip;

    @JsonProperty("location")
    private String location;

    @JsonProperty("latitude")
    private Double latitude;

    @JsonProperty("longitude")
    private Double longitude;

    @JsonProperty("peakPower")
    private String peakPower; // kW, sometimes with a unit suffix

    @JsonProperty("timeZone")
    private String timeZone;
}
