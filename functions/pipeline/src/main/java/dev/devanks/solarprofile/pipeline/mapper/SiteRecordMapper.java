package dev.devanks.solarprofile.pipeline.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.model.MonitoringSiteRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.time.ZoneOffset.UTC;

/**
 * Maps raw site listing records to {@link SiteEntity}. Local dates are taken as UTC.
 */
@Component
@Slf4j
public class SiteRecordMapper {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("^\\d{10,}$");
    private static final Pattern PEAK_POWER = Pattern.compile("^\\s*(\\d+(?:[.,]\\d+)?)\\s*([A-Za-z]*)\\s*$");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy"));

    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    /**
     * @param rawRecord   one element of the listing's {@code records} array
     * @param refreshedAt time of the import run, stored as {@code updatedOn}
     * @return the mapped site, or empty when the record carries no id
     * @throws IllegalArgumentException when the record cannot be read as a site record
     */
    public Optional<SiteEntity> toEntity(JsonNode rawRecord, Instant refreshedAt) {
        MonitoringSiteRecord siteRecord;
        try {
            siteRecord = objectMapper.treeToValue(rawRecord, MonitoringSiteRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable site record: " + e.getOriginalMessage(), e);
        }
        if (siteRecord == null || siteRecord.getId() == null) {
            log.warn("Skipping site record without id: {}", rawRecord);
            return Optional.empty();
        }
        return Optional.of(toEntity(siteRecord, refreshedAt));
    }

    @VisibleForTesting
    SiteEntity toEntity(MonitoringSiteRecord siteRecord, Instant refreshedAt) {
        long siteId = siteRecord.getId();
        return SiteEntity.builder()
                .id(SiteEntity.documentId(siteId))
                .siteId(siteId)
                .name(firstNonBlank(siteRecord.getUrlName(), siteRecord.getName()))
                .type(siteRecord.getType())
                .status(siteRecord.getStatus())
                .country(siteRecord.getCountry())
                .state(siteRecord.getState())
                .city(siteRecord.getCity())
                .address(siteRecord.getAddress())
                .secondaryAddress(siteRecord.getSecondaryAddress())
                .zipCode(siteRecord.getZip())
                .location(siteRecord.getLocation())
                .latitude(siteRecord.getLatitude())
                .longitude(siteRecord.getLongitude())
                .timeZone(blankToNull(siteRecord.getTimeZone()))
                .peakPowerKw(parsePeakPowerKw(siteRecord.getPeakPower()))
                .installationDate(parseDate(siteRecord.getInstallationDate()))
                .lastReportingTime(parseDate(siteRecord.getLastReportingTime()))
                .updatedOn(refreshedAt)
                .build();
    }

    /**
     * Installed capacity in kW. Plain numbers are kW, a W suffix is divided by 1000.
     * Missing or unreadable values give 0.
     */
    static double parsePeakPowerKw(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        Matcher matcher = PEAK_POWER.matcher(value);
        if (!matcher.matches()) {
            log.warn("Unreadable peak power '{}', using 0.", value);
            return 0.0;
        }
        double amount = Double.parseDouble(matcher.group(1).replace(',', '.'));
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        if (unit.isEmpty() || unit.startsWith("kw")) {
            return amount;
        }
        if (unit.startsWith("mw")) {
            return amount * 1000.0;
        }
        if (unit.startsWith("w")) {
            return amount / 1000.0;
        }
        log.warn("Unknown peak power unit '{}' in '{}', using 0.", unit, value);
        return 0.0;
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        if (EPOCH_MILLIS.matcher(text).matches()) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("'{}' is not an ISO offset date-time", text);
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format).toInstant(UTC);
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format).atStartOfDay(UTC).toInstant();
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }
        log.warn("Unreadable date '{}', leaving it empty.", value);
        return null;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
