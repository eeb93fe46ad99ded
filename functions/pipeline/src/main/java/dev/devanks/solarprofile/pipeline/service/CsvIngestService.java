package dev.devanks.solarprofile.pipeline.service;

import com.google.common.collect.Lists;
import dev.devanks.solarprofile.pipeline.config.PipelineProperties;
import dev.devanks.solarprofile.pipeline.entity.ProductionPointEntity;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.exception.CsvIngestException;
import dev.devanks.solarprofile.pipeline.model.IngestRowError;
import dev.devanks.solarprofile.pipeline.model.IngestSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.supercsv.exception.SuperCsvException;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.ICsvListReader;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads one site's production CSV and stores the rows that are not stored yet.
 * Bad rows are counted and skipped; only an unusable file or a failed write is fatal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvIngestService {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss]"));

    private final ProductionStore productionStore;
    private final PipelineProperties properties;

    /**
     * @param site owner of the rows, its zone applies to local timestamps
     * @param csv  the CSV export
     * @return counts of the file
     * @throws CsvIngestException when the file cannot be read, lacks the needed columns or a batch
     *                            write fails; batches written before stay written
     */
    public IngestSummary ingest(SiteEntity site, Resource csv) {
        long siteId = site.getSiteId();
        ZoneId zone = zoneOf(site);
        var csvProperties = properties.getCsv();
        log.info("Ingesting {} for site {} (local timestamps in {}).", csv.getDescription(), siteId, zone);

        var summary = IngestSummary.builder().siteId(siteId);
        List<ProductionPointEntity> toInsert = new ArrayList<>();
        long rowsRead = 0;
        long rowsSkipped = 0;

        try (ICsvListReader reader = new CsvListReader(
                new InputStreamReader(csv.getInputStream(), UTF_8), CsvPreference.STANDARD_PREFERENCE)) {
            String[] header = reader.getHeader(true);
            if (header == null) {
                throw new CsvIngestException("CSV has no header row: " + csv.getDescription(), summary.build());
            }
            int timeIndex = columnIndex(header, csvProperties.getTimestampColumns());
            int productionIndex = columnIndex(header, csvProperties.getProductionColumns());
            if (timeIndex < 0 || productionIndex < 0) {
                throw new CsvIngestException(String.format("CSV header %s lacks a timestamp column %s or a production column %s",
                        List.of(header), csvProperties.getTimestampColumns(), csvProperties.getProductionColumns()),
                        summary.build());
            }

            Set<Instant> existing = productionStore.existingTimestamps(siteId).block();
            Set<Instant> known = existing == null ? new HashSet<>() : new HashSet<>(existing);

            while (true) {
                List<String> row;
                try {
                    row = reader.read();
                } catch (SuperCsvException e) {
                    rowsRead++;
                    rowsSkipped++;
                    summary.rowError(rowError(reader, "malformed row: " + e.getMessage()));
                    continue;
                }
                if (row == null) {
                    break;
                }
                rowsRead++;
                if (row.size() <= Math.max(timeIndex, productionIndex)) {
                    rowsSkipped++;
                    summary.rowError(rowError(reader, "not enough columns"));
                    continue;
                }
                Instant timestamp = parseTimestamp(row.get(timeIndex), zone);
                if (timestamp == null) {
                    rowsSkipped++;
                    summary.rowError(rowError(reader, "unparseable timestamp '" + row.get(timeIndex) + "'"));
                    continue;
                }
                Double production = parseProduction(row.get(productionIndex));
                if (production == null) {
                    rowsSkipped++;
                    summary.rowError(rowError(reader, "non-numeric production '" + row.get(productionIndex) + "'"));
                    continue;
                }
                if (!known.add(timestamp)) {
                    log.trace("Site {}: {} already stored or repeated in file, skipping.", siteId, timestamp);
                    rowsSkipped++;
                    continue;
                }
                toInsert.add(ProductionPointEntity.builder()
                        .id(ProductionPointEntity.documentId(siteId, timestamp))
                        .siteId(siteId)
                        .timestamp(timestamp)
                        .productionW(production)
                        .build());
            }
        } catch (IOException e) {
            log.error("Site {}: cannot read {}: {}", siteId, csv.getDescription(), e.getMessage(), e);
            throw new CsvIngestException("Cannot read CSV " + csv.getDescription() + ": " + e.getMessage(),
                    summary.rowsRead(rowsRead).rowsSkipped(rowsSkipped).build(), e);
        }

        summary.rowsRead(rowsRead).rowsSkipped(rowsSkipped);
        long inserted = 0;
        for (List<ProductionPointEntity> batch : Lists.partition(toInsert, csvProperties.getBatchSize())) {
            try {
                productionStore.insertBatch(siteId, batch).block();
            } catch (RuntimeException e) {
                log.error("Site {}: batch write failed after {} inserted row(s): {}", siteId, inserted, e.getMessage(), e);
                throw new CsvIngestException(String.format("Batch write failed for site %d after %d inserted row(s): %s",
                        siteId, inserted, e.getMessage()), summary.rowsInserted(inserted).build(), e);
            }
            inserted += batch.size();
            log.debug("Site {}: {} of {} new row(s) written.", siteId, inserted, toInsert.size());
        }

        IngestSummary result = summary.rowsInserted(inserted).build();
        log.info("Site {}: CSV ingested. Rows read: {}, inserted: {}, skipped: {}, row errors: {}.",
                siteId, result.getRowsRead(), result.getRowsInserted(), result.getRowsSkipped(), result.getRowErrors().size());
        return result;
    }

    private ZoneId zoneOf(SiteEntity site) {
        try {
            return properties.resolveZone(site.getTimeZone(), site.getCountry());
        } catch (DateTimeException e) {
            log.warn("Site {} declares an unknown time zone '{}', using its country zone.", site.getSiteId(), site.getTimeZone());
            return properties.resolveZone(null, site.getCountry());
        }
    }

    private static int columnIndex(String[] header, List<String> candidates) {
        for (String candidate : candidates) {
            for (int i = 0; i < header.length; i++) {
                if (header[i] != null && candidate.equals(stripBom(header[i]).trim())) {
                    return i;
                }
            }
        }
        return -1;
    }

    static Instant parseTimestamp(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("'{}' has no offset", text);
        }
        try {
            return ZonedDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("'{}' has no zone", text);
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(text, format).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }
        return null;
    }

    /**
     * Watts as a decimal. Blank means no production, {@code null} means unreadable.
     */
    static Double parseProduction(String value) {
        if (value == null) {
            return 0.0;
        }
        String cleaned = value.replace("\"", "").replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return 0.0;
        }
        try {
            return new BigDecimal(cleaned).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static IngestRowError rowError(ICsvListReader reader, String reason) {
        return new IngestRowError(reader.getLineNumber(), reason, reader.getUntokenizedRow());
    }

    private static String stripBom(String value) {
        return !value.isEmpty() && value.charAt(0) == BYTE_ORDER_MARK ? value.substring(1) : value;
    }
}
