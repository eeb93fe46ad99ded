package dev.devanks.solarprofile.pipeline.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Whole typical-year curve of one site in a single document, so a recomputation replaces
 * the previous curve in one write. The {@code perKwGeneration} field needs a single-field
 * index exemption (35,040 array entries).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "site_reference_year")
public class ReferenceYearProfileEntity {

    @DocumentId
    private String id; // site id as text

    private Long siteId;
    private int bucketMinutes;
    private String leapDayPolicy;
    private List<Double> perKwGeneration;
    private long observationCount;
    private List<Integer> yearsObserved;
    private Instant computedOn;
}
