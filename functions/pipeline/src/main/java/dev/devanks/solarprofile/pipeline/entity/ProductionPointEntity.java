package dev.devanks.solarprofile.pipeline.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "site_production")
public class ProductionPointEntity {

    @DocumentId
    private String id; // <siteId>_<epochMillis>, one document per site and instant

    private Long siteId;
    private Instant timestamp;
    private double productionW;

    public static String documentId(long siteId, Instant timestamp) {
        return siteId + "_" + timestamp.toEpochMilli();
    }
}
