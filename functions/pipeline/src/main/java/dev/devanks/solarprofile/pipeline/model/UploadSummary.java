package dev.devanks.solarprofile.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class UploadSummary {
    int sitesProcessed;
    int sitesUploaded;
    int sitesFailed;
    long rowsInserted;
    long rowsSkipped;
    @Singular
    List<ItemError> errors;

    public String describe() {
        return String.format(
                "Production upload completed. Sites processed: %d, uploaded: %d, failed: %d, rows inserted: %d, rows skipped: %d.",
                sitesProcessed, sitesUploaded, sitesFailed, rowsInserted, rowsSkipped);
    }
}
