package dev.devanks.solarprofile.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DownloadSummary {
    int sitesConsidered;
    int downloaded;
    int skipped;
    int failed;
    @Singular
    List<ItemError> errors;

    public String describe() {
        return String.format(
                "CSV download completed. Sites considered: %d, downloaded: %d, skipped: %d, failed: %d.",
                sitesConsidered, downloaded, skipped, failed);
    }
}
