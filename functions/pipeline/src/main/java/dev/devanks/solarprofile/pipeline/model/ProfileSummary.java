package dev.devanks.solarprofile.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProfileSummary {
    int sitesProcessed;
    int profiled;
    int failed;
    @Singular
    List<ItemError> errors;

    public String describe() {
        return String.format(
                "Yearly profile calculation completed. Sites processed: %d, profiled: %d, failed: %d.",
                sitesProcessed, profiled, failed);
    }
}
