package dev.devanks.solarprofile.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportSummary {
    int pagesFetched;
    int fetched;
    int created;
    int updated;
    int skipped;
    boolean aborted;
    String failure; // only set when aborted
    @Singular
    List<ItemError> errors;

    public String describe() {
        return String.format(
                "Site import %s. Pages: %d, records fetched: %d, created: %d, updated: %d, skipped: %d, errors: %d.%s",
                aborted ? "aborted" : "completed", pagesFetched, fetched, created, updated, skipped, errors.size(),
                aborted ? " Failure: " + failure : "");
    }
}
