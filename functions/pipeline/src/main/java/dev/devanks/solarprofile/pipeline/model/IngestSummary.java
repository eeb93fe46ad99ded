package dev.devanks.solarprofile.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestSummary {
    long siteId;
    long rowsRead;
    long rowsInserted;
    long rowsSkipped;
    @Singular
    List<IngestRowError> rowErrors;
}
