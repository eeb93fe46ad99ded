package dev.devanks.solarprofile.pipeline.exception;

import dev.devanks.solarprofile.pipeline.model.IngestSummary;
import lombok.Getter;

/**
 * File-level CSV ingestion failure. Carries whatever was written before the failure.
 */
@Getter
public class CsvIngestException extends PipelineException {

    private final transient IngestSummary partialSummary;

    public CsvIngestException(String message, IngestSummary partialSummary) {
        super(message);
        this.partialSummary = partialSummary;
    }

    public CsvIngestException(String message, IngestSummary partialSummary, Throwable cause) {
        super(message, cause);
        this.partialSummary = partialSummary;
    }
}
