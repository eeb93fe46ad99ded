package dev.devanks.solarprofile.pipeline.model;

import lombok.Value;

/**
 * A CSV row that was skipped. Never fatal to the file.
 */
@Value
public class IngestRowError {
    long lineNumber;
    String reason;
    String raw;
}
