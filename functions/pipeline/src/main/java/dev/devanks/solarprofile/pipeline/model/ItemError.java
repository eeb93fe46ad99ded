package dev.devanks.solarprofile.pipeline.model;

import lombok.Value;

/**
 * A per-item failure reported in a run summary (a record, a site).
 */
@Value
public class ItemError {
    String item;
    String reason;
}
