package dev.devanks.solarprofile.pipeline.model;

import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import lombok.Value;

@Value
public class SiteUpsertResult {
    SiteEntity site;
    boolean created;
}
