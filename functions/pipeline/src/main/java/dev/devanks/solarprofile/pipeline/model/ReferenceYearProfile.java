package dev.devanks.solarprofile.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReferenceYearProfile {
    long siteId;
    List<ReferenceYearPoint> points; // ordered by bucket
    long observationCount;
    List<Integer> yearsObserved;
}
