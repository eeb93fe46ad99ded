package dev.devanks.solarprofile.pipeline.model;

import lombok.Value;

@Value
public class ReferenceYearPoint {
    long siteId;
    int bucket; // 15-minute slot of the 365-day reference year, 0..35039
    double perKwGeneration;
}
