package dev.devanks.solarprofile.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class DecodedPayload {
    JsonNode body;
    String strategy; // name of the decode strategy that succeeded
}
