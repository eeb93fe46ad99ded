package dev.devanks.solarprofile.pipeline.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * One way of turning a response body into a JSON tree. Implementations are pure.
 */
public interface JsonDecodeStrategy {

    String name();

    JsonNode decode(String text) throws IOException;
}
