package dev.devanks.solarprofile.pipeline.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;

public class StrictJsonStrategy implements JsonDecodeStrategy {

    public static final String NAME = "strict";

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonNode decode(String text) throws IOException {
        return mapper.readTree(text);
    }
}
