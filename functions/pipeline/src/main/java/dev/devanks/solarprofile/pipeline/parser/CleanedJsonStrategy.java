package dev.devanks.solarprofile.pipeline.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Repairs the text with {@link JsonTextCleaner}, then parses it strictly.
 */
@Slf4j
@RequiredArgsConstructor
public class CleanedJsonStrategy implements JsonDecodeStrategy {

    public static final String NAME = "cleaned";

    private final JsonTextCleaner cleaner;
    private final StrictJsonStrategy strict = new StrictJsonStrategy();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonNode decode(String text) throws IOException {
        String cleaned = cleaner.clean(text);
        log.trace("Cleaned payload for strict parsing: {}", TolerantJsonDecoder.excerpt(cleaned));
        return strict.decode(cleaned);
    }
}
