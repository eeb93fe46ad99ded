package dev.devanks.solarprofile.pipeline.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarprofile.pipeline.exception.PayloadParseException;
import dev.devanks.solarprofile.pipeline.model.DecodedPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes monitoring API payloads that are not always valid JSON. Strategies are tried in
 * order and the first one that yields a JSON object wins.
 */
@Component
@Slf4j
public class TolerantJsonDecoder {

    private static final int EXCERPT_LENGTH = 800;

    private final List<JsonDecodeStrategy> strategies;

    public TolerantJsonDecoder() {
        this(List.of(
                new StrictJsonStrategy(),
                new CleanedJsonStrategy(new JsonTextCleaner()),
                new LenientJsonStrategy()));
    }

    @VisibleForTesting
    TolerantJsonDecoder(List<JsonDecodeStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * @param text raw response body
     * @return the decoded object and the name of the strategy that produced it
     * @throws PayloadParseException when every strategy fails
     */
    public DecodedPayload decode(String text) {
        List<String> failures = new ArrayList<>();
        for (JsonDecodeStrategy strategy : strategies) {
            try {
                JsonNode node = strategy.decode(text == null ? "" : text);
                if (node != null && node.isObject()) {
                    if (!failures.isEmpty()) {
                        log.info("Payload decoded by '{}' strategy after {} failed attempt(s).", strategy.name(), failures.size());
                    }
                    return new DecodedPayload(node, strategy.name());
                }
                failures.add(strategy.name() + ": not a JSON object");
            } catch (IOException | RuntimeException e) {
                log.debug("'{}' decode failed: {}", strategy.name(), e.getMessage());
                failures.add(strategy.name() + ": " + firstLine(e.getMessage()));
            }
        }
        String excerpt = excerpt(text);
        log.warn("All decode strategies failed. Response text snippet (first {} chars): {}", EXCERPT_LENGTH, excerpt);
        throw new PayloadParseException(excerpt, failures);
    }

    public static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
