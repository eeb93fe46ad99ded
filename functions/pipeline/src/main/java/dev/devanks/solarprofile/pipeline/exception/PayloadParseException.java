package dev.devanks.solarprofile.pipeline.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when no decode strategy could turn a response body into a JSON object.
 */
@Getter
public class PayloadParseException extends PipelineException {

    private final String excerpt;
    private final List<String> strategyFailures;

    public PayloadParseException(String excerpt, List<String> strategyFailures) {
        super("Unable to decode payload (" + String.join("; ", strategyFailures) + "). Excerpt: " + excerpt);
        this.excerpt = excerpt;
        this.strategyFailures = List.copyOf(strategyFailures);
    }
}
