package dev.devanks.solarprofile.pipeline.exception;

import lombok.Getter;

/**
 * Monitoring API call failed. {@code retryable} tells transient transport faults apart from
 * terminal ones (client errors, unparseable payloads).
 */
@Getter
public class FetchException extends PipelineException {

    private final int attempts;
    private final boolean retryable;

    public FetchException(String message, int attempts, boolean retryable, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
        this.retryable = retryable;
    }
}
