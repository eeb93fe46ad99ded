package dev.devanks.solarprofile.pipeline.exception;

public class InsufficientDataException extends PipelineException {
    public InsufficientDataException(String message) {
        super(message);
    }
}
