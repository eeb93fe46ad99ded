package dev.devanks.solarprofile.pipeline.exception;

public class ProfileConfigurationException extends PipelineException {
    public ProfileConfigurationException(String message) {
        super(message);
    }
}
