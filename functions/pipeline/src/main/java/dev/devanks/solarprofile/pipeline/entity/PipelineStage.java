package dev.devanks.solarprofile.pipeline.entity;

/**
 * Progress of a site through the pipeline. Declaration order is the stage order.
 */
public enum PipelineStage {
    DISCOVERED,
    CSV_DOWNLOADED,
    UPLOADED,
    PROFILED;

    public boolean isAtLeast(PipelineStage other) {
        return compareTo(other) >= 0;
    }

    public PipelineStage previous() {
        return this == DISCOVERED ? DISCOVERED : values()[ordinal() - 1];
    }
}
