package de.anton.spectro.processor.spectro_processor.service;

/**
 * Stages of one dispatcher run. The stages are passed in declaration order; {@link #FAILED} can be
 * reached from every non-terminal stage.
 */
public enum PipelineState {
    CREATED,
    INSTRUMENT_CONFIGURED,
    EXPERIMENT_CONFIGURED,
    LOADED,
    CONFIG_EXTRACTED,
    DATA_EXTRACTED,
    CHANNELS_BUILT,
    CORRECTED,
    RENDERED,
    FAILED;

    public boolean isTerminal() {
        return this == RENDERED || this == FAILED;
    }

    /** @return The stage following this one on the success path. */
    public PipelineState next() {
        if (isTerminal()) {
            throw new IllegalStateException("No stage follows terminal state " + this);
        }
        return values()[ordinal() + 1];
    }
}
