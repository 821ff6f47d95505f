package de.anton.spectro.processor.spectro_processor.model;

/**
 * Named arrays a {@link Channel} can hand out: its current state, the raw values captured at
 * construction, and the snapshot each correction step leaves behind.
 */
public enum Trace {
    X,
    Y,
    Y_ERROR,
    RAW_X,
    RAW_SIGNAL,
    RAW_ERROR,
    QC_CORRECTED,
    BLANK_CORRECTED,
    DILUTION_CORRECTED,
    DENATURANT_X,
    BLANKED,
    MME,
    MME_ERROR,
    NORMALIZED,
    NORMALIZED_ERROR
}
