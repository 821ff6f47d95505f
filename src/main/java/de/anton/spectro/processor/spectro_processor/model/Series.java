package de.anton.spectro.processor.spectro_processor.model;

/**
 * Logical names of the numeric columns a profile can ask for. The instrument column that
 * feeds each series is declared per profile in an {@link ExtractionPlan}.
 */
public enum Series {
    ALL_X,          // x-axis shared by every channel
    SAMPLE_X,       // per-channel x-axis (ATF pH and temperature experiments)
    REFERENCE_X,
    SAMPLE_Y,       // ATF raw photomultiplier signal
    REFERENCE_Y,
    CD_SIGNAL,
    CD_ERROR,
    CONCENTRATIONS, // fractional sample concentration, 1.0 = undiluted
    SHOT_SIZE,      // injected volume in µL
    QC_SIGNAL,
    DARK_SIGNAL
}
