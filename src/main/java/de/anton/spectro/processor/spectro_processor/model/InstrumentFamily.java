package de.anton.spectro.processor.spectro_processor.model;

/**
 * Instrument families recognised in the tag column of an instrument file.
 */
public enum InstrumentFamily {
    /** Fluorescence/absorbance unit, identified by the photomultiplier voltage tag. */
    ATF("$PMTHV"),
    /** Circular dichroism spectrometer, identified by the CD high voltage tag. */
    CD("$CDHV:");

    private final String identifyingTag;

    InstrumentFamily(String identifyingTag) {
        this.identifyingTag = identifyingTag;
    }

    /** @return The 6-character tag whose presence identifies this family. */
    public String getIdentifyingTag() {
        return identifyingTag;
    }
}
