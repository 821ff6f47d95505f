package de.anton.spectro.processor.spectro_processor.model;

import java.util.Objects;

/**
 * One column of the output table per channel: the header label (without channel prefix) and the
 * channel array written under it.
 */
public record OutputColumn(String label, Trace trace) {

    public OutputColumn {
        Objects.requireNonNull(label, "Label cannot be null.");
        Objects.requireNonNull(trace, "Trace cannot be null.");
    }

    public static OutputColumn of(String label, Trace trace) {
        return new OutputColumn(label, trace);
    }
}
