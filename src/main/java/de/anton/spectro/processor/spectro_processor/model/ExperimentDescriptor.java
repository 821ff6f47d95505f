package de.anton.spectro.processor.spectro_processor.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The (instrument, experiment type) pair read from an instrument file. Used only as a dispatch key.
 * The experiment type is kept as the raw label so that unknown types can still be reported.
 */
public record ExperimentDescriptor(InstrumentFamily instrument, String experimentType) {

    public ExperimentDescriptor {
        Objects.requireNonNull(instrument, "Instrument cannot be null.");
        Objects.requireNonNull(experimentType, "Experiment type cannot be null.");
    }

    public static ExperimentDescriptor of(InstrumentFamily instrument, ExperimentFamily family) {
        return new ExperimentDescriptor(instrument, family.getLabel());
    }

    /** @return The experiment family, or empty if the label is not one the processor knows. */
    public Optional<ExperimentFamily> experimentFamily() {
        return ExperimentFamily.fromLabel(experimentType);
    }

    @Override
    public String toString() {
        return instrument + "/" + experimentType;
    }
}
