package de.anton.spectro.processor.spectro_processor.model;

import java.util.Optional;

/**
 * Experiment types as written on the second line of an instrument file.
 */
public enum ExperimentFamily {
    TITRATION("Titration"),
    PH("pH"),
    TEMPERATURE("Temperature"),
    WAVELENGTH("Wavelength");

    private final String label;

    ExperimentFamily(String label) {
        this.label = label;
    }

    /** @return The label used by the instrument software. */
    public String getLabel() {
        return label;
    }

    /**
     * Finds the family for a label read from a file. Matching is exact, like the instrument writes it.
     *
     * @param label The experiment type string.
     * @return The family, or empty if the label is unknown.
     */
    public static Optional<ExperimentFamily> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (ExperimentFamily family : values()) {
            if (family.label.equals(label.strip())) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
