package de.anton.spectro.processor.spectro_processor.model;

/**
 * Raised for an instrument/experiment combination that has no processing profile,
 * or for an operation the resolved profile cannot perform (e.g. an ATF wavelength scan).
 */
public class UnsupportedExperimentException extends ProcessingException {

    public UnsupportedExperimentException(String message) {
        super(message);
    }
}
