package de.anton.spectro.processor.spectro_processor.model;

/**
 * Raised when an instrument file is malformed or does not match what the caller expected:
 * missing section tags, unknown instrument, unparsable numeric cells, mismatching blank files.
 */
public class FormatException extends ProcessingException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
