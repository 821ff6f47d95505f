package de.anton.spectro.processor.spectro_processor.model;

import java.util.Objects;

/**
 * Declares one caller parameter a profile understands: its key, type, whether it must be present
 * and a short description used for command line help.
 */
public record ParameterSpec(String key, ValueType type, boolean required, String description) {

    public ParameterSpec {
        Objects.requireNonNull(key, "Parameter key cannot be null.");
        Objects.requireNonNull(type, "Parameter type cannot be null.");
        description = description == null ? "" : description;
    }

    public static ParameterSpec required(String key, ValueType type, String description) {
        return new ParameterSpec(key, type, true, description);
    }

    public static ParameterSpec optional(String key, ValueType type, String description) {
        return new ParameterSpec(key, type, false, description);
    }

    /**
     * @return A stand-in value of the declared type (1 for numbers, true for booleans, empty text),
     *         used when a file is pre-read before the caller has supplied anything.
     */
    public Object placeholder() {
        switch (type) {
            case INT: return 1;
            case FLOAT: return 1.0;
            case BOOLEAN: return Boolean.TRUE;
            default: return "";
        }
    }
}
