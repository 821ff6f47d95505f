package de.anton.spectro.processor.spectro_processor.model;

import java.util.Collection;
import java.util.List;

/**
 * Raised when a caller parameter required by the selected profiles is missing or has the wrong type.
 */
public class ConfigurationException extends ProcessingException {

    private final List<String> parameterNames;

    public ConfigurationException(String message, Collection<String> parameterNames) {
        super(message);
        this.parameterNames = List.copyOf(parameterNames);
    }

    public ConfigurationException(String message) {
        this(message, List.of());
    }

    /** @return The parameter keys this failure is about (may be empty). */
    public List<String> getParameterNames() {
        return parameterNames;
    }
}
