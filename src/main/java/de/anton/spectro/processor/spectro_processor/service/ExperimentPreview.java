package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.ConfigField;
import de.anton.spectro.processor.spectro_processor.model.ExperimentDescriptor;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;

import java.util.List;
import java.util.Optional;

/**
 * What a pre-read of a file reveals before the caller supplies parameters: its combination, the
 * instrument configuration, the parameters to ask for and the channels found.
 */
public record ExperimentPreview(
    ExperimentDescriptor descriptor,
    List<ConfigField> configFields,
    List<String> rawDate,
    List<ParameterSpec> requiredParameters,
    List<ParameterSpec> optionalParameters,
    List<String> channelNames
) {
    public ExperimentPreview {
        configFields = List.copyOf(configFields);
        rawDate = List.copyOf(rawDate);
        requiredParameters = List.copyOf(requiredParameters);
        optionalParameters = List.copyOf(optionalParameters);
        channelNames = List.copyOf(channelNames);
    }

    public Optional<ConfigField> configField(String name) {
        return configFields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }
}
