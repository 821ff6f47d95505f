package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ExtractedData;

import java.util.List;

/**
 * Outcome of a run stopped after channel construction: what was read and the uncorrected channels.
 */
public record LoadedExperiment(ExtractedData data, List<Channel> channels) {

    public LoadedExperiment {
        channels = List.copyOf(channels);
    }

    public Channel firstChannel() {
        return channels.get(0);
    }
}
