package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigField;
import de.anton.spectro.processor.spectro_processor.model.DataTable;
import de.anton.spectro.processor.spectro_processor.model.ExperimentDescriptor;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a complete run.
 *
 * @param inputFile     The processed file.
 * @param descriptor    Instrument and experiment type the file was processed as.
 * @param configFields  Extracted configuration, universal fields first.
 * @param channels      The corrected channels.
 * @param processingLog The per channel correction log.
 * @param headerLines   Provenance header lines without the {@code "# "} prefix.
 * @param table         The output table before formatting.
 * @param output        Header and formatted table, the text written to the output file.
 */
public record ProcessingResult(
    Path inputFile,
    ExperimentDescriptor descriptor,
    List<ConfigField> configFields,
    List<Channel> channels,
    String processingLog,
    List<String> headerLines,
    DataTable table,
    String output
) {
    public ProcessingResult {
        configFields = List.copyOf(configFields);
        channels = List.copyOf(channels);
        headerLines = List.copyOf(headerLines);
    }
}
