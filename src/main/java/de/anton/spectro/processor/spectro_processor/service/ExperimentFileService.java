package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ExcelExporter;
import de.anton.spectro.processor.spectro_processor.model.ExperimentDescriptor;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFileReader;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;
import de.anton.spectro.processor.spectro_processor.view.ChannelChartWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for front ends: identifies, previews and processes instrument files and writes
 * the results.
 */
public class ExperimentFileService {

    private static final Logger logger = LoggerFactory.getLogger(ExperimentFileService.class);

    private final ProcessingConfiguration configuration;
    private final InstrumentFileReader reader = new InstrumentFileReader();

    public ExperimentFileService() {
        this(ProcessingConfiguration.defaults());
    }

    public ExperimentFileService(ProcessingConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null.");
    }

    /**
     * Determines instrument and experiment type of a file without extracting anything.
     *
     * @throws ProcessingException if the file cannot be read or identified.
     */
    public ExperimentDescriptor identify(Path file) throws ProcessingException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        ExperimentDescriptor descriptor = reader.read(file).getDescriptor();
        logger.info("Service: {} identified as {}", file.getFileName(), descriptor);
        return descriptor;
    }

    /**
     * Pre-reads a file with placeholder values for every required parameter and reports what was found.
     *
     * @throws ProcessingException if the file cannot be identified, is unsupported or malformed.
     */
    public ExperimentPreview preview(Path file) throws ProcessingException {
        ExperimentDispatcher dispatcher = new ExperimentDispatcher(identify(file), configuration);
        List<ParameterSpec> specs = dispatcher.parameterSpecs();
        LoadedExperiment loaded = dispatcher.extractChannels(file, dispatcher.placeholderParameters());

        List<ParameterSpec> required = new ArrayList<>();
        List<ParameterSpec> optional = new ArrayList<>();
        for (ParameterSpec spec : specs) {
            (spec.required() ? required : optional).add(spec);
        }
        List<String> channelNames = new ArrayList<>();
        for (Channel channel : loaded.channels()) {
            channelNames.add(channel.getName());
        }
        return new ExperimentPreview(dispatcher.getDescriptor(), loaded.data().getConfigFields(),
                loaded.data().getRawDate(), required, optional, channelNames);
    }

    /**
     * Processes a file as whatever combination it declares.
     */
    public ProcessingResult process(Path file, ParameterBundle parameters) throws ProcessingException {
        return ExperimentDispatcher.forFile(file, configuration).process(file, parameters);
    }

    /**
     * Processes a file as the given combination; the file must match it.
     */
    public ProcessingResult process(Path file, ExperimentDescriptor descriptor, ParameterBundle parameters)
            throws ProcessingException {
        return new ExperimentDispatcher(descriptor, configuration).process(file, parameters);
    }

    public void writeOutput(ProcessingResult result, Path target) throws IOException {
        Files.writeString(target, result.output(), StandardCharsets.UTF_8);
        logger.info("Service: output written to {}", target);
    }

    public void exportExcel(ProcessingResult result, Path target) throws IOException {
        new ExcelExporter().export(result.table(), result.headerLines(), target);
    }

    public void writeChart(ProcessingResult result, Path target) throws IOException {
        String xLabel = result.table().getLabels().isEmpty() ? "x" : result.table().getLabels().get(0).substring(2);
        new ChannelChartWriter().write(result.descriptor().toString(), xLabel, result.channels(), target);
    }
}
