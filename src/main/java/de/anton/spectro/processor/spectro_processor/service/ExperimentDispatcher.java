package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigExtractor;
import de.anton.spectro.processor.spectro_processor.model.ConfigField;
import de.anton.spectro.processor.spectro_processor.model.DataExtractor;
import de.anton.spectro.processor.spectro_processor.model.DataTable;
import de.anton.spectro.processor.spectro_processor.model.ExperimentDescriptor;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.ExtractedData;
import de.anton.spectro.processor.spectro_processor.model.ExtractionPlan;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFile;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFileReader;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;
import de.anton.spectro.processor.spectro_processor.model.Series;
import de.anton.spectro.processor.spectro_processor.model.TableRenderer;
import de.anton.spectro.processor.spectro_processor.model.UnsupportedExperimentException;
import de.anton.spectro.processor.spectro_processor.profile.AtfInstrumentProfile;
import de.anton.spectro.processor.spectro_processor.profile.CdInstrumentProfile;
import de.anton.spectro.processor.spectro_processor.profile.CorrectionContext;
import de.anton.spectro.processor.spectro_processor.profile.ExperimentProfile;
import de.anton.spectro.processor.spectro_processor.profile.InstrumentProfile;
import de.anton.spectro.processor.spectro_processor.profile.PhExperiment;
import de.anton.spectro.processor.spectro_processor.profile.TemperatureExperiment;
import de.anton.spectro.processor.spectro_processor.profile.TitrationExperiment;
import de.anton.spectro.processor.spectro_processor.profile.WavelengthExperiment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one instrument file through the pipeline for a fixed (instrument, experiment) combination.
 * <p>
 * The combination is resolved once against a static table of the supported pairs. A dispatcher
 * instance runs exactly once and walks the stages of {@link PipelineState} in order; the first
 * failure moves it to {@link PipelineState#FAILED} and is rethrown with the failing stage recorded.
 * There is no partial output.
 */
public class ExperimentDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ExperimentDispatcher.class);

    /** Key of the dispatch table. */
    record DispatchKey(InstrumentFamily instrument, ExperimentFamily experiment) { }

    /** The two strategies of a supported combination. Both are stateless and shared. */
    record ProfilePair(InstrumentProfile instrument, ExperimentProfile experiment) { }

    private static final Map<DispatchKey, ProfilePair> DISPATCH_TABLE;

    static {
        InstrumentProfile cd = new CdInstrumentProfile();
        InstrumentProfile atf = new AtfInstrumentProfile();
        ExperimentProfile titration = new TitrationExperiment();
        ExperimentProfile ph = new PhExperiment();
        ExperimentProfile temperature = new TemperatureExperiment();
        ExperimentProfile wavelength = new WavelengthExperiment();

        Map<DispatchKey, ProfilePair> table = new LinkedHashMap<>();
        table.put(new DispatchKey(InstrumentFamily.ATF, ExperimentFamily.TITRATION), new ProfilePair(atf, titration));
        table.put(new DispatchKey(InstrumentFamily.CD, ExperimentFamily.TITRATION), new ProfilePair(cd, titration));
        table.put(new DispatchKey(InstrumentFamily.ATF, ExperimentFamily.PH), new ProfilePair(atf, ph));
        table.put(new DispatchKey(InstrumentFamily.CD, ExperimentFamily.PH), new ProfilePair(cd, ph));
        table.put(new DispatchKey(InstrumentFamily.ATF, ExperimentFamily.TEMPERATURE), new ProfilePair(atf, temperature));
        table.put(new DispatchKey(InstrumentFamily.CD, ExperimentFamily.TEMPERATURE), new ProfilePair(cd, temperature));
        table.put(new DispatchKey(InstrumentFamily.CD, ExperimentFamily.WAVELENGTH), new ProfilePair(cd, wavelength));
        DISPATCH_TABLE = Collections.unmodifiableMap(table);
    }

    private final ExperimentDescriptor descriptor;
    private final ProfilePair profiles;
    private final ProcessingConfiguration configuration;
    private final InstrumentFileReader reader = new InstrumentFileReader();
    private final ConfigExtractor configExtractor = new ConfigExtractor();
    private final DataExtractor dataExtractor = new DataExtractor();

    private PipelineState state = PipelineState.CREATED;
    private Path inputFile;

    /**
     * @param descriptor    The combination the caller commits to; the file must match it.
     * @param configuration Rendering settings.
     * @throws UnsupportedExperimentException if the combination is not in the dispatch table.
     */
    public ExperimentDispatcher(ExperimentDescriptor descriptor, ProcessingConfiguration configuration)
            throws UnsupportedExperimentException {
        this.descriptor = Objects.requireNonNull(descriptor, "Descriptor cannot be null.");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null.");
        this.profiles = resolve(descriptor);
    }

    /**
     * Creates a dispatcher for whatever combination the file declares, determined by a pre-read.
     *
     * @throws ProcessingException if the file cannot be identified or its combination is unsupported.
     */
    public static ExperimentDispatcher forFile(Path file, ProcessingConfiguration configuration) throws ProcessingException {
        ExperimentDescriptor found = new InstrumentFileReader().read(file).getDescriptor();
        return new ExperimentDispatcher(found, configuration);
    }

    private static ProfilePair resolve(ExperimentDescriptor descriptor) throws UnsupportedExperimentException {
        Optional<ExperimentFamily> experiment = descriptor.experimentFamily();
        ProfilePair pair = experiment.map(e -> DISPATCH_TABLE.get(new DispatchKey(descriptor.instrument(), e))).orElse(null);
        if (pair == null) {
            throw new UnsupportedExperimentException("No processing available for " + descriptor.instrument()
                    + " " + descriptor.experimentType() + " experiments");
        }
        return pair;
    }

    public static boolean supports(ExperimentDescriptor descriptor) {
        return descriptor.experimentFamily()
                .map(e -> DISPATCH_TABLE.containsKey(new DispatchKey(descriptor.instrument(), e)))
                .orElse(false);
    }

    /** @return All supported combinations in table order. */
    public static List<ExperimentDescriptor> supportedDescriptors() {
        List<ExperimentDescriptor> descriptors = new ArrayList<>();
        for (DispatchKey key : DISPATCH_TABLE.keySet()) {
            descriptors.add(ExperimentDescriptor.of(key.instrument(), key.experiment()));
        }
        return descriptors;
    }

    /** @return The instrument parameters followed by the experiment parameters of this combination. */
    public List<ParameterSpec> parameterSpecs() {
        List<ParameterSpec> specs = new ArrayList<>(profiles.instrument().parameterSpecs());
        specs.addAll(profiles.experiment().parameterSpecs(profiles.instrument().family()));
        return specs;
    }

    /**
     * Stand-in parameters for a pre-read: a placeholder for every required parameter and, for ATF
     * files, both channels enabled.
     */
    public ParameterBundle placeholderParameters() {
        ParameterBundle placeholders = ParameterBundle.placeholdersFor(parameterSpecs());
        if (profiles.instrument().family() == InstrumentFamily.ATF) {
            placeholders.put(Parameters.SAMPLE, true).put(Parameters.REFERENCE, true);
        }
        return placeholders;
    }

    /**
     * Runs all stages and renders the output.
     *
     * @param file       The instrument file.
     * @param parameters Caller parameters.
     * @return The complete result.
     * @throws ProcessingException  on format, configuration or unsupported-combination failures.
     * @throws ArithmeticException  if a correction divides by zero; the message names the stage and the file.
     */
    public ProcessingResult process(Path file, ParameterBundle parameters) throws ProcessingException {
        LoadedExperiment loaded = runUntilChannelsBuilt(file, parameters);
        ExtractedData data = loaded.data();
        List<Channel> channels = loaded.channels();
        InstrumentProfile instrument = profiles.instrument();
        ExperimentProfile experiment = profiles.experiment();

        CorrectionContext context = new CorrectionContext(instrument.family(), parameters, data, this::loadBlank);
        String processingLog = step(PipelineState.CORRECTED, () -> experiment.applyCorrections(channels, context));

        return step(PipelineState.RENDERED, () -> {
            TableRenderer renderer = configuration.renderer();
            DataTable table = renderer.tabulate(channels, experiment.outputColumns(instrument.family()));
            List<String> headerLines = buildHeader(file, data, channels, parameters, processingLog);

            StringBuilder output = new StringBuilder();
            for (String line : headerLines) {
                output.append("# ").append(line).append('\n');
            }
            output.append(renderer.render(table));
            logger.info("Dispatcher: processed {} as {} ({} channel(s), {} rows)", file.getFileName(), descriptor,
                    channels.size(), table.rowCount());
            return new ProcessingResult(file, data.getFile().getDescriptor(), data.getConfigFields(), channels,
                    processingLog, headerLines, table, output.toString());
        });
    }

    /**
     * Runs the stages up to {@link PipelineState#CHANNELS_BUILT} and stops; no corrections are applied.
     * Used to pre-read files and to load blanks.
     */
    public LoadedExperiment extractChannels(Path file, ParameterBundle parameters) throws ProcessingException {
        return runUntilChannelsBuilt(file, parameters);
    }

    private LoadedExperiment runUntilChannelsBuilt(Path file, ParameterBundle parameters) throws ProcessingException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        Objects.requireNonNull(parameters, "Parameters cannot be null.");
        if (state != PipelineState.CREATED) {
            throw new IllegalStateException("Dispatcher has already run (state " + state + ")");
        }
        inputFile = file;
        logger.info("Dispatcher: processing {} as {}", file, descriptor);

        ExtractionPlan plan = new ExtractionPlan();
        step(PipelineState.INSTRUMENT_CONFIGURED, () -> {
            profiles.instrument().declareExtraction(plan, parameters);
            return null;
        });
        step(PipelineState.EXPERIMENT_CONFIGURED, () -> {
            profiles.experiment().declareExtraction(profiles.instrument().family(), plan, parameters);
            return null;
        });
        InstrumentFile instrumentFile = step(PipelineState.LOADED, () -> reader.read(file, descriptor));
        ConfigExtractor.Result config = step(PipelineState.CONFIG_EXTRACTED,
                () -> configExtractor.extract(instrumentFile, plan.getConfigFields()));
        Map<Series, double[]> series = step(PipelineState.DATA_EXTRACTED, () -> dataExtractor.extract(instrumentFile, plan));
        ExtractedData data = new ExtractedData(instrumentFile, config.fields(), config.rawDate(), series);
        List<Channel> channels = step(PipelineState.CHANNELS_BUILT,
                () -> profiles.instrument().buildChannels(data, parameters));
        return new LoadedExperiment(data, channels);
    }

    /** Work of one stage. */
    @FunctionalInterface
    private interface Stage<T> {
        T run() throws ProcessingException;
    }

    private <T> T step(PipelineState target, Stage<T> stage) throws ProcessingException {
        if (state.isTerminal() || state.next() != target) {
            throw new IllegalStateException("Cannot move from " + state + " to " + target);
        }
        try {
            T result = stage.run();
            state = target;
            logger.debug("Dispatcher: reached {}", target);
            return result;
        } catch (ProcessingException e) {
            e.setStage(target.name());
            state = PipelineState.FAILED;
            logger.error("Dispatcher: stage {} failed: {}", target, e.getMessage());
            throw e;
        } catch (ArithmeticException e) {
            state = PipelineState.FAILED;
            ArithmeticException located = new ArithmeticException("[" + target.name() + "] " + e.getMessage()
                    + " (" + inputFile + ")");
            located.initCause(e);
            logger.error("Dispatcher: stage {} failed: {}", target, located.getMessage());
            throw located;
        } catch (RuntimeException e) {
            state = PipelineState.FAILED;
            logger.error("Dispatcher: stage {} failed", target, e);
            throw e;
        }
    }

    /** Loads the first channel of a blank file through an independent placeholder run. */
    private Channel loadBlank(Path blankFile) throws ProcessingException {
        logger.info("Dispatcher: loading blank {}", blankFile);
        ExperimentDispatcher nested = forFile(blankFile, configuration);
        return nested.extractChannels(blankFile, nested.placeholderParameters()).firstChannel();
    }

    private List<String> buildHeader(Path file, ExtractedData data, List<Channel> channels, ParameterBundle parameters,
                                     String processingLog) throws ProcessingException {
        List<String> lines = new ArrayList<>();
        lines.add("----- Experiment information -----");
        lines.add("Input file: " + file);
        lines.add("Instrument: " + descriptor.instrument());
        lines.add("Experiment: " + descriptor.experimentType());
        lines.add("");

        if (configuration.setupHeader()) {
            String date = data.getConfigField("date").filter(ConfigField::isPopulated).map(ConfigField::formatValue).orElse(null);
            Optional<SetupHeader> setup = SetupHeader.from(parameters, date);
            if (setup.isPresent()) {
                lines.addAll(setup.get().lines(profiles.experiment().family(), channels));
            }
        }

        lines.add("----- Instrument configuration -----");
        for (ConfigField field : data.getConfigFields()) {
            lines.add(field.getTitle() + ": " + field.formatValue());
        }
        lines.add("");

        // the log ends with a newline, which yields a final empty header line
        Collections.addAll(lines, processingLog.split("\n", -1));
        return lines;
    }

    public PipelineState getState() {
        return state;
    }

    public ExperimentDescriptor getDescriptor() {
        return descriptor;
    }
}
