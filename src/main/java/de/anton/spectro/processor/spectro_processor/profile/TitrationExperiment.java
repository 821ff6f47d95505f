package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigField;
import de.anton.spectro.processor.spectro_processor.model.ConfigurationException;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.ExtractionPlan;
import de.anton.spectro.processor.spectro_processor.model.FormatException;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;
import de.anton.spectro.processor.spectro_processor.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Titration (typically chemical denaturation): titrant is injected stepwise into the cuvette.
 * <p>
 * Sequence per channel: denaturant axis recomputation (only if an override is given), quantum
 * counter (ATF, on request), buffer/titrant blanks, dilution, then the instrument tail.
 */
public class TitrationExperiment extends AbstractExperimentProfile {

    private static final Logger logger = LoggerFactory.getLogger(TitrationExperiment.class);

    static final String INITIAL_CONC_FIELD = "init_conc";
    static final String TITRANT_CONC_FIELD = "titrant_conc";
    static final String CELL_VOLUME_FIELD = "cell_vol";

    private static final List<String> DENATURANT_OVERRIDES = List.of(
            Parameters.INITIAL_TITRANT_CONC, Parameters.TITRANT_STOCK_CONC, Parameters.CELL_VOLUME);

    // CD files carry a single (sample) channel, so only ATF runs read the reference blanks
    private static final List<ParameterSpec> CD_PARAMETERS = List.of(
            Parameters.spec(Parameters.SAMPLE_BUFFER_BLANK).orElseThrow(),
            Parameters.spec(Parameters.SAMPLE_TITRANT_BLANK).orElseThrow(),
            Parameters.spec(Parameters.INITIAL_TITRANT_CONC).orElseThrow(),
            Parameters.spec(Parameters.TITRANT_STOCK_CONC).orElseThrow(),
            Parameters.spec(Parameters.CELL_VOLUME).orElseThrow());

    private static final List<ParameterSpec> ATF_PARAMETERS = List.of(
            Parameters.spec(Parameters.SAMPLE_BUFFER_BLANK).orElseThrow(),
            Parameters.spec(Parameters.SAMPLE_TITRANT_BLANK).orElseThrow(),
            Parameters.spec(Parameters.REFERENCE_BUFFER_BLANK).orElseThrow(),
            Parameters.spec(Parameters.REFERENCE_TITRANT_BLANK).orElseThrow(),
            Parameters.spec(Parameters.INITIAL_TITRANT_CONC).orElseThrow(),
            Parameters.spec(Parameters.TITRANT_STOCK_CONC).orElseThrow(),
            Parameters.spec(Parameters.CELL_VOLUME).orElseThrow());

    @Override
    public ExperimentFamily family() {
        return ExperimentFamily.TITRATION;
    }

    @Override
    public List<ParameterSpec> parameterSpecs(InstrumentFamily instrument) {
        return instrument == InstrumentFamily.ATF ? ATF_PARAMETERS : CD_PARAMETERS;
    }

    @Override
    public void declareExtraction(InstrumentFamily instrument, ExtractionPlan plan, ParameterBundle parameters) {
        plan.addConfigField(ConfigField.decimal("$CONCSYRTITRANT", TITRANT_CONC_FIELD, "Titrant concentration"))
            .addConfigField(ConfigField.decimal("$CONCINITTITRANT", INITIAL_CONC_FIELD, "Initial titrant"))
            .addConfigField(ConfigField.decimal("$CONCCELLVOL", CELL_VOLUME_FIELD, "Cuvette volume"))
            .addConfigField(ConfigField.decimal("$CONCTARGET2", "final_titr_conc", "Final [titrant]"));

        plan.requestColumn("X", Series.ALL_X)
            .requestColumn("Samp._Conc.", Series.CONCENTRATIONS)
            .requestColumn("Inj._Vol._ul.", Series.SHOT_SIZE);
    }

    @Override
    protected void correct(Channel channel, CorrectionContext context, StringBuilder log) throws ProcessingException {
        ParameterBundle parameters = context.getParameters();
        double[] blanks = blanksFor(channel.getName(), parameters);

        if (DENATURANT_OVERRIDES.stream().anyMatch(parameters::contains)) {
            log.append(correctDenaturant(channel, context));
        }
        correctQuantumCounter(channel, context, log);
        log.append(channel.correctTitrantBlanks(blanks[0], blanks[1]));
        log.append(channel.correctDilution());
        convertAndNormalize(channel, context, log);
    }

    private double[] blanksFor(String channelName, ParameterBundle parameters) throws ConfigurationException {
        String bufferKey = AtfInstrumentProfile.REFERENCE_CHANNEL.equals(channelName)
                ? Parameters.REFERENCE_BUFFER_BLANK : Parameters.SAMPLE_BUFFER_BLANK;
        String titrantKey = AtfInstrumentProfile.REFERENCE_CHANNEL.equals(channelName)
                ? Parameters.REFERENCE_TITRANT_BLANK : Parameters.SAMPLE_TITRANT_BLANK;
        if (!parameters.contains(bufferKey) || !parameters.contains(titrantKey)) {
            throw new ConfigurationException(bufferKey + " and " + titrantKey + " blank values must be specified!",
                    List.of(bufferKey, titrantKey));
        }
        return new double[] {parameters.getDouble(bufferKey), parameters.getDouble(titrantKey)};
    }

    private String correctDenaturant(Channel channel, CorrectionContext context) throws ProcessingException {
        ParameterBundle parameters = context.getParameters();
        Double initConc = parameters.optionalDouble(Parameters.INITIAL_TITRANT_CONC).orElse(null);
        Double titrantConc = parameters.optionalDouble(Parameters.TITRANT_STOCK_CONC).orElse(null);
        Double cellVolume = parameters.optionalDouble(Parameters.CELL_VOLUME).orElse(null);
        List<Double> instrumentValues = Arrays.asList(
                context.configValue(INITIAL_CONC_FIELD),
                context.configValue(TITRANT_CONC_FIELD),
                context.configValue(CELL_VOLUME_FIELD));
        try {
            return channel.correctDenaturant(instrumentValues, initConc, titrantConc, cellVolume);
        } catch (IllegalArgumentException e) {
            logger.error("Denaturant correction of channel {} impossible: {}", channel.getName(), e.getMessage());
            throw new FormatException(e.getMessage() + " (" + context.getData().getFile().getPath() + ")", e);
        }
    }

    @Override
    protected String xLabel() {
        return "x";
    }
}
