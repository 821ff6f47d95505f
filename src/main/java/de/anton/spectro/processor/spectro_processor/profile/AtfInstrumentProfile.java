package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigField;
import de.anton.spectro.processor.spectro_processor.model.ConfigurationException;
import de.anton.spectro.processor.spectro_processor.model.ExtractedData;
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

import java.util.ArrayList;
import java.util.List;

/**
 * Fluorescence/absorbance instrument with a sample and a reference photomultiplier. Each channel is
 * enabled by its own boolean parameter; both share the quantum counter and dark signal columns.
 * A channel whose arrays are unusable is dropped instead of failing the run.
 */
public class AtfInstrumentProfile implements InstrumentProfile {

    private static final Logger logger = LoggerFactory.getLogger(AtfInstrumentProfile.class);

    public static final String SAMPLE_CHANNEL = "sample";
    public static final String REFERENCE_CHANNEL = "reference";

    private static final List<ParameterSpec> PARAMETERS = List.of(
            Parameters.spec(Parameters.SAMPLE).orElseThrow(),
            Parameters.spec(Parameters.REFERENCE).orElseThrow(),
            Parameters.spec(Parameters.QC_CORRECTION).orElseThrow());

    @Override
    public InstrumentFamily family() {
        return InstrumentFamily.ATF;
    }

    @Override
    public List<ParameterSpec> parameterSpecs() {
        return PARAMETERS;
    }

    /** @return Whether the sample channel was requested. */
    public static boolean sampleRequested(ParameterBundle parameters) throws ConfigurationException {
        return parameters.getBoolean(Parameters.SAMPLE, false);
    }

    /** @return Whether the reference channel was requested. */
    public static boolean referenceRequested(ParameterBundle parameters) throws ConfigurationException {
        return parameters.getBoolean(Parameters.REFERENCE, false);
    }

    @Override
    public void declareExtraction(ExtractionPlan plan, ParameterBundle parameters) throws ProcessingException {
        parameters.requireAll(PARAMETERS);
        boolean sample = sampleRequested(parameters);
        boolean reference = referenceRequested(parameters);
        if (!sample && !reference) {
            throw new ConfigurationException("At least one of the following options is required for ATF experiments: "
                    + Parameters.SAMPLE + ", " + Parameters.REFERENCE, List.of(Parameters.SAMPLE, Parameters.REFERENCE));
        }

        plan.requestColumn("QC_Signal", Series.QC_SIGNAL)
            .requestColumn("PMT_Signal_(Dark)", Series.DARK_SIGNAL);

        plan.addConfigField(ConfigField.decimal("$EXWL", "excitation_wavelength", "Excitation wavelength"))
            .addConfigField(ConfigField.decimal("$EMWL", "emission_wavelength", "Emission wavelength"))
            .addConfigField(ConfigField.decimal("$EXBW", "excitation_bandwidth", "Excitation bandwidth"))
            .addConfigField(ConfigField.decimal("$EMBW", "emission_bandwidth", "Emission bandwidth"));

        if (sample) {
            plan.addConfigField(ConfigField.decimal("$TEMPSP", "sample_temperature", "Sample temperature"));
            plan.requestColumn("Samp._PMT_Raw_Sig.", Series.SAMPLE_Y);
        }
        if (reference) {
            plan.addConfigField(ConfigField.decimal("$TEMPREFSP", "ref_temperature", "Reference temperature"));
            plan.requestColumn("Ref._PMT_Raw_Sig.", Series.REFERENCE_Y);
        }
    }

    @Override
    public List<Channel> buildChannels(ExtractedData data, ParameterBundle parameters) throws ProcessingException {
        List<Channel> channels = new ArrayList<>(2);
        if (sampleRequested(parameters)) {
            addChannel(channels, SAMPLE_CHANNEL, data, Series.SAMPLE_X, Series.SAMPLE_Y);
        }
        if (referenceRequested(parameters)) {
            addChannel(channels, REFERENCE_CHANNEL, data, Series.REFERENCE_X, Series.REFERENCE_Y);
        }
        if (channels.isEmpty()) {
            throw new FormatException("No usable channel in " + data.getFile().getPath());
        }
        return channels;
    }

    private void addChannel(List<Channel> channels, String name, ExtractedData data, Series xSeries, Series ySeries) {
        // per-channel x-axis if the experiment supplies one, otherwise the shared one
        double[] x = data.hasSeries(xSeries) ? data.getSeries(xSeries) : data.getSeries(Series.ALL_X);
        try {
            Channel channel = new Channel(name,
                    x,
                    data.getSeries(ySeries),
                    null,
                    data.getSeries(Series.CONCENTRATIONS),
                    data.getSeries(Series.DARK_SIGNAL),
                    data.getSeries(Series.QC_SIGNAL),
                    data.getSeries(Series.SHOT_SIZE));
            channels.add(channel);
            logger.debug("Built ATF channel {}", channel);
        } catch (IllegalArgumentException e) {
            logger.warn("Dropping {} channel: {}", name, e.getMessage());
        }
    }
}
