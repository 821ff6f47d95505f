package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigField;
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

import java.util.List;

/**
 * Circular dichroism spectrometer: one "sample" channel built from the CD signal and its error.
 * Requires the protein data needed for the molar ellipticity conversion.
 */
public class CdInstrumentProfile implements InstrumentProfile {

    private static final Logger logger = LoggerFactory.getLogger(CdInstrumentProfile.class);

    public static final String SIGNAL_COLUMN = "CD_Signal";
    public static final String ERROR_COLUMN = "CD_Error";

    private static final List<ParameterSpec> PARAMETERS = List.of(
            Parameters.spec(Parameters.NUM_RESIDUES).orElseThrow(),
            Parameters.spec(Parameters.MOLECULAR_WEIGHT).orElseThrow(),
            Parameters.spec(Parameters.PROTEIN_CONC).orElseThrow(),
            Parameters.spec(Parameters.PATH_LENGTH).orElseThrow());

    @Override
    public InstrumentFamily family() {
        return InstrumentFamily.CD;
    }

    @Override
    public List<ParameterSpec> parameterSpecs() {
        return PARAMETERS;
    }

    @Override
    public void declareExtraction(ExtractionPlan plan, ParameterBundle parameters) throws ProcessingException {
        parameters.requireAll(PARAMETERS);

        plan.requestColumn(SIGNAL_COLUMN, Series.CD_SIGNAL)
            .requestColumn(ERROR_COLUMN, Series.CD_ERROR);

        plan.addConfigField(ConfigField.decimal("$MONOWL", "wavelength", "Wavelength"))
            .addConfigField(ConfigField.decimal("$MONOBW", "bandwidth", "Bandwidth"))
            .addConfigField(ConfigField.decimal("$TEMPSP", "sample_temperature", "Sample temperature"));
    }

    @Override
    public List<Channel> buildChannels(ExtractedData data, ParameterBundle parameters) throws ProcessingException {
        try {
            Channel sample = new Channel("sample",
                    data.getSeries(Series.ALL_X),
                    data.getSeries(Series.CD_SIGNAL),
                    data.getSeries(Series.CD_ERROR),
                    data.getSeries(Series.CONCENTRATIONS),
                    null,
                    null,
                    data.getSeries(Series.SHOT_SIZE));
            logger.debug("Built CD channel {}", sample);
            return List.of(sample);
        } catch (IllegalArgumentException e) {
            throw new FormatException("Cannot build CD sample channel from " + data.getFile().getPath() + ": " + e.getMessage(), e);
        }
    }
}
