package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigField;
import de.anton.spectro.processor.spectro_processor.model.ExtractedData;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a correction sequence may consult besides the channels themselves: the instrument,
 * the caller parameters, the extracted configuration and a way to load blank files.
 */
public final class CorrectionContext {

    /** Loads the first channel of another instrument file, without applying corrections. */
    @FunctionalInterface
    public interface BlankLoader {
        Channel load(Path blankFile) throws ProcessingException;
    }

    private final InstrumentFamily instrument;
    private final ParameterBundle parameters;
    private final ExtractedData data;
    private final BlankLoader blankLoader;

    public CorrectionContext(InstrumentFamily instrument, ParameterBundle parameters, ExtractedData data, BlankLoader blankLoader) {
        this.instrument = Objects.requireNonNull(instrument, "Instrument cannot be null.");
        this.parameters = Objects.requireNonNull(parameters, "Parameters cannot be null.");
        this.data = Objects.requireNonNull(data, "Extracted data cannot be null.");
        this.blankLoader = Objects.requireNonNull(blankLoader, "Blank loader cannot be null.");
    }

    public InstrumentFamily getInstrument() {
        return instrument;
    }

    public boolean isCd() {
        return instrument == InstrumentFamily.CD;
    }

    public ParameterBundle getParameters() {
        return parameters;
    }

    public ExtractedData getData() {
        return data;
    }

    /** @return The numeric value of an extracted configuration field, null if the tag was not in the file. */
    public Double configValue(String fieldName) {
        return data.getConfigField(fieldName)
                .filter(ConfigField::isPopulated)
                .map(ConfigField::getDouble)
                .orElse(null);
    }

    public Channel loadBlank(Path blankFile) throws ProcessingException {
        return blankLoader.load(blankFile);
    }

    /** Converts a channel to mean molar ellipticity using the CD parameters. */
    public String convertToMme(Channel channel) throws ProcessingException {
        return channel.convertToMme(
                parameters.getInt(Parameters.NUM_RESIDUES),
                parameters.getDouble(Parameters.MOLECULAR_WEIGHT),
                parameters.getDouble(Parameters.PROTEIN_CONC),
                parameters.getDouble(Parameters.PATH_LENGTH));
    }
}
