package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.ExtractionPlan;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.OutputColumn;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;
import de.anton.spectro.processor.spectro_processor.model.Series;
import de.anton.spectro.processor.spectro_processor.model.Trace;
import de.anton.spectro.processor.spectro_processor.model.UnsupportedExperimentException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * CD wavelength scan: optional blank file subtraction followed by the MME conversion.
 * No normalization.
 */
public class WavelengthExperiment extends AbstractExperimentProfile {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            Parameters.spec(Parameters.BLANK_FILE).orElseThrow());

    @Override
    public ExperimentFamily family() {
        return ExperimentFamily.WAVELENGTH;
    }

    @Override
    public List<ParameterSpec> parameterSpecs(InstrumentFamily instrument) {
        return PARAMETERS;
    }

    @Override
    public void declareExtraction(InstrumentFamily instrument, ExtractionPlan plan, ParameterBundle parameters)
            throws ProcessingException {
        if (instrument != InstrumentFamily.CD) {
            throw new UnsupportedExperimentException("Wavelength experiments can only be processed for CD files, not " + instrument);
        }
        plan.requestColumn("X", Series.ALL_X);
    }

    @Override
    protected void correct(Channel channel, CorrectionContext context, StringBuilder log) throws ProcessingException {
        Optional<String> blankFile = context.getParameters().optionalString(Parameters.BLANK_FILE);
        if (blankFile.isPresent()) {
            Channel blank = context.loadBlank(Path.of(blankFile.get()));
            log.append(channel.subtractBlank(blank, blankFile.get()));
        } else {
            log.append(channel.subtractBlank(null, null));
        }
        log.append(context.convertToMme(channel));
    }

    @Override
    protected String xLabel() {
        return "wavelength";
    }

    @Override
    public List<OutputColumn> outputColumns(InstrumentFamily instrument) {
        return List.of(
                OutputColumn.of(xLabel(), Trace.X),
                OutputColumn.of("raw", Trace.RAW_SIGNAL),
                OutputColumn.of("raw_err", Trace.RAW_ERROR),
                OutputColumn.of("MME", Trace.MME),
                OutputColumn.of("MME_err", Trace.MME_ERROR));
    }
}
