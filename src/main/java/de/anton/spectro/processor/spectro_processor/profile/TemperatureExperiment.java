package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.ExtractionPlan;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;
import de.anton.spectro.processor.spectro_processor.model.Series;

import java.util.List;

/**
 * Temperature melt. The x-axis is the recorded temperature, so the set-point temperature of every
 * channel driven by a temperature column is left out of the header.
 * Sequence: quantum counter (ATF, on request), instrument tail.
 */
public class TemperatureExperiment extends AbstractExperimentProfile {

    @Override
    public ExperimentFamily family() {
        return ExperimentFamily.TEMPERATURE;
    }

    @Override
    public List<ParameterSpec> parameterSpecs(InstrumentFamily instrument) {
        return List.of();
    }

    @Override
    public void declareExtraction(InstrumentFamily instrument, ExtractionPlan plan, ParameterBundle parameters)
            throws ProcessingException {
        if (instrument == InstrumentFamily.ATF) {
            if (AtfInstrumentProfile.sampleRequested(parameters)) {
                plan.requestColumn("Sample_Temp", Series.SAMPLE_X);
                plan.removeConfigField("$TEMPSP");
            }
            if (AtfInstrumentProfile.referenceRequested(parameters)) {
                plan.requestColumn("Reference_Temp", Series.REFERENCE_X);
                plan.removeConfigField("$TEMPREFSP");
            }
        } else {
            plan.requestColumn("X", Series.ALL_X);
            plan.removeConfigField("$TEMPSP");
        }
    }

    @Override
    protected void correct(Channel channel, CorrectionContext context, StringBuilder log) throws ProcessingException {
        correctQuantumCounter(channel, context, log);
        convertAndNormalize(channel, context, log);
    }

    @Override
    protected String xLabel() {
        return "temp";
    }
}
