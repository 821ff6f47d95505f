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
 * pH titration. The ATF records a pH reading per channel, the CD a single x-axis.
 * Sequence: quantum counter (ATF, on request), dilution, instrument tail.
 */
public class PhExperiment extends AbstractExperimentProfile {

    @Override
    public ExperimentFamily family() {
        return ExperimentFamily.PH;
    }

    @Override
    public List<ParameterSpec> parameterSpecs(InstrumentFamily instrument) {
        return List.of();
    }

    @Override
    public void declareExtraction(InstrumentFamily instrument, ExtractionPlan plan, ParameterBundle parameters)
            throws ProcessingException {
        plan.requestColumn("pH_Inj._Volumes", Series.SHOT_SIZE)
            .requestColumn("Samp._Conc.", Series.CONCENTRATIONS);

        if (instrument == InstrumentFamily.ATF) {
            if (AtfInstrumentProfile.sampleRequested(parameters)) {
                plan.requestColumn("pH_Channel_1", Series.SAMPLE_X);
            }
            if (AtfInstrumentProfile.referenceRequested(parameters)) {
                plan.requestColumn("pH_Channel_2", Series.REFERENCE_X);
            }
        } else {
            plan.requestColumn("X", Series.ALL_X);
        }
    }

    @Override
    protected void correct(Channel channel, CorrectionContext context, StringBuilder log) throws ProcessingException {
        correctQuantumCounter(channel, context, log);
        log.append(channel.correctDilution());
        convertAndNormalize(channel, context, log);
    }

    @Override
    protected String xLabel() {
        return "pH";
    }
}
