package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.ExtractionPlan;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.OutputColumn;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;

import java.util.List;

/**
 * What is specific to an experiment type: the extra columns and tags to read, the ordered correction
 * sequence applied to every channel, and the columns written to the output table.
 * Declared after the instrument, so an experiment may remove fields the instrument added.
 */
public interface ExperimentProfile {

    ExperimentFamily family();

    /** @return The parameters this experiment reads when run on the given instrument. */
    List<ParameterSpec> parameterSpecs(InstrumentFamily instrument);

    /**
     * @throws ProcessingException if the experiment cannot be run on the instrument or parameters are unusable.
     */
    void declareExtraction(InstrumentFamily instrument, ExtractionPlan plan, ParameterBundle parameters)
            throws ProcessingException;

    /**
     * Runs the correction sequence on every channel, in channel order.
     *
     * @return The processing log: per channel a title line, the step entries and a blank line.
     */
    String applyCorrections(List<Channel> channels, CorrectionContext context) throws ProcessingException;

    /** @return Per channel output columns, in output order. */
    List<OutputColumn> outputColumns(InstrumentFamily instrument);
}
