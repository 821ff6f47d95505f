package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ExtractedData;
import de.anton.spectro.processor.spectro_processor.model.ExtractionPlan;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;

import java.util.List;

/**
 * What is instrument specific about a run: the signal columns and configuration tags to read,
 * the caller parameters needed, and how the extracted arrays are assembled into channels.
 * Implementations are stateless; everything per run arrives as arguments.
 */
public interface InstrumentProfile {

    InstrumentFamily family();

    /** @return Parameters understood by this instrument. */
    List<ParameterSpec> parameterSpecs();

    /**
     * Validates the instrument parameters and adds the instrument's columns and configuration fields
     * to the plan.
     *
     * @throws ProcessingException (typically a ConfigurationException) if the parameters are unusable.
     */
    void declareExtraction(ExtractionPlan plan, ParameterBundle parameters) throws ProcessingException;

    /**
     * Assembles the channels from the extracted arrays.
     *
     * @return The active channels, never empty.
     * @throws ProcessingException if no channel can be built.
     */
    List<Channel> buildChannels(ExtractedData data, ParameterBundle parameters) throws ProcessingException;
}
