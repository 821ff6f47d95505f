package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.OutputColumn;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;
import de.anton.spectro.processor.spectro_processor.model.Trace;

import java.util.List;
import java.util.Locale;

/**
 * Shared parts of the experiment profiles: the per-channel log framing, the optional quantum
 * counter step and the instrument dependent tail (MME then inverted normalization for CD,
 * plain normalization otherwise).
 */
public abstract class AbstractExperimentProfile implements ExperimentProfile {

    @Override
    public String applyCorrections(List<Channel> channels, CorrectionContext context) throws ProcessingException {
        StringBuilder log = new StringBuilder();
        for (Channel channel : channels) {
            log.append(String.format(Locale.ROOT, "----- %s channel processing -----\n", capitalize(channel.getName())));
            correct(channel, context, log);
            log.append('\n');
        }
        return log.toString();
    }

    /** Applies this experiment's correction sequence to one channel, appending each step's log entry. */
    protected abstract void correct(Channel channel, CorrectionContext context, StringBuilder log) throws ProcessingException;

    /** Label of the x column in the output table. */
    protected abstract String xLabel();

    protected void correctQuantumCounter(Channel channel, CorrectionContext context, StringBuilder log) throws ProcessingException {
        if (context.getInstrument() == InstrumentFamily.ATF
                && context.getParameters().getBoolean(Parameters.QC_CORRECTION, false)) {
            log.append(channel.correctDarkQc());
        }
    }

    protected void convertAndNormalize(Channel channel, CorrectionContext context, StringBuilder log) throws ProcessingException {
        if (context.isCd()) {
            log.append(context.convertToMme(channel));
            log.append(channel.normalize(true));
        } else {
            log.append(channel.normalize(false));
        }
    }

    @Override
    public List<OutputColumn> outputColumns(InstrumentFamily instrument) {
        if (instrument == InstrumentFamily.CD) {
            return List.of(
                    OutputColumn.of(xLabel(), Trace.X),
                    OutputColumn.of("raw", Trace.RAW_SIGNAL),
                    OutputColumn.of("raw_err", Trace.RAW_ERROR),
                    OutputColumn.of("norm", Trace.NORMALIZED),
                    OutputColumn.of("norm_err", Trace.NORMALIZED_ERROR),
                    OutputColumn.of("MME", Trace.MME),
                    OutputColumn.of("MME_err", Trace.MME_ERROR));
        }
        return List.of(
                OutputColumn.of(xLabel(), Trace.X),
                OutputColumn.of("raw", Trace.RAW_SIGNAL),
                OutputColumn.of("norm", Trace.NORMALIZED));
    }

    static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
