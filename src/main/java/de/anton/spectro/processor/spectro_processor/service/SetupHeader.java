package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigurationException;
import de.anton.spectro.processor.spectro_processor.model.DenaturantCalculator;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Descriptive block about who ran the experiment and how, placed after the experiment information
 * in the provenance header. For titrations with refractive indices it also checks the final
 * denaturant concentration against the last titrant value the instrument recorded for the first channel.
 */
public final class SetupHeader {

    private static final Logger logger = LoggerFactory.getLogger(SetupHeader.class);

    public static final int WRAP_WIDTH = 78;
    public static final double DENATURANT_TOLERANCE = 0.05; // M

    private final String user;
    private final String date;
    private final String comments;
    private final String denaturant;
    private final Double bufferIndex;
    private final Double finalIndex;

    private SetupHeader(String user, String date, String comments, String denaturant, Double bufferIndex, Double finalIndex) {
        this.user = user;
        this.date = date;
        this.comments = comments;
        this.denaturant = denaturant;
        this.bufferIndex = bufferIndex;
        this.finalIndex = finalIndex;
    }

    /**
     * @param parameters     Caller parameters.
     * @param instrumentDate The date extracted from the file (year.month.day), may be null.
     * @return The block, or empty if none of user, comments or denaturant is given.
     */
    public static Optional<SetupHeader> from(ParameterBundle parameters, String instrumentDate) throws ConfigurationException {
        String user = parameters.optionalString(Parameters.USER).orElse(null);
        String comments = parameters.optionalString(Parameters.COMMENTS).orElse(null);
        String denaturant = parameters.optionalString(Parameters.DENATURANT).orElse(null);
        if (user == null && comments == null && denaturant == null) {
            return Optional.empty();
        }
        if (denaturant != null) {
            DenaturantCalculator.denaturantFor(denaturant); // fail early on unknown names
        }
        return Optional.of(new SetupHeader(user, instrumentDate, comments, denaturant,
                parameters.optionalDouble(Parameters.BUFFER_REFRACTIVE_INDEX).orElse(null),
                parameters.optionalDouble(Parameters.FINAL_REFRACTIVE_INDEX).orElse(null)));
    }

    /**
     * @param experiment The experiment type of the run.
     * @param channels   The corrected channels; the first one is used for the denaturant check.
     * @return Header lines, ending with an empty separator line.
     */
    public List<String> lines(ExperimentFamily experiment, List<Channel> channels) throws ConfigurationException {
        List<String> out = new ArrayList<>();
        out.add("----- Experimental setup -----");
        if (user != null) {
            out.add("User: " + user);
        }
        out.add("Date: " + (date == null ? "n/a" : date));
        if (comments != null) {
            out.add("Comments:");
            out.addAll(wrap(comments, WRAP_WIDTH));
        }

        boolean titrantExperiment = experiment == ExperimentFamily.TITRATION || experiment == ExperimentFamily.PH;
        if (denaturant != null && titrantExperiment) {
            out.add("Titrant type: " + denaturant);
        }
        if (denaturant != null && experiment == ExperimentFamily.TITRATION && bufferIndex != null && finalIndex != null) {
            double calculated = DenaturantCalculator.concentration(denaturant, bufferIndex, finalIndex);
            out.add(String.format(Locale.ROOT, "Buffer n: %.4f", bufferIndex));
            out.add(String.format(Locale.ROOT, "Final n: %.4f", finalIndex));
            out.add(String.format(Locale.ROOT, "Calculated [%s]: %.2f", denaturant, calculated));

            // instrument axis, before any denaturant recomputation
            double[] x = channels.get(0).getTrace(Trace.RAW_X);
            double inExperiment = x[x.length - 1];
            if (Math.abs(calculated - inExperiment) > DENATURANT_TOLERANCE) {
                logger.warn("Calculated final [{}] {} differs from experiment value {}", denaturant, calculated, inExperiment);
                out.add("Warning: final denaturant concentration is incorrect");
            }
        }
        out.add("");
        return out;
    }

    /**
     * Greedy word wrap. Existing line breaks are kept; a single word longer than the width stays on its own line.
     */
    static List<String> wrap(String text, int width) {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n", -1)) {
            if (paragraph.length() <= width) {
                lines.add(paragraph);
                continue;
            }
            StringBuilder current = new StringBuilder();
            for (String word : paragraph.trim().split("\\s+")) {
                if (current.length() > 0 && current.length() + 1 + word.length() > width) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(word);
            }
            if (current.length() > 0) {
                lines.add(current.toString());
            }
        }
        return lines;
    }
}
