package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigurationException;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SetupHeaderTest {

    private final List<Channel> channels = List.of(
            new Channel("sample", new double[] {0.0, 1.0, 2.0}, new double[] {-10, -12, -15}));

    @Test
    void absentWithoutDescriptiveParameters() throws Exception {
        assertTrue(SetupHeader.from(new ParameterBundle().put(Parameters.PATH_LENGTH, 0.1), "2006.08.07").isEmpty());
    }

    @Test
    void listsUserDateAndComments() throws Exception {
        ParameterBundle parameters = new ParameterBundle()
                .put(Parameters.USER, "jdoe")
                .put(Parameters.COMMENTS, "first run");

        List<String> lines = SetupHeader.from(parameters, "2006.08.07").orElseThrow()
                .lines(ExperimentFamily.TEMPERATURE, channels);

        assertEquals(List.of("----- Experimental setup -----", "User: jdoe", "Date: 2006.08.07",
                "Comments:", "first run", ""), lines);
    }

    @Test
    void missingDateIsShownAsNotAvailable() throws Exception {
        List<String> lines = SetupHeader.from(new ParameterBundle().put(Parameters.USER, "jdoe"), null).orElseThrow()
                .lines(ExperimentFamily.PH, channels);

        assertTrue(lines.contains("Date: n/a"));
    }

    @Test
    void titrationReportsCalculatedDenaturant() throws Exception {
        ParameterBundle parameters = new ParameterBundle()
                .put(Parameters.DENATURANT, "urea")
                .put(Parameters.BUFFER_REFRACTIVE_INDEX, 1.3330)
                .put(Parameters.FINAL_REFRACTIVE_INDEX, 1.3500);

        List<String> lines = SetupHeader.from(parameters, null).orElseThrow().lines(ExperimentFamily.TITRATION, channels);

        assertTrue(lines.contains("Titrant type: urea"));
        assertTrue(lines.contains("Buffer n: 1.3330"));
        assertTrue(lines.contains("Final n: 1.3500"));
        assertTrue(lines.contains("Calculated [urea]: 2.01"));
        assertFalse(lines.contains("Warning: final denaturant concentration is incorrect"));
    }

    @Test
    void warnsWhenFinalConcentrationDisagrees() throws Exception {
        ParameterBundle parameters = new ParameterBundle()
                .put(Parameters.DENATURANT, "GdmHCl")
                .put(Parameters.BUFFER_REFRACTIVE_INDEX, 1.3330)
                .put(Parameters.FINAL_REFRACTIVE_INDEX, 1.4330);

        List<String> lines = SetupHeader.from(parameters, null).orElseThrow().lines(ExperimentFamily.TITRATION, channels);

        assertTrue(lines.contains("Warning: final denaturant concentration is incorrect"));
    }

    @Test
    void unknownDenaturantIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> SetupHeader.from(new ParameterBundle().put(Parameters.DENATURANT, "sucrose"), null));
    }

    @Test
    void wrapsLongComments() {
        List<String> lines = SetupHeader.wrap("alpha beta gamma delta", 11);

        assertEquals(List.of("alpha beta", "gamma delta"), lines);
    }

    @Test
    void checksAgainstInstrumentAxisNotRecomputedOne() throws Exception {
        Channel sample = new Channel("sample", new double[] {0.0, 1.0, 2.0}, new double[] {-10, -12, -15},
                null, null, null, null, new double[] {0, 250, 250});
        sample.correctDenaturant(Arrays.asList(0.0, 8.0, 2.0), null, 40.0, null);
        ParameterBundle parameters = new ParameterBundle()
                .put(Parameters.DENATURANT, "urea")
                .put(Parameters.BUFFER_REFRACTIVE_INDEX, 1.3330)
                .put(Parameters.FINAL_REFRACTIVE_INDEX, 1.3500);

        List<String> lines = SetupHeader.from(parameters, null).orElseThrow()
                .lines(ExperimentFamily.TITRATION, List.of(sample));

        assertFalse(lines.contains("Warning: final denaturant concentration is incorrect"));
    }
}
