package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.InstrumentFileFixtures;
import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigurationException;
import de.anton.spectro.processor.spectro_processor.model.ExperimentDescriptor;
import de.anton.spectro.processor.spectro_processor.model.ExperimentFamily;
import de.anton.spectro.processor.spectro_processor.model.FormatException;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFamily;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.Trace;
import de.anton.spectro.processor.spectro_processor.model.UnsupportedExperimentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentDispatcherTest {

    @TempDir
    Path tempDir;

    private static final ExperimentDescriptor CD_TITRATION = ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.TITRATION);
    private static final ExperimentDescriptor ATF_TITRATION = ExperimentDescriptor.of(InstrumentFamily.ATF, ExperimentFamily.TITRATION);

    private static ParameterBundle cdParameters() {
        return new ParameterBundle()
                .put(Parameters.NUM_RESIDUES, 100)
                .put(Parameters.MOLECULAR_WEIGHT, 11000.0)
                .put(Parameters.PROTEIN_CONC, 50.0)
                .put(Parameters.PATH_LENGTH, 0.1);
    }

    private static ParameterBundle withSampleBlanks(ParameterBundle parameters, double buffer, double titrant) {
        return parameters.put(Parameters.SAMPLE_BUFFER_BLANK, buffer).put(Parameters.SAMPLE_TITRANT_BLANK, titrant);
    }

    private static ExperimentDispatcher dispatcher(ExperimentDescriptor descriptor) throws Exception {
        return new ExperimentDispatcher(descriptor, ProcessingConfiguration.defaults());
    }

    @Test
    void cdTitrationWithZeroBlanksOnlyCorrectsDilution() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);
        ExperimentDispatcher dispatcher = dispatcher(CD_TITRATION);

        ProcessingResult result = dispatcher.process(file, withSampleBlanks(cdParameters(), 0.0, 0.0));

        assertEquals(PipelineState.RENDERED, dispatcher.getState());
        Channel sample = result.channels().get(0);
        assertArrayEquals(new double[] {-10.0, -12.0 / 0.9, -15.0 / 0.8}, sample.getTrace(Trace.DILUTION_CORRECTED), 1e-9);
        assertArrayEquals(new double[] {0.0, 1.0, 2.0}, sample.getTrace(Trace.X), 1e-9);
        // 100 * 11000 / (0.1 * 50 * 100)
        assertEquals(-10.0 * 2200.0, sample.getTrace(Trace.MME)[0], 1e-6);
        assertEquals(0.0, sample.getTrace(Trace.NORMALIZED)[0], 1e-9);
        assertEquals(1.0, sample.getTrace(Trace.NORMALIZED)[2], 1e-9);
    }

    @Test
    void titrantBlanksAreScaledByConcentration() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);

        ProcessingResult result = dispatcher(CD_TITRATION).process(file, withSampleBlanks(cdParameters(), 1.0, 3.0));

        double[] blanked = result.channels().get(0).getTrace(Trace.BLANK_CORRECTED);
        assertEquals(-10.0 - 1.0, blanked[0], 1e-9);
        assertEquals(-12.0 - 1.0 - 2.0 * 0.1, blanked[1], 1e-9);
        assertEquals(-15.0 - 1.0 - 2.0 * 0.2, blanked[2], 1e-9);
    }

    @Test
    void denaturantOverrideRecomputesAxis() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);
        ParameterBundle parameters = withSampleBlanks(cdParameters(), 0.0, 0.0).put(Parameters.TITRANT_STOCK_CONC, 10.0);

        ProcessingResult result = dispatcher(CD_TITRATION).process(file, parameters);

        double[] x = result.channels().get(0).getTrace(Trace.DENATURANT_X);
        double first = 0.0 * (2.0 - 0.25) / 2.0 + 0.25 * 10.0 / 2.0;
        double second = first * (2.0 - 0.25) / 2.0 + 0.25 * 10.0 / 2.0;
        assertArrayEquals(new double[] {0.0, first, second}, x, 1e-9);
        assertTrue(result.processingLog().contains("Denaturant Correction:"));
    }

    @Test
    void outputCarriesCommentedHeaderThenTable() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);

        ProcessingResult result = dispatcher(CD_TITRATION).process(file, withSampleBlanks(cdParameters(), 0.0, 0.0));

        List<String> lines = Arrays.asList(result.output().split("\n"));
        assertEquals("# ----- Experiment information -----", lines.get(0));
        assertEquals("# Instrument: CD", lines.get(2));
        assertEquals("# Experiment: Titration", lines.get(3));
        assertTrue(lines.contains("# ----- Sample channel processing -----"));
        assertTrue(lines.contains("# Titrant Blank Correction:"));
        assertFalse(lines.contains("# ----- Experimental setup -----"));

        int tableStart = lines.size() - 4;
        assertTrue(lines.get(tableStart).startsWith("                     s_x       s_raw   s_raw_err      s_norm"));
        assertEquals("           0", lines.get(tableStart + 1).substring(0, 12));
        assertEquals(3, result.table().rowCount());
        assertEquals(7, result.table().columnCount());
    }

    @Test
    void atfSampleOnlyYieldsOneChannel() throws Exception {
        Path file = InstrumentFileFixtures.atfTitration(tempDir);
        ParameterBundle parameters = withSampleBlanks(new ParameterBundle(), 0.0, 0.0)
                .put(Parameters.SAMPLE, true)
                .put(Parameters.QC_CORRECTION, true);

        ProcessingResult result = dispatcher(ATF_TITRATION).process(file, parameters);

        assertEquals(1, result.channels().size());
        Channel sample = result.channels().get(0);
        assertEquals("sample", sample.getName());
        assertArrayEquals(new double[] {45.0, 35.0, 25.0}, sample.getTrace(Trace.QC_CORRECTED), 1e-9);
        assertEquals(List.of("s_x", "s_raw", "s_norm"), result.table().getLabels());
    }

    @Test
    void atfBothChannelsNeedBothBlankPairs() throws Exception {
        Path file = InstrumentFileFixtures.atfTitration(tempDir);
        ParameterBundle parameters = withSampleBlanks(new ParameterBundle(), 0.0, 0.0)
                .put(Parameters.SAMPLE, true)
                .put(Parameters.REFERENCE, true);
        ExperimentDispatcher dispatcher = dispatcher(ATF_TITRATION);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> dispatcher.process(file, parameters));
        assertEquals(List.of(Parameters.REFERENCE_BUFFER_BLANK, Parameters.REFERENCE_TITRANT_BLANK), e.getParameterNames());
        assertEquals(PipelineState.CORRECTED.name(), e.getStage());
    }

    @Test
    void atfWithoutChannelsFailsBeforeReading() throws Exception {
        Path file = InstrumentFileFixtures.atfTitration(tempDir);
        ExperimentDispatcher dispatcher = dispatcher(ATF_TITRATION);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> dispatcher.process(file, withSampleBlanks(new ParameterBundle(), 0.0, 0.0)));
        assertEquals(PipelineState.INSTRUMENT_CONFIGURED.name(), e.getStage());
        assertEquals(PipelineState.FAILED, dispatcher.getState());
    }

    @Test
    void unsupportedCombinationIsRejectedUpFront() {
        assertThrows(UnsupportedExperimentException.class,
                () -> dispatcher(ExperimentDescriptor.of(InstrumentFamily.ATF, ExperimentFamily.WAVELENGTH)));
        assertThrows(UnsupportedExperimentException.class,
                () -> dispatcher(new ExperimentDescriptor(InstrumentFamily.CD, "Kinetics")));
        assertEquals(7, ExperimentDispatcher.supportedDescriptors().size());
    }

    @Test
    void fileMustMatchSelectedCombination() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);
        ExperimentDispatcher dispatcher = dispatcher(ATF_TITRATION);
        ParameterBundle parameters = withSampleBlanks(new ParameterBundle(), 0.0, 0.0).put(Parameters.SAMPLE, true);

        FormatException e = assertThrows(FormatException.class, () -> dispatcher.process(file, parameters));
        assertEquals(PipelineState.LOADED.name(), e.getStage());
        assertTrue(e.getMessage().contains("does not match the selected processing profile"));
    }

    @Test
    void dispatcherRunsOnlyOnce() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);
        ExperimentDispatcher dispatcher = dispatcher(CD_TITRATION);
        dispatcher.process(file, withSampleBlanks(cdParameters(), 0.0, 0.0));

        assertThrows(IllegalStateException.class,
                () -> dispatcher.process(file, withSampleBlanks(cdParameters(), 0.0, 0.0)));
    }

    @Test
    void extractChannelsStopsBeforeCorrections() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);
        ExperimentDispatcher dispatcher = dispatcher(CD_TITRATION);

        LoadedExperiment loaded = dispatcher.extractChannels(file, dispatcher.placeholderParameters());

        assertEquals(PipelineState.CHANNELS_BUILT, dispatcher.getState());
        assertFalse(loaded.firstChannel().hasTrace(Trace.DILUTION_CORRECTED));
    }

    @Test
    void wavelengthScanSubtractsMatchingBlank() throws Exception {
        double[] wavelengths = {200, 201, 202};
        Path input = InstrumentFileFixtures.cdWavelength(tempDir, "scan.dat", wavelengths, new double[] {-5, -6, -7});
        Path blank = InstrumentFileFixtures.cdWavelength(tempDir, "blank.dat", wavelengths, new double[] {-1, -1, -2});
        ParameterBundle parameters = cdParameters().put(Parameters.BLANK_FILE, blank.toString());

        ProcessingResult result = dispatcher(ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.WAVELENGTH))
                .process(input, parameters);

        assertArrayEquals(new double[] {-4, -5, -5}, result.channels().get(0).getTrace(Trace.BLANKED), 1e-9);
        assertEquals(List.of("s_wavelength", "s_raw", "s_raw_err", "s_MME", "s_MME_err"), result.table().getLabels());
    }

    @Test
    void blankOnDifferentAxisIsAFormatError() throws Exception {
        Path input = InstrumentFileFixtures.cdWavelength(tempDir, "scan.dat",
                new double[] {200, 201, 202}, new double[] {-5, -6, -7});
        Path blank = InstrumentFileFixtures.cdWavelength(tempDir, "blank.dat",
                new double[] {200, 201, 203}, new double[] {-1, -1, -2});
        ExperimentDispatcher dispatcher = dispatcher(ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.WAVELENGTH));

        FormatException e = assertThrows(FormatException.class,
                () -> dispatcher.process(input, cdParameters().put(Parameters.BLANK_FILE, blank.toString())));
        assertEquals(PipelineState.CORRECTED.name(), e.getStage());
        assertEquals(PipelineState.FAILED, dispatcher.getState());
    }

    @Test
    void missingCdParametersAreNamed() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> dispatcher(CD_TITRATION).process(file, new ParameterBundle().put(Parameters.NUM_RESIDUES, 100)));
        assertEquals(List.of(Parameters.MOLECULAR_WEIGHT, Parameters.PROTEIN_CONC, Parameters.PATH_LENGTH),
                e.getParameterNames());
    }

    @Test
    void cdPhCorrectsDilutionWithoutBlanks() throws Exception {
        Path file = InstrumentFileFixtures.cd("pH")
                .config("$MONOWL", "222.000")
                .columns("X", "CD_Signal", "CD_Error", "Samp._Conc.", "pH_Inj._Volumes")
                .row(7.0, -10.0, 0.5, 1.0, 0.0)
                .row(6.5, -12.0, 0.5, 0.9, 250.0)
                .row(6.0, -15.0, 0.5, 0.8, 250.0)
                .write(tempDir.resolve("cd_ph.dat"));

        ProcessingResult result = dispatcher(ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.PH))
                .process(file, cdParameters());

        Channel sample = result.channels().get(0);
        assertArrayEquals(new double[] {-10.0, -12.0 / 0.9, -15.0 / 0.8}, sample.getTrace(Trace.DILUTION_CORRECTED), 1e-9);
        assertFalse(sample.hasTrace(Trace.BLANK_CORRECTED));
        assertArrayEquals(new double[] {7.0, 6.5, 6.0}, sample.getTrace(Trace.X), 1e-9);
        assertEquals(-10.0 * 2200.0, sample.getTrace(Trace.MME)[0], 1e-6);
        assertEquals("s_pH", result.table().getLabels().get(0));
    }

    @Test
    void atfPhUsesChannelAxisAndQuantumCounter() throws Exception {
        Path file = InstrumentFileFixtures.atf("pH")
                .config("$EXWL", "280.000")
                .columns("pH_Channel_1", "pH_Channel_2", "Samp._PMT_Raw_Sig.", "Ref._PMT_Raw_Sig.", "QC_Signal",
                        "PMT_Signal_(Dark)", "Samp._Conc.", "pH_Inj._Volumes")
                .row(7.0, 7.1, 100.0, 50.0, 2.0, 10.0, 1.0, 0.0)
                .row(6.5, 6.6, 80.0, 45.0, 2.0, 10.0, 0.9, 250.0)
                .row(6.0, 6.1, 60.0, 40.0, 2.0, 10.0, 0.8, 250.0)
                .write(tempDir.resolve("atf_ph.dat"));
        ParameterBundle parameters = new ParameterBundle().put(Parameters.SAMPLE, true).put(Parameters.QC_CORRECTION, true);

        ProcessingResult result = dispatcher(ExperimentDescriptor.of(InstrumentFamily.ATF, ExperimentFamily.PH))
                .process(file, parameters);

        Channel sample = result.channels().get(0);
        assertArrayEquals(new double[] {7.0, 6.5, 6.0}, sample.getTrace(Trace.X), 1e-9);
        assertArrayEquals(new double[] {45.0, 35.0 / 0.9, 25.0 / 0.8}, sample.getTrace(Trace.DILUTION_CORRECTED), 1e-9);
        assertFalse(sample.hasTrace(Trace.BLANK_CORRECTED));
    }

    @Test
    void cdTemperatureSkipsDilutionAndSetPoint() throws Exception {
        Path file = InstrumentFileFixtures.cd("Temperature")
                .config("$MONOWL", "222.000")
                .config("$TEMPSP", "25.000")
                .columns("X", "CD_Signal", "CD_Error")
                .row(20.0, -10.0, 0.5)
                .row(30.0, -12.0, 0.5)
                .row(40.0, -15.0, 0.5)
                .write(tempDir.resolve("cd_temp.dat"));

        ProcessingResult result = dispatcher(ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.TEMPERATURE))
                .process(file, cdParameters());

        Channel sample = result.channels().get(0);
        assertFalse(sample.hasTrace(Trace.DILUTION_CORRECTED));
        assertEquals(-12.0 * 2200.0, sample.getTrace(Trace.MME)[1], 1e-6);
        assertTrue(result.headerLines().contains("Wavelength: 222.000"));
        assertTrue(result.headerLines().stream().noneMatch(l -> l.startsWith("Sample temperature:")));
        assertEquals("s_temp", result.table().getLabels().get(0));
    }

    @Test
    void atfTemperatureUsesPerChannelTemperatures() throws Exception {
        Path file = InstrumentFileFixtures.atf("Temperature")
                .config("$EXWL", "280.000")
                .config("$TEMPSP", "25.000")
                .config("$TEMPREFSP", "25.000")
                .columns("Sample_Temp", "Reference_Temp", "Samp._PMT_Raw_Sig.", "Ref._PMT_Raw_Sig.", "QC_Signal",
                        "PMT_Signal_(Dark)")
                .row(20.0, 21.0, 100.0, 50.0, 2.0, 10.0)
                .row(30.0, 31.0, 80.0, 45.0, 2.0, 10.0)
                .row(40.0, 41.0, 60.0, 40.0, 2.0, 10.0)
                .write(tempDir.resolve("atf_temp.dat"));
        ParameterBundle parameters = new ParameterBundle()
                .put(Parameters.SAMPLE, true)
                .put(Parameters.REFERENCE, true)
                .put(Parameters.QC_CORRECTION, true);

        ProcessingResult result = dispatcher(ExperimentDescriptor.of(InstrumentFamily.ATF, ExperimentFamily.TEMPERATURE))
                .process(file, parameters);

        Channel sample = result.channels().get(0);
        Channel reference = result.channels().get(1);
        assertArrayEquals(new double[] {20.0, 30.0, 40.0}, sample.getTrace(Trace.X), 1e-9);
        assertArrayEquals(new double[] {21.0, 31.0, 41.0}, reference.getTrace(Trace.X), 1e-9);
        assertArrayEquals(new double[] {20.0, 17.5, 15.0}, reference.getTrace(Trace.QC_CORRECTED), 1e-9);
        assertFalse(sample.hasTrace(Trace.DILUTION_CORRECTED));
        assertEquals(List.of("s_temp", "s_raw", "s_norm", "r_temp", "r_raw", "r_norm"), result.table().getLabels());
        assertTrue(result.headerLines().stream().noneMatch(
                l -> l.startsWith("Sample temperature:") || l.startsWith("Reference temperature:")));
    }

    @Test
    void arithmeticFailureNamesStageAndFile() throws Exception {
        Path file = InstrumentFileFixtures.cd("Temperature")
                .columns("X", "CD_Signal", "CD_Error")
                .row(20.0, -5.0, 0.5)
                .row(30.0, -5.0, 0.5)
                .write(tempDir.resolve("flat.dat"));
        ExperimentDispatcher dispatcher = dispatcher(ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.TEMPERATURE));

        ArithmeticException e = assertThrows(ArithmeticException.class, () -> dispatcher.process(file, cdParameters()));
        assertTrue(e.getMessage().startsWith("[" + PipelineState.CORRECTED.name() + "]"));
        assertTrue(e.getMessage().contains("flat.dat"));
        assertTrue(e.getCause() instanceof ArithmeticException);
        assertEquals(PipelineState.FAILED, dispatcher.getState());
    }
}
