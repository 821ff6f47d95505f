package de.anton.spectro.processor.spectro_processor.profile;

import de.anton.spectro.processor.spectro_processor.InstrumentFileFixtures;
import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.ConfigurationException;
import de.anton.spectro.processor.spectro_processor.model.ExtractedData;
import de.anton.spectro.processor.spectro_processor.model.ExtractionPlan;
import de.anton.spectro.processor.spectro_processor.model.FormatException;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFile;
import de.anton.spectro.processor.spectro_processor.model.InstrumentFileReader;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.Series;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AtfInstrumentProfileTest {

    @TempDir
    Path tempDir;

    private final AtfInstrumentProfile profile = new AtfInstrumentProfile();
    private InstrumentFile file;

    @BeforeEach
    void setUp() throws Exception {
        file = new InstrumentFileReader().read(InstrumentFileFixtures.atfTitration(tempDir));
    }

    @Test
    void atLeastOneChannelMustBeRequested() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> profile.declareExtraction(new ExtractionPlan(), new ParameterBundle()));
        assertEquals(List.of(Parameters.SAMPLE, Parameters.REFERENCE), e.getParameterNames());
    }

    @Test
    void sampleOnlyDeclaresSampleColumns() throws Exception {
        ExtractionPlan plan = new ExtractionPlan();
        profile.declareExtraction(plan, new ParameterBundle().put(Parameters.SAMPLE, true));

        assertTrue(plan.getColumns().containsKey("Samp._PMT_Raw_Sig."));
        assertFalse(plan.getColumns().containsKey("Ref._PMT_Raw_Sig."));
        assertTrue(plan.hasConfigField("$TEMPSP"));
        assertFalse(plan.hasConfigField("$TEMPREFSP"));
    }

    @Test
    void buildsRequestedChannelsInOrder() throws Exception {
        Map<Series, double[]> series = new EnumMap<>(Series.class);
        series.put(Series.ALL_X, new double[] {0, 1, 2});
        series.put(Series.SAMPLE_Y, new double[] {100, 80, 60});
        series.put(Series.REFERENCE_Y, new double[] {50, 45, 40});
        ExtractedData data = new ExtractedData(file, List.of(), List.of(), series);

        List<Channel> channels = profile.buildChannels(data,
                new ParameterBundle().put(Parameters.SAMPLE, true).put(Parameters.REFERENCE, true));

        assertEquals(2, channels.size());
        assertEquals("sample", channels.get(0).getName());
        assertEquals("reference", channels.get(1).getName());
    }

    @Test
    void unusableChannelIsDropped() throws Exception {
        Map<Series, double[]> series = new EnumMap<>(Series.class);
        series.put(Series.ALL_X, new double[] {0, 1, 2});
        series.put(Series.SAMPLE_Y, new double[] {100, 80, 60});
        ExtractedData data = new ExtractedData(file, List.of(), List.of(), series);

        List<Channel> channels = profile.buildChannels(data,
                new ParameterBundle().put(Parameters.SAMPLE, true).put(Parameters.REFERENCE, true));

        assertEquals(1, channels.size());
        assertEquals("sample", channels.get(0).getName());
    }

    @Test
    void noUsableChannelIsAFormatError() {
        Map<Series, double[]> series = new EnumMap<>(Series.class);
        series.put(Series.ALL_X, new double[] {0, 1, 2});
        ExtractedData data = new ExtractedData(file, List.of(), List.of(), series);

        assertThrows(FormatException.class,
                () -> profile.buildChannels(data, new ParameterBundle().put(Parameters.SAMPLE, true)));
    }
}
