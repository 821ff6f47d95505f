package de.anton.spectro.processor.spectro_processor.model;

import de.anton.spectro.processor.spectro_processor.InstrumentFileFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentFileReaderTest {

    @TempDir
    Path tempDir;

    private final InstrumentFileReader reader = new InstrumentFileReader();

    @Test
    void identifiesCdFile() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);

        InstrumentFile parsed = reader.read(file);

        assertEquals(InstrumentFamily.CD, parsed.getDescriptor().instrument());
        assertEquals("Titration", parsed.getDescriptor().experimentType());
        assertEquals(ExperimentFamily.TITRATION, parsed.getDescriptor().experimentFamily().orElseThrow());
    }

    @Test
    void identifiesAtfFile() throws Exception {
        Path file = InstrumentFileFixtures.atfTitration(tempDir);

        assertEquals(ExperimentDescriptor.of(InstrumentFamily.ATF, ExperimentFamily.TITRATION),
                reader.read(file).getDescriptor());
    }

    @Test
    void identificationIsStableAcrossReads() throws Exception {
        Path file = InstrumentFileFixtures.atfTitration(tempDir);

        assertEquals(reader.read(file).getDescriptor(), reader.read(file).getDescriptor());
    }

    @Test
    void unknownInstrumentIsRejected() throws IOException {
        Path file = tempDir.resolve("unknown.dat");
        Files.write(file, List.of("header", "Experiment type: Titration", "$CONFIG", "$MDCDA", "X", "1", "$ENDDA"),
                StandardCharsets.ISO_8859_1);

        FormatException e = assertThrows(FormatException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("not recognized"));
    }

    @Test
    void missingFileIsAFormatError() {
        Path file = tempDir.resolve("missing.dat");

        FormatException e = assertThrows(FormatException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("does not exist"));
    }

    @Test
    void mismatchWithSelectedProfileIsRejected() throws Exception {
        Path file = InstrumentFileFixtures.cdTitration(tempDir);

        assertThrows(FormatException.class,
                () -> reader.read(file, ExperimentDescriptor.of(InstrumentFamily.ATF, ExperimentFamily.TITRATION)));
        assertThrows(FormatException.class,
                () -> reader.read(file, ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.PH)));
        assertNotNull(reader.read(file, ExperimentDescriptor.of(InstrumentFamily.CD, ExperimentFamily.TITRATION)));
    }

    @Test
    void tagColumnIndexesFirstSixCharacters() throws Exception {
        InstrumentFile parsed = reader.read(InstrumentFileFixtures.cdTitration(tempDir));

        assertTrue(parsed.containsTag("$CDHV:"));
        assertTrue(parsed.containsTag("$MDCDA"));
        assertFalse(parsed.containsTag("$PMTHV"));
        assertEquals(-1, parsed.indexOfTag("$PMTHV"));
        assertTrue(parsed.indexOfTag("$MDCDA") < parsed.indexOfTag("$ENDDA"));
    }
}
